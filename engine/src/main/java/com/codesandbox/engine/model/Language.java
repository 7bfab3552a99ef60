package com.codesandbox.engine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Languages the sandbox accepts, keyed by the tag clients send in
 * {@code language}.
 *
 * Adding a language means adding a constant here; the registry and the
 * coordinator pick it up by table lookup.
 */
public enum Language {

    JAVA   ("java",    "Java",     RunnerKind.EMBEDDED, null,      ".jsh"),
    PYTHON3("python3", "Python 3", RunnerKind.EXTERNAL, "python3", ".py"),
    NODEJS ("nodejs",  "Node.js",  RunnerKind.EXTERNAL, "node",    ".js");

    private final String     wireName;
    private final String     displayName;
    private final RunnerKind kind;
    private final String     defaultInterpreter;
    private final String     fileSuffix;

    Language(String wireName, String displayName, RunnerKind kind,
             String defaultInterpreter, String fileSuffix) {
        this.wireName           = wireName;
        this.displayName        = displayName;
        this.kind               = kind;
        this.defaultInterpreter = defaultInterpreter;
        this.fileSuffix         = fileSuffix;
    }

    public String     wireName()           { return wireName; }
    public String     displayName()        { return displayName; }
    public RunnerKind kind()               { return kind; }
    public String     fileSuffix()         { return fileSuffix; }

    /** Binary name looked up on PATH when no override is configured; null for embedded languages. */
    public String defaultInterpreter() { return defaultInterpreter; }

    /** Exact, case-sensitive match on the wire tag. */
    public static Optional<Language> fromWireName(String wireName) {
        if (wireName == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(l -> l.wireName.equals(wireName))
                .findFirst();
    }
}
