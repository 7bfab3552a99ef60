package com.codesandbox.engine.runner;

import com.codesandbox.engine.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Table from language tag to the runner that executes it.
 *
 * Lives inside each worker process. The parent service passes interpreter
 * overrides to the worker as {@code -Dsandbox.interpreter.<tag>=<binary>}
 * system properties, which {@link #fromSystemProperties()} reads back.
 */
public class RunnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunnerRegistry.class);

    private static final String INTERPRETER_PROPERTY_PREFIX = "sandbox.interpreter.";

    private final Map<Language, LanguageRunner> runners;

    public RunnerRegistry(Map<Language, LanguageRunner> runners) {
        this.runners = new EnumMap<>(Language.class);
        this.runners.putAll(runners);
    }

    /** One runner per language; external languages use the given binary or their default. */
    public static RunnerRegistry withInterpreters(Map<Language, String> interpreters) {
        Map<Language, LanguageRunner> table = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            LanguageRunner runner = switch (language.kind()) {
                case EMBEDDED -> new EmbeddedJavaRunner();
                case EXTERNAL -> new ExternalProcessRunner(language,
                        interpreters.getOrDefault(language, language.defaultInterpreter()));
            };
            table.put(language, runner);
        }
        return new RunnerRegistry(table);
    }

    public static RunnerRegistry fromSystemProperties() {
        Map<Language, String> interpreters = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            String binary = System.getProperty(interpreterProperty(language));
            if (binary != null && !binary.isBlank()) {
                interpreters.put(language, binary);
                log.debug("Using '{}' for {}", binary, language.displayName());
            }
        }
        return withInterpreters(interpreters);
    }

    /** System property a worker reads its interpreter override for {@code language} from. */
    public static String interpreterProperty(Language language) {
        return INTERPRETER_PROPERTY_PREFIX + language.wireName();
    }

    public Optional<LanguageRunner> find(String wireName) {
        return Language.fromWireName(wireName).map(runners::get);
    }
}
