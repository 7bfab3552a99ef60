package com.codesandbox.engine.runner;

import com.codesandbox.engine.model.Language;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which languages can actually run on this host, as decided once at startup.
 */
public record RuntimeAvailability(Set<Language> available) {

    public RuntimeAvailability {
        available = Collections.unmodifiableSet(
                available.isEmpty() ? EnumSet.noneOf(Language.class) : EnumSet.copyOf(available));
    }

    public static RuntimeAvailability all() {
        return new RuntimeAvailability(EnumSet.allOf(Language.class));
    }

    public boolean isAvailable(Language language) {
        return available.contains(language);
    }
}
