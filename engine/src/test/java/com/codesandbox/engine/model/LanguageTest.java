package com.codesandbox.engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageTest {

    @Test
    void fromWireName_isExactAndCaseSensitive() {
        assertThat(Language.fromWireName("python3")).contains(Language.PYTHON3);
        assertThat(Language.fromWireName("PYTHON3")).isEmpty();
        assertThat(Language.fromWireName(" java")).isEmpty();
        assertThat(Language.fromWireName(null)).isEmpty();
    }

    @Test
    void externalLanguages_haveDefaultInterpreters() {
        assertThat(Language.PYTHON3.defaultInterpreter()).isEqualTo("python3");
        assertThat(Language.NODEJS.defaultInterpreter()).isEqualTo("node");
        assertThat(Language.JAVA.kind()).isEqualTo(RunnerKind.EMBEDDED);
    }
}
