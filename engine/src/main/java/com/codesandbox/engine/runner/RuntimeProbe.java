package com.codesandbox.engine.runner;

import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.model.RunnerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Checks once, at startup, which external interpreters are installed.
 *
 * An interpreter counts as installed when {@code <binary> --version} starts
 * and exits with code 0 within a few seconds. Embedded languages run inside
 * the worker JVM and are always available.
 */
public class RuntimeProbe {

    private static final Logger log = LoggerFactory.getLogger(RuntimeProbe.class);

    private static final long PROBE_TIMEOUT_SECONDS = 10;

    public RuntimeAvailability probe(Map<Language, String> interpreters) {
        Set<Language> available = EnumSet.noneOf(Language.class);
        for (Language language : Language.values()) {
            if (language.kind() == RunnerKind.EMBEDDED) {
                available.add(language);
                continue;
            }
            String binary = interpreters.getOrDefault(language, language.defaultInterpreter());
            if (isInstalled(binary)) {
                log.info("{} runtime available ('{}')", language.displayName(), binary);
                available.add(language);
            } else {
                log.warn("{} runtime unavailable ('{}'); '{}' requests will be refused",
                        language.displayName(), binary, language.wireName());
            }
        }
        return new RuntimeAvailability(available);
    }

    public boolean isInstalled(String binary) {
        try {
            Process process = new ProcessBuilder(binary, "--version")
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("'{} --version' did not exit within {}s", binary, PROBE_TIMEOUT_SECONDS);
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            log.debug("Could not start '{}': {}", binary, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
