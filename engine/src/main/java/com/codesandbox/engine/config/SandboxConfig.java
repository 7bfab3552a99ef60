package com.codesandbox.engine.config;

import com.codesandbox.engine.admission.AdmissionController;
import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.runner.RuntimeAvailability;
import com.codesandbox.engine.runner.RuntimeProbe;
import com.codesandbox.engine.worker.ProcessWorkerLauncher;
import com.codesandbox.engine.worker.TimeoutSupervisor;
import com.codesandbox.engine.worker.WorkerPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the execution engine from {@code sandbox.*} properties.
 * Everything is read once at startup; changing a value needs a restart.
 */
@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    @Bean
    RuntimeProbe runtimeProbe() {
        return new RuntimeProbe();
    }

    @Bean
    RuntimeAvailability runtimeAvailability(RuntimeProbe probe,
                                            @Value("${sandbox.interpreters.python3}") String python3,
                                            @Value("${sandbox.interpreters.nodejs}") String nodejs) {
        return probe.probe(interpreters(python3, nodejs));
    }

    @Bean
    ProcessWorkerLauncher workerLauncher(@Value("${sandbox.worker.classpath}") String classpath,
                                         @Value("${sandbox.worker.jvm-options}") String jvmOptions,
                                         @Value("${sandbox.interpreters.python3}") String python3,
                                         @Value("${sandbox.interpreters.nodejs}") String nodejs,
                                         ObjectMapper objectMapper) {
        return new ProcessWorkerLauncher(classpath, splitOptions(jvmOptions),
                interpreters(python3, nodejs), objectMapper);
    }

    @Bean(destroyMethod = "close")
    TimeoutSupervisor timeoutSupervisor() {
        return new TimeoutSupervisor();
    }

    @Bean(destroyMethod = "close")
    WorkerPool workerPool(@Value("${sandbox.max-workers}") int maxWorkers,
                          @Value("${sandbox.max-requests}") int maxRequests,
                          @Value("${sandbox.worker-timeout}") long timeoutSeconds,
                          ProcessWorkerLauncher launcher,
                          TimeoutSupervisor supervisor,
                          RuntimeAvailability availability) {
        int size = PoolSizing.resolve(maxWorkers);
        log.info("Sandbox configuration: workers={} (configured {}), max-requests={}, timeout={}s, languages={}",
                size, maxWorkers, maxRequests, timeoutSeconds, availability.available());
        WorkerPool pool = new WorkerPool(size, launcher, supervisor);
        pool.start();
        return pool;
    }

    @Bean(destroyMethod = "close")
    AdmissionController admissionController(@Value("${sandbox.max-requests}") int maxRequests,
                                            WorkerPool pool,
                                            MeterRegistry meterRegistry) {
        return new AdmissionController(maxRequests, pool.size(), meterRegistry);
    }

    static Map<Language, String> interpreters(String python3, String nodejs) {
        Map<Language, String> interpreters = new EnumMap<>(Language.class);
        interpreters.put(Language.PYTHON3, python3);
        interpreters.put(Language.NODEJS, nodejs);
        return interpreters;
    }

    static List<String> splitOptions(String options) {
        if (options == null || options.isBlank()) {
            return List.of();
        }
        return Arrays.stream(options.trim().split("\\s+")).toList();
    }
}
