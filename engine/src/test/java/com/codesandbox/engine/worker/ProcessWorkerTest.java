package com.codesandbox.engine.worker;

import com.codesandbox.engine.model.FailureKind;
import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.worker.dto.WorkerRequest;
import com.codesandbox.engine.worker.dto.WorkerResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Forks a real worker JVM from the test classpath and talks to it over pipes.
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class ProcessWorkerTest {

    ProcessWorkerLauncher launcher = new ProcessWorkerLauncher(
            "", List.of("-Xmx128m"), Map.of(Language.NODEJS, "/opt/node/bin/node"), new ObjectMapper());

    static final String LEAKING_THREAD = """
            new Thread(() -> {
                while (true) {
                    System.out.print("LEAK");
                    try { Thread.sleep(20); } catch (InterruptedException e) { return; }
                }
            }).start();
            """;

    Worker worker;

    @BeforeEach
    void setUp() throws Exception {
        worker = launcher.launch(0);
    }

    @AfterEach
    void tearDown() {
        worker.terminate();
    }

    @Test
    void command_forwardsOptionsAndInterpreters() {
        assertThat(launcher.command())
                .contains("-Xmx128m",
                        "-Dsandbox.interpreter.nodejs=/opt/node/bin/node",
                        "-Dlogback.configurationFile=worker-logback.xml")
                .endsWith(WorkerMain.class.getName());
    }

    @Test
    void handle_javaSnippet_roundTrip() {
        WorkerResponse response = worker.handle(new WorkerRequest("r1", "java", "System.out.println(\"hi\");"));

        assertThat(response.id()).isEqualTo("r1");
        assertThat(response.success()).isTrue();
        assertThat(response.stdout()).isEqualTo("hi\n");
        assertThat(worker.isHealthy()).isTrue();
    }

    @Test
    void handle_servesConsecutiveRequests() {
        worker.handle(new WorkerRequest("r1", "java", "int x = 1;"));
        WorkerResponse second = worker.handle(new WorkerRequest("r2", "java", "System.out.print(x);"));

        assertThat(second.id()).isEqualTo("r2");
        assertThat(second.success()).isFalse();
        assertThat(second.failure()).isEqualTo(FailureKind.CODE_ERROR);
    }

    @Test
    void handle_unknownLanguage_answeredByWorker() {
        WorkerResponse response = worker.handle(new WorkerRequest("r1", "cobol", ""));

        assertThat(response.failure()).isEqualTo(FailureKind.UNSUPPORTED_LANGUAGE);
    }

    @Test
    void handle_snippetKillsProcess_throwsCrashedWithExitCode() {
        WorkerRequest request = new WorkerRequest("r1", "java", "Runtime.getRuntime().halt(3);");

        assertThatThrownBy(() -> worker.handle(request))
                .isInstanceOf(WorkerException.class)
                .hasMessageContaining("exit code 3")
                .satisfies(e -> assertThat(((WorkerException) e).getKind()).isEqualTo(WorkerException.Kind.CRASHED));
        assertThat(worker.isHealthy()).isFalse();
    }

    @Test
    void handle_snippetLeavesThreadRunning_retiresWorker() throws Exception {
        WorkerResponse response = worker.handle(new WorkerRequest("r1", "java", LEAKING_THREAD));

        assertThat(response.success()).isTrue();
        assertThat(response.retire()).isTrue();
        assertThat(worker.isHealthy()).isFalse();
        ((ProcessWorker) worker).processHandle().onExit().get(5, TimeUnit.SECONDS);
    }

    @Test
    void terminate_isIdempotent() {
        worker.terminate();
        worker.terminate();

        assertThat(worker.isHealthy()).isFalse();
    }
}
