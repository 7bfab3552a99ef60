package com.codesandbox.engine.worker;

import com.codesandbox.engine.model.Language;
import com.codesandbox.engine.runner.RunnerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Forks worker JVMs running {@link WorkerMain}.
 *
 * Command line:
 * <pre>
 *   $JAVA_HOME/bin/java -Dsandbox.worker.slot=N [jvm options] -Dlogback.configurationFile=worker-logback.xml
 *       -Dsandbox.interpreter.&lt;tag&gt;=&lt;binary&gt; ... -cp &lt;classpath&gt; WorkerMain
 * </pre>
 * The worker's stderr is inherited, so its log lines and stack traces show
 * up in the service's own output. stdin/stdout stay piped for the protocol.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    // Classpath resource; keeps worker logging off stdout, which carries the protocol.
    static final String WORKER_LOGGING_CONFIG = "worker-logback.xml";
    static final String SLOT_PROPERTY         = "sandbox.worker.slot";

    private final List<String> command;
    private final ObjectMapper json;

    /**
     * @param classpath    classpath of the worker JVM; blank means this JVM's java.class.path
     * @param jvmOptions   extra JVM flags, e.g. heap limits
     * @param interpreters external interpreter overrides forwarded to the worker
     */
    public ProcessWorkerLauncher(String classpath, List<String> jvmOptions,
                                 Map<Language, String> interpreters, ObjectMapper json) {
        this.json    = json;
        this.command = buildCommand(classpath, jvmOptions, interpreters);
        log.info("Worker command: {}", String.join(" ", command));
    }

    @Override
    public Worker launch(int slotId) throws IOException {
        List<String> slotCommand = new ArrayList<>(command);
        slotCommand.add(1, "-D" + SLOT_PROPERTY + "=" + slotId);
        Process process = new ProcessBuilder(slotCommand)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        ProcessWorker worker = new ProcessWorker(slotId, process, json);
        log.info("Started {}", worker.describe());
        return worker;
    }

    List<String> command() {
        return command;
    }

    private static List<String> buildCommand(String classpath, List<String> jvmOptions,
                                             Map<Language, String> interpreters) {
        String javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String effectiveClasspath = (classpath == null || classpath.isBlank())
                ? System.getProperty("java.class.path")
                : classpath;

        List<String> cmd = new ArrayList<>();
        cmd.add(javaBin);
        cmd.addAll(jvmOptions);
        cmd.add("-Dlogback.configurationFile=" + WORKER_LOGGING_CONFIG);
        interpreters.forEach((language, binary) ->
                cmd.add("-D" + RunnerRegistry.interpreterProperty(language) + "=" + binary));
        cmd.add("-cp");
        cmd.add(effectiveClasspath);
        cmd.add(WorkerMain.class.getName());
        return List.copyOf(cmd);
    }
}
