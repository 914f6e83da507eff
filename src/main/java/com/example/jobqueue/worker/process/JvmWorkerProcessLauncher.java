package com.example.jobqueue.worker.process;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches {@link WorkerProcessMain} in a new JVM with this JVM's class path.
 * The child's stderr is inherited so its logs show up with the parent's.
 */
@Slf4j
public class JvmWorkerProcessLauncher implements WorkerProcessLauncher {

    private final List<String> command;

    public JvmWorkerProcessLauncher() {
        var java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        this.command = List.of(java,
                "-cp", System.getProperty("java.class.path"),
                "-Dlogback.configurationFile=logback-worker.xml",
                WorkerProcessMain.class.getName());
    }

    @Override
    public WorkerProcess launch(int slot) throws IOException {
        var process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        log.info("Started worker process {} for slot {}", process.pid(), slot);
        return new ChildProcess(process);
    }

    private static final class ChildProcess implements WorkerProcess {

        private final Process process;
        private final BufferedWriter writer;
        private final BufferedReader reader;

        private ChildProcess(Process process) {
            this.process = process;
            this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            this.reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public void send(String line) throws IOException {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }

        @Override
        public String receive() throws IOException {
            return reader.readLine();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void shutdown(Duration timeout) {
            try {
                writer.close();
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker process {} did not exit within {}, killing it", process.pid(), timeout);
                    process.destroyForcibly();
                }
            } catch (IOException e) {
                log.debug("Worker process {} input already closed: {}", process.pid(), e.getMessage());
                process.destroyForcibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        @Override
        public void destroy() {
            process.destroyForcibly();
        }
    }
}
