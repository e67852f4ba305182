package dev.citadel.gateway.backend;

import dev.citadel.transport.NewlineDelimitedCodec;
import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches the configured command and speaks newline-delimited JSON-RPC over its stdin and
 * stdout. Standard error is drained into the log. Crashed processes are not restarted here;
 * the registry reconnects on the next request.
 */
public class ProcessBackendConnector implements BackendConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessBackendConnector.class);

    private final Duration startupGrace;

    public ProcessBackendConnector(Duration startupGrace) {
        this.startupGrace = startupGrace;
    }

    @Override
    public BackendTransport open(BackendDefinition definition) throws IOException {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(definition.command());
        commandLine.addAll(definition.args());
        ProcessBuilder builder = new ProcessBuilder(commandLine);
        builder.environment().putAll(definition.env());
        if (definition.workingDirectory() != null) {
            builder.directory(definition.workingDirectory().toFile());
        }
        LOGGER.info("Starting backend {}: {}", definition.name(), commandLine);
        Process process = builder.start();
        if (!startupGrace.isZero()) {
            try {
                if (process.waitFor(startupGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    String stderr = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8).trim();
                    throw new IOException("Backend " + definition.name() + " exited immediately with status "
                            + process.exitValue() + (stderr.isEmpty() ? "" : ": " + stderr));
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while starting backend " + definition.name(), e);
            }
        }
        LOGGER.info("Started backend {} (pid {})", definition.name(), process.pid());
        return new ProcessBackendTransport(definition.name(), process);
    }

    static final class ProcessBackendTransport implements BackendTransport {

        private final String name;
        private final Process process;
        private final OutputStream stdin;
        private final AtomicBoolean closed = new AtomicBoolean();

        ProcessBackendTransport(String name, Process process) {
            this.name = name;
            this.process = process;
            this.stdin = process.getOutputStream();
        }

        @Override
        public void start(Listener listener) {
            Thread reader = new Thread(() -> readLoop(listener), "backend-reader-" + name);
            reader.setDaemon(true);
            reader.start();
            Thread stderr = new Thread(this::drainStderr, "backend-stderr-" + name);
            stderr.setDaemon(true);
            stderr.start();
        }

        private void readLoop(Listener listener) {
            Throwable failure = null;
            try (InputStream in = new BufferedInputStream(process.getInputStream())) {
                String frame;
                while ((frame = NewlineDelimitedCodec.readFrame(in)) != null) {
                    listener.onFrame(frame);
                }
            } catch (IOException e) {
                if (!closed.get()) {
                    failure = e;
                }
            } finally {
                listener.onClosed(failure);
            }
        }

        private void drainStderr() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    LOGGER.info("[{}] {}", name, line);
                }
            } catch (IOException e) {
                LOGGER.debug("Stopped reading stderr of backend {}", name, e);
            }
        }

        @Override
        public void send(String frame) throws IOException {
            if (closed.get()) {
                throw new IOException("Backend " + name + " transport is closed");
            }
            NewlineDelimitedCodec.writeFrame(stdin, frame);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                stdin.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing stdin of backend {}", name, e);
            }
            process.destroy();
            try {
                if (!process.waitFor(1, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
            LOGGER.info("Stopped backend {}", name);
        }

        @Override
        public String describe() {
            return name + " (pid " + process.pid() + ")";
        }
    }
}
