package dev.citadel.gateway.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class ProcessBackendConnectorTest {

    private final ProcessBackendConnector connector = new ProcessBackendConnector(Duration.ofMillis(500));

    @Test
    void missingCommandIsReported() {
        assertThatThrownBy(() -> connector.open(BackendDefinition.of("ghost", "/definitely/not/here")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void processExitingDuringStartupIsReportedWithStderr() {
        BackendDefinition crashing = BackendDefinition.of("crashing", "sh", "-c", "echo boom >&2; exit 3");

        assertThatThrownBy(() -> connector.open(crashing))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("status 3")
                .hasMessageContaining("boom");
    }

    @Test
    void framesTravelOverStdio() throws Exception {
        BackendDefinition echo = new BackendDefinition("echo", "sh", List.of("-c", "[ \"$GREETING\" = hi ] && cat"),
                Map.of("GREETING", "hi"), null);
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        CountDownLatch closed = new CountDownLatch(1);

        BackendTransport transport = connector.open(echo);
        transport.start(new BackendTransport.Listener() {
            @Override
            public void onFrame(String frame) {
                frames.add(frame);
            }

            @Override
            public void onClosed(Throwable cause) {
                closed.countDown();
            }
        });
        transport.send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");

        assertThat(frames.poll(5, TimeUnit.SECONDS)).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");
        assertThat(transport.describe()).startsWith("echo (pid ");

        transport.close();
        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThatThrownBy(() -> transport.send("{}")).isInstanceOf(IOException.class);
    }
}
