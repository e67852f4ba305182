package dev.citadel.client;

import dev.citadel.client.transport.UnixSocketClientTransport;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins a stdio MCP client to one gateway connection. Runs until either side hangs up.
 */
public class StdioBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(StdioBridge.class);

    private final UnixSocketClientTransport transport;
    private final ServerNameInjector injector;

    public StdioBridge(UnixSocketClientTransport transport, ServerNameInjector injector) {
        this.transport = transport;
        this.injector = injector;
    }

    public void run(InputStream stdin, OutputStream stdout) throws IOException, InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<IOException> failure = new AtomicReference<>();
        Thread inbound = pump("bridge-inbound", () -> transport.pumpInbound(stdout), done, failure);
        Thread outbound = pump("bridge-outbound", () -> transport.pumpOutbound(stdin, injector::inject), done,
                failure);
        inbound.start();
        outbound.start();
        done.await();
        transport.close();
        if (failure.get() != null) {
            throw failure.get();
        }
    }

    private Thread pump(String name, IoTask task, CountDownLatch done, AtomicReference<IOException> failure) {
        Thread thread = new Thread(() -> {
            try {
                task.run();
            } catch (IOException e) {
                if (transport.isRunning()) {
                    LOGGER.warn("{} failed: {}", name, e.getMessage());
                    failure.compareAndSet(null, e);
                }
            } finally {
                done.countDown();
            }
        }, name);
        thread.setDaemon(true);
        return thread;
    }

    @FunctionalInterface
    private interface IoTask {

        void run() throws IOException;
    }
}
