package dev.citadel.gateway.backend;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Hands out {@link FakeBackendTransport}s and records every open.
 */
public class FakeConnector implements BackendConnector {

    private final List<FakeBackendTransport> opened = new CopyOnWriteArrayList<>();

    private volatile boolean autoReply = true;
    private volatile boolean rejectInitialize;
    private volatile IOException failure;
    private volatile CountDownLatch gate;

    @Override
    public BackendTransport open(BackendDefinition definition) throws IOException {
        CountDownLatch latch = gate;
        if (latch != null) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        if (failure != null) {
            opened.add(null);
            throw failure;
        }
        FakeBackendTransport transport = new FakeBackendTransport(autoReply);
        transport.setRejectInitialize(rejectInitialize);
        opened.add(transport);
        return transport;
    }

    public int opens() {
        return opened.size();
    }

    public FakeBackendTransport last() {
        return opened.get(opened.size() - 1);
    }

    public void setAutoReply(boolean autoReply) {
        this.autoReply = autoReply;
    }

    public void setRejectInitialize(boolean rejectInitialize) {
        this.rejectInitialize = rejectInitialize;
    }

    public void failWith(IOException failure) {
        this.failure = failure;
    }

    /**
     * Block every open until {@link CountDownLatch#countDown()} is called on the returned latch.
     */
    public CountDownLatch hold() {
        CountDownLatch latch = new CountDownLatch(1);
        gate = latch;
        return latch;
    }
}
