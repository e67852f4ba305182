package dev.citadel.gateway.transport;

import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.TransportKind;
import dev.citadel.transport.EnvelopeCodec;
import dev.citadel.transport.NewlineDelimitedCodec;
import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts newline-delimited JSON-RPC clients on a Unix domain socket. Each accepted channel
 * gets a reader thread and a {@link StreamConnection}; its writes drain on the same pool.
 */
public class UnixSocketServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnixSocketServer.class);

    private final Path socketPath;
    private final Router router;
    private final SessionManager sessions;
    private final EnvelopeCodec codec;
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private final ExecutorService clientExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "uds-client");
        t.setDaemon(true);
        return t;
    });
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocketChannel serverChannel;
    private Thread acceptThread;
    private volatile boolean running;

    public UnixSocketServer(Path socketPath, Router router, SessionManager sessions, EnvelopeCodec codec) {
        this.socketPath = socketPath;
        this.router = router;
        this.sessions = sessions;
        this.codec = codec;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        if (Files.deleteIfExists(socketPath)) {
            LOGGER.info("Removed stale socket {}", socketPath);
        }
        if (socketPath.getParent() != null) {
            Files.createDirectories(socketPath.getParent());
        }
        serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        serverChannel.bind(UnixDomainSocketAddress.of(socketPath));
        try {
            Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            LOGGER.warn("Cannot restrict permissions of {} on this file system", socketPath);
        }
        running = true;
        acceptThread = new Thread(this::acceptLoop, "uds-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("Unix socket server listening on {}", socketPath);
    }

    private void acceptLoop() {
        while (running) {
            try {
                SocketChannel channel = serverChannel.accept();
                ClientConnection connection = new ClientConnection(channel,
                        "uds-" + connectionCounter.incrementAndGet());
                connections.add(connection);
                clientExecutor.execute(connection::run);
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Client executor rejected connection");
            }
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverChannel.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing server socket", e);
        }
        try {
            acceptThread.join(Duration.ofSeconds(1).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (ClientConnection connection : new ArrayList<>(connections)) {
            connection.close();
        }
        clientExecutor.shutdown();
        try {
            if (!clientExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                clientExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            LOGGER.warn("Could not remove socket file {}", socketPath, e);
        }
        LOGGER.info("Unix socket server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public Path socketPath() {
        return socketPath;
    }

    public int connectionCount() {
        return connections.size();
    }

    private final class ClientConnection implements Closeable, FrameSink {

        private final SocketChannel channel;
        private final StreamConnection stream;

        ClientConnection(SocketChannel channel, String connectionId) {
            this.channel = channel;
            this.stream = new StreamConnection(connectionId, TransportKind.UNIX_SOCKET, router, sessions, codec,
                    this, clientExecutor);
            LOGGER.info("Accepted connection {}", connectionId);
        }

        void run() {
            try (InputStream in = new BufferedInputStream(Channels.newInputStream(channel))) {
                String frame;
                while ((frame = NewlineDelimitedCodec.readFrame(in)) != null) {
                    stream.onFrame(frame);
                }
            } catch (IOException e) {
                if (running && channel.isOpen()) {
                    LOGGER.warn("Connection {} failed: {}", stream.connectionId(), e.getMessage());
                }
            } finally {
                close();
            }
        }

        // Writes go straight to the channel; the input stream holds the channel's blocking lock while reading.
        @Override
        public void send(String frame) throws IOException {
            ByteBuffer buffer = ByteBuffer.wrap(NewlineDelimitedCodec.frameBytes(frame));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }

        @Override
        public void close() {
            connections.remove(this);
            try {
                channel.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing connection {}", stream.connectionId(), e);
            }
            stream.onClosed();
        }
    }
}
