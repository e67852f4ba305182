package dev.citadel.client.transport;

import dev.citadel.transport.NewlineDelimitedCodec;
import dev.citadel.transport.Wire;
import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newline-delimited connection to the gateway's Unix socket. Inbound and outbound frames are
 * pumped by separate threads.
 */
public class UnixSocketClientTransport implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnixSocketClientTransport.class);

    private final Path socketPath;

    private SocketChannel channel;
    private volatile boolean running;

    public UnixSocketClientTransport(Path socketPath) {
        this.socketPath = socketPath;
    }

    public void connect() throws IOException {
        channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            channel.close();
            throw new IOException("Failed to connect to the gateway at " + socketPath + ". Is it running?", e);
        }
        running = true;
        LOGGER.info("Connected to {}", socketPath);
    }

    /**
     * Copy gateway frames to {@code out} until the gateway disconnects.
     */
    public void pumpInbound(OutputStream out) throws IOException {
        InputStream in = new BufferedInputStream(Channels.newInputStream(channel));
        String frame;
        while ((frame = NewlineDelimitedCodec.readFrame(in)) != null) {
            Wire.rx(socketPath.toString(), frame);
            NewlineDelimitedCodec.writeFrame(out, frame);
        }
        LOGGER.info("Gateway closed the connection");
    }

    /**
     * Copy client frames from {@code in} to the gateway, rewriting each one first, until
     * {@code in} ends.
     */
    public void pumpOutbound(InputStream in, UnaryOperator<String> rewrite) throws IOException {
        InputStream buffered = new BufferedInputStream(in);
        String frame;
        while ((frame = NewlineDelimitedCodec.readFrame(buffered)) != null) {
            send(rewrite.apply(frame));
        }
        LOGGER.info("Client input ended");
    }

    public synchronized void send(String frame) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(NewlineDelimitedCodec.frameBytes(frame));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        Wire.tx(socketPath.toString(), frame);
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
    }
}
