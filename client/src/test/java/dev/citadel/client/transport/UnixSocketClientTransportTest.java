package dev.citadel.client.transport;

import static org.assertj.core.api.Assertions.assertThat;

import dev.citadel.client.ServerNameInjector;
import dev.citadel.client.StdioBridge;
import dev.citadel.transport.NewlineDelimitedCodec;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UnixSocketClientTransportTest {

    @TempDir
    Path dir;

    @Test
    void bridgeInjectsServerAndRelaysReplies() throws Exception {
        Path socket = dir.resolve("gw.sock");
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            server.bind(UnixDomainSocketAddress.of(socket));

            // Fake gateway: answer one request, then hang up.
            CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
                try (SocketChannel peer = server.accept()) {
                    InputStream in = new BufferedInputStream(Channels.newInputStream(peer));
                    String frame = NewlineDelimitedCodec.readFrame(in);
                    peer.write(ByteBuffer.wrap(NewlineDelimitedCodec.frameBytes("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}")));
                    return frame;
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });

            ByteArrayOutputStream stdout = new ByteArrayOutputStream();
            // stdin stays open so the bridge ends when the gateway disconnects
            InputStream stdin = new BlockingAfter("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}\n");
            try (UnixSocketClientTransport transport = new UnixSocketClientTransport(socket)) {
                transport.connect();
                new StdioBridge(transport, new ServerNameInjector("github")).run(stdin, stdout);
            }

            assertThat(received.get(5, TimeUnit.SECONDS)).contains("\"server\":\"github\"");
            assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}\n");
        }
    }

    /**
     * Serves the given text, then blocks like an idle terminal.
     */
    private static final class BlockingAfter extends InputStream {

        private final ByteArrayInputStream head;

        BlockingAfter(String text) {
            this.head = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public int read() {
            int b = head.read();
            if (b != -1) {
                return b;
            }
            block();
            return -1;
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (head.available() > 0) {
                return head.read(b, off, len);
            }
            block();
            return -1;
        }

        private static void block() {
            try {
                Thread.sleep(Long.MAX_VALUE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
