package dev.citadel.client;

import dev.citadel.client.transport.UnixSocketClientTransport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Main {

    static final String DEFAULT_SOCKET = "/tmp/mcp-citadel.sock";
    static final String SOCKET_ENV = "MCP_CITADEL_SOCKET";

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        Path socket;
        try {
            socket = socketPath(arguments, System.getenv(SOCKET_ENV));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }
        if (arguments.size() != 1 || arguments.get(0).startsWith("-")) {
            printUsage();
            System.exit(1);
            return;
        }
        String server = arguments.get(0);

        try (UnixSocketClientTransport transport = new UnixSocketClientTransport(socket)) {
            transport.connect();
            new StdioBridge(transport, new ServerNameInjector(server)).run(System.in, System.out);
        } catch (IOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Remove {@code --socket <path>} from the arguments, falling back to the environment and
     * then to the default path.
     */
    static Path socketPath(List<String> arguments, String fromEnvironment) {
        int index = arguments.indexOf("--socket");
        if (index >= 0) {
            if (index + 1 >= arguments.size()) {
                throw new IllegalArgumentException("--socket requires a path");
            }
            String value = arguments.remove(index + 1);
            arguments.remove(index);
            return Path.of(value);
        }
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return Path.of(fromEnvironment);
        }
        return Path.of(DEFAULT_SOCKET);
    }

    private static void printUsage() {
        System.err.println("Usage: mcp-client <server-name> [--socket <path>]\n" +
            "Example: mcp-client github\n" +
            "The socket defaults to $" + SOCKET_ENV + " or " + DEFAULT_SOCKET);
    }
}
