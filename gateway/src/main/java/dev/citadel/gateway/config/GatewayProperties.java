package dev.citadel.gateway.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;

import dev.citadel.gateway.backend.BackendDefinition;
import dev.citadel.gateway.routing.Router.NotificationPolicy;

/**
 * Core gateway settings: supported protocol versions, session lifetime, backend timeouts and
 * the table of named backend servers.
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

	/**
	 * Protocol versions accepted in {@code initialize}. The first entry is also the version the
	 * gateway announces in its own backend handshakes.
	 */
	private List<String> supportedProtocolVersions = new ArrayList<>(
			List.of("2025-06-18", "2025-03-26", "2024-11-05"));

	private final Session session = new Session();

	private final Backend backend = new Backend();

	/**
	 * Backend servers by name. The name is what clients put in {@code params.server}.
	 */
	private Map<String, Server> servers = new LinkedHashMap<>();

	public List<String> getSupportedProtocolVersions() {
		return supportedProtocolVersions;
	}

	public void setSupportedProtocolVersions(List<String> supportedProtocolVersions) {
		this.supportedProtocolVersions = supportedProtocolVersions;
	}

	public Session getSession() {
		return session;
	}

	public Backend getBackend() {
		return backend;
	}

	public Map<String, Server> getServers() {
		return servers;
	}

	public void setServers(Map<String, Server> servers) {
		this.servers = servers;
	}

	/**
	 * Convert the configured servers into backend definitions.
	 * @return definitions keyed by server name, in configuration order
	 */
	public Map<String, BackendDefinition> backendDefinitions() {
		Map<String, BackendDefinition> definitions = new LinkedHashMap<>();
		this.servers.forEach((name, server) -> {
			if (server.getCommand() == null || server.getCommand().isBlank()) {
				throw new IllegalStateException("gateway.servers." + name + ".command must be set");
			}
			definitions.put(name, new BackendDefinition(name, server.getCommand(), server.getArgs(),
					server.getEnv(), server.getWorkingDirectory()));
		});
		return definitions;
	}

	/**
	 * Session lifetime settings.
	 */
	public static class Session {

		/**
		 * Sessions idle for longer than this are closed by the sweeper.
		 */
		private Duration idleTimeout = Duration.ofHours(1);

		/**
		 * How often the sweeper looks for idle sessions.
		 */
		private Duration sweepInterval = Duration.ofSeconds(60);

		public Duration getIdleTimeout() {
			return idleTimeout;
		}

		public void setIdleTimeout(Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
		}

		public Duration getSweepInterval() {
			return sweepInterval;
		}

		public void setSweepInterval(Duration sweepInterval) {
			this.sweepInterval = sweepInterval;
		}

	}

	/**
	 * Settings shared by every backend connection.
	 */
	public static class Backend {

		/**
		 * Upper bound for the gateway's own initialize exchange with a backend.
		 */
		private Duration handshakeTimeout = Duration.ofSeconds(30);

		/**
		 * Upper bound for a single forwarded call. Only the timed-out call fails.
		 */
		private Duration callTimeout = Duration.ofSeconds(60);

		/**
		 * Time a freshly launched backend process must survive before it is considered started.
		 */
		private Duration startupGrace = Duration.ofMillis(100);

		/**
		 * What to do with notifications a backend sends on its shared connection.
		 */
		private NotificationPolicy notificationPolicy = NotificationPolicy.BROADCAST;

		/**
		 * {@code clientInfo.name} the gateway announces to backends.
		 */
		private String clientName = "mcp-citadel";

		/**
		 * {@code clientInfo.version} the gateway announces to backends.
		 */
		private String clientVersion = "0.4.0";

		public Duration getHandshakeTimeout() {
			return handshakeTimeout;
		}

		public void setHandshakeTimeout(Duration handshakeTimeout) {
			this.handshakeTimeout = handshakeTimeout;
		}

		public Duration getCallTimeout() {
			return callTimeout;
		}

		public void setCallTimeout(Duration callTimeout) {
			this.callTimeout = callTimeout;
		}

		public Duration getStartupGrace() {
			return startupGrace;
		}

		public void setStartupGrace(Duration startupGrace) {
			this.startupGrace = startupGrace;
		}

		public NotificationPolicy getNotificationPolicy() {
			return notificationPolicy;
		}

		public void setNotificationPolicy(NotificationPolicy notificationPolicy) {
			this.notificationPolicy = Objects.requireNonNullElse(notificationPolicy, NotificationPolicy.BROADCAST);
		}

		public String getClientName() {
			return clientName;
		}

		public void setClientName(String clientName) {
			this.clientName = clientName;
		}

		public String getClientVersion() {
			return clientVersion;
		}

		public void setClientVersion(String clientVersion) {
			this.clientVersion = clientVersion;
		}

	}

	/**
	 * One backend server launched as a child process speaking JSON-RPC over stdio.
	 */
	public static class Server {

		private String command;

		private List<String> args = new ArrayList<>();

		/**
		 * Extra environment variables, merged over the gateway's own environment.
		 */
		private Map<String, String> env = new LinkedHashMap<>();

		@Nullable
		private Path workingDirectory;

		public String getCommand() {
			return command;
		}

		public void setCommand(String command) {
			this.command = command;
		}

		public List<String> getArgs() {
			return args;
		}

		public void setArgs(List<String> args) {
			this.args = args;
		}

		public Map<String, String> getEnv() {
			return env;
		}

		public void setEnv(Map<String, String> env) {
			this.env = env;
		}

		@Nullable
		public Path getWorkingDirectory() {
			return workingDirectory;
		}

		public void setWorkingDirectory(@Nullable Path workingDirectory) {
			this.workingDirectory = workingDirectory;
		}

	}

}
