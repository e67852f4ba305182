package dev.citadel.gateway.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Unix domain socket listener settings.
 */
@ConfigurationProperties(prefix = "gateway.unix-socket")
public class UnixSocketProperties {

	private boolean enabled = true;

	/**
	 * Socket file. A stale file left by a previous run is removed at start.
	 */
	private Path path = Path.of("/tmp/mcp-citadel.sock");

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public Path getPath() {
		return path;
	}

	public void setPath(Path path) {
		this.path = path;
	}

}
