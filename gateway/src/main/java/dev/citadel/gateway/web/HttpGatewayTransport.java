package dev.citadel.gateway.web;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import dev.citadel.gateway.backend.BackendConnection;
import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayErrors;
import dev.citadel.gateway.error.GatewayException;
import dev.citadel.gateway.routing.MethodKind;
import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.Session;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.TransportKind;
import dev.citadel.transport.DecodeException;
import dev.citadel.transport.Envelope;
import dev.citadel.transport.EnvelopeCodec;
import dev.citadel.transport.Wire;

/**
 * One-shot HTTP transport. Every POST carries one JSON-RPC message and the session is
 * correlated through the {@value #SESSION_ID_HEADER} header issued by {@code initialize}.
 * HTTP sessions have no push channel, so backend notifications never reach them.
 */
public class HttpGatewayTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpGatewayTransport.class);

	public static final String SESSION_ID_HEADER = "Mcp-Session-Id";

	public static final String PROTOCOL_VERSION_HEADER = "MCP-Protocol-Version";

	private final String endpoint;

	private final boolean disallowDelete;

	private final Set<String> allowedOrigins;

	private final Router router;

	private final SessionManager sessions;

	private final BackendRegistry backends;

	private final EnvelopeCodec codec;

	private final Duration responseTimeout;

	public HttpGatewayTransport(String endpoint, boolean disallowDelete, Iterable<String> allowedOrigins,
			Router router, SessionManager sessions, BackendRegistry backends, EnvelopeCodec codec,
			Duration responseTimeout) {
		this.endpoint = endpoint;
		this.disallowDelete = disallowDelete;
		this.allowedOrigins = new LinkedHashSet<>();
		allowedOrigins.forEach(origin -> this.allowedOrigins.add(origin.toLowerCase(Locale.ROOT)));
		this.router = router;
		this.sessions = sessions;
		this.backends = backends;
		this.codec = codec;
		this.responseTimeout = responseTimeout;
		logger.info("HTTP transport on endpoint {}", endpoint);
	}

	public String getEndpoint() {
		return this.endpoint;
	}

	public RouterFunction<ServerResponse> getRouterFunction() {
		return RouterFunctions.route()
			.GET(this.endpoint, this::handleGet)
			.POST(this.endpoint, this::handlePost)
			.DELETE(this.endpoint, this::handleDelete)
			.build();
	}

	private ServerResponse handleGet(ServerRequest request) {
		if (!originAllowed(request)) {
			return forbidden();
		}
		ObjectNode status = this.codec.mapper().createObjectNode();
		status.put("status", "ok");
		status.put("sessions", this.sessions.size());
		ArrayNode servers = status.putArray("backends");
		for (String name : this.backends.serverNames()) {
			ObjectNode server = servers.addObject();
			server.put("name", name);
			BackendConnection connection = this.backends.live(name).orElse(null);
			server.put("connected", connection != null);
			server.put("boundSessions", this.sessions.sessionsBoundTo(name).size());
			if (connection != null) {
				server.put("pendingCalls", connection.pendingCount());
			}
		}
		return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(status);
	}

	private ServerResponse handlePost(ServerRequest request) throws IOException {
		if (!originAllowed(request)) {
			return forbidden();
		}
		String versionHeader = request.headers().firstHeader(PROTOCOL_VERSION_HEADER);
		if (versionHeader != null && !this.sessions.isSupported(versionHeader)) {
			return error(null, new GatewayException(GatewayErrorKind.UNSUPPORTED_PROTOCOL_VERSION,
					"Unsupported " + PROTOCOL_VERSION_HEADER + ": " + versionHeader), null);
		}
		byte[] body = request.servletRequest().getInputStream().readAllBytes();
		String connectionId = "http-" + request.servletRequest().getRemoteAddr();
		Envelope envelope;
		try {
			envelope = this.codec.decode(body);
		}
		catch (DecodeException ex) {
			return error(ex.id(), GatewayErrors.fromDecode(ex), null);
		}
		Wire.rx(connectionId, new String(body, StandardCharsets.UTF_8));

		if (envelope instanceof Envelope.Request initialize
				&& MethodKind.of(initialize.method()) == MethodKind.INITIALIZE) {
			return handleInitialize(initialize);
		}

		JsonNode id = (envelope instanceof Envelope.Request withId) ? withId.id() : null;
		String sessionId = request.headers().firstHeader(SESSION_ID_HEADER);
		if (sessionId == null || sessionId.isBlank()) {
			return error(id, new GatewayException(GatewayErrorKind.MISSING_SESSION_ID,
					"Missing " + SESSION_ID_HEADER + " header"), null);
		}
		Session session;
		try {
			session = this.sessions.lookup(sessionId);
		}
		catch (GatewayException ex) {
			return error(id, ex, null);
		}

		if (envelope instanceof Envelope.Request call) {
			try {
				Envelope.Response response = await(this.router.dispatch(session, call));
				return json(HttpStatus.OK, response, session);
			}
			catch (GatewayException ex) {
				return error(call.id(), ex, session);
			}
		}
		if (envelope instanceof Envelope.Notification notification) {
			try {
				this.router.notify(session, notification);
			}
			catch (GatewayException ex) {
				return error(null, ex, session);
			}
		}
		return ServerResponse.accepted().header(SESSION_ID_HEADER, session.id()).build();
	}

	private ServerResponse handleInitialize(Envelope.Request call) {
		Router.Initialized initialized;
		try {
			initialized = await(this.router.initialize(call, TransportKind.HTTP));
		}
		catch (GatewayException ex) {
			return error(call.id(), ex, null);
		}
		logger.info("Opened HTTP {}", initialized.session());
		return json(HttpStatus.OK, initialized.response(), initialized.session());
	}

	private ServerResponse handleDelete(ServerRequest request) {
		if (!originAllowed(request)) {
			return forbidden();
		}
		if (this.disallowDelete) {
			return ServerResponse.status(HttpStatus.METHOD_NOT_ALLOWED).build();
		}
		String sessionId = request.headers().firstHeader(SESSION_ID_HEADER);
		if (sessionId == null || sessionId.isBlank()) {
			return error(null, new GatewayException(GatewayErrorKind.MISSING_SESSION_ID,
					"Missing " + SESSION_ID_HEADER + " header"), null);
		}
		if (!this.sessions.close(sessionId)) {
			return error(null, new GatewayException(GatewayErrorKind.SESSION_NOT_FOUND,
					"Session not found: " + sessionId), null);
		}
		return ServerResponse.noContent().build();
	}

	private <T> T await(CompletableFuture<T> future) {
		try {
			return future.get(this.responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (ExecutionException | TimeoutException ex) {
			throw GatewayErrors.unwrap(ex);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new GatewayException(GatewayErrorKind.INTERNAL, "Interrupted while waiting for the backend", null,
					ex);
		}
	}

	private boolean originAllowed(ServerRequest request) {
		String origin = request.headers().firstHeader("Origin");
		if (origin == null) {
			return true;
		}
		String normalized = origin.trim().toLowerCase(Locale.ROOT);
		if (this.allowedOrigins.contains(normalized)) {
			return true;
		}
		try {
			String host = URI.create(normalized).getHost();
			if (host != null && host.startsWith("[") && host.endsWith("]")) {
				host = host.substring(1, host.length() - 1);
			}
			return host != null && this.allowedOrigins.contains(host);
		}
		catch (IllegalArgumentException ex) {
			return false;
		}
	}

	private ServerResponse forbidden() {
		return ServerResponse.status(HttpStatus.FORBIDDEN).build();
	}

	private ServerResponse error(@Nullable JsonNode id, GatewayException error, @Nullable Session session) {
		this.router.metrics().error(error.kind(), error.server());
		if (error.kind() == GatewayErrorKind.INTERNAL) {
			logger.error("HTTP request failed", error);
		}
		else {
			logger.debug("HTTP request rejected: {} {}", error.kind(), error.getMessage());
		}
		return json(HttpStatus.valueOf(error.kind().httpStatus()), GatewayErrors.toResponse(id, error), session);
	}

	private ServerResponse json(HttpStatus status, Envelope.Response response, @Nullable Session session) {
		ServerResponse.BodyBuilder builder = ServerResponse.status(status).contentType(MediaType.APPLICATION_JSON);
		if (session != null) {
			builder.header(SESSION_ID_HEADER, session.id());
		}
		return builder.body(this.codec.encodeBytes(response));
	}

}
