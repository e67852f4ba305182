package dev.citadel.gateway.web;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.TransportKind;
import dev.citadel.gateway.transport.FrameSink;
import dev.citadel.gateway.transport.StreamConnection;
import dev.citadel.transport.EnvelopeCodec;

/**
 * WebSocket transport. Each text message is one JSON-RPC envelope and each WebSocket connection
 * hosts a single gateway session, exactly like a Unix socket connection.
 */
public class WebSocketGatewayHandler extends TextWebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketGatewayHandler.class);

	private final Router router;

	private final SessionManager sessions;

	private final EnvelopeCodec codec;

	private final Executor writer;

	private final Map<String, StreamConnection> connections = new ConcurrentHashMap<>();

	public WebSocketGatewayHandler(Router router, SessionManager sessions, EnvelopeCodec codec, Executor writer) {
		this.router = router;
		this.sessions = sessions;
		this.codec = codec;
		this.writer = writer;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession socketSession) {
		StreamConnection connection = new StreamConnection("ws-" + socketSession.getId(), TransportKind.WEBSOCKET,
				this.router, this.sessions, this.codec, new SocketSink(socketSession), this.writer);
		this.connections.put(socketSession.getId(), connection);
		logger.info("WebSocket connection established: {}", socketSession.getId());
	}

	@Override
	protected void handleTextMessage(WebSocketSession socketSession, TextMessage message) {
		StreamConnection connection = this.connections.get(socketSession.getId());
		if (connection == null) {
			logger.warn("Message on unknown WebSocket {}", socketSession.getId());
			return;
		}
		connection.onFrame(message.getPayload());
	}

	@Override
	public void handleTransportError(WebSocketSession socketSession, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", socketSession.getId(), exception);
		release(socketSession);
	}

	@Override
	public void afterConnectionClosed(WebSocketSession socketSession, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", socketSession.getId(), status);
		release(socketSession);
	}

	public int connectionCount() {
		return this.connections.size();
	}

	private void release(WebSocketSession socketSession) {
		StreamConnection connection = this.connections.remove(socketSession.getId());
		if (connection != null) {
			connection.onClosed();
		}
	}

	private static final class SocketSink implements FrameSink {

		private final WebSocketSession socketSession;

		SocketSink(WebSocketSession socketSession) {
			this.socketSession = socketSession;
		}

		@Override
		public void send(String frame) throws IOException {
			if (!this.socketSession.isOpen()) {
				throw new IOException("WebSocket session " + this.socketSession.getId() + " is closed");
			}
			this.socketSession.sendMessage(new TextMessage(frame));
		}

		@Override
		public void close() {
			try {
				this.socketSession.close(CloseStatus.SESSION_NOT_RELIABLE);
			}
			catch (IOException ex) {
				logger.debug("Could not close WebSocket {}", this.socketSession.getId(), ex);
			}
		}

	}

}
