package com.scriptdeck.runner.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;

/**
 * WebSocket endpoint {@code /ws/{jobId}}: one text frame per stream message.
 * Incoming frames from the viewer are ignored.
 */
@Component
public class JobStreamWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(JobStreamWebSocketHandler.class);

    private final JobStreamBroadcaster broadcaster;

    public JobStreamWebSocketHandler(JobStreamBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String jobId = extractJobId(session.getUri());
        log.info("Viewer connected: job={} session={}", jobId, session.getId());
        broadcaster.attach(jobId, new SocketChannel(session));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.detach(session.getId());
        log.info("Viewer disconnected: session={} status={}", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring message from viewer {}: {}", session.getId(), message.getPayload());
    }

    /** Last path segment of {@code /ws/{jobId}}, or null. */
    static String extractJobId(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        String path = uri.getPath();
        int slash = path.lastIndexOf('/');
        String id = slash >= 0 ? path.substring(slash + 1) : path;
        return id.isEmpty() ? null : id;
    }

    private static final class SocketChannel implements ViewerChannel {

        private final WebSocketSession session;

        SocketChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override public String id() { return session.getId(); }

        @Override
        public void send(String message) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("session " + session.getId() + " is closed");
            }
            session.sendMessage(new TextMessage(message));
        }

        @Override
        public void close() throws IOException {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        }
    }
}
