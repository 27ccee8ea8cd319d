package com.bko.ensemble.stream;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Buffers the events of every live run and fans them out to attached WebSocket sessions. Late subscribers get
 * a replay of the buffered events after their {@code since} id.
 */
@Component
public class ModeStreamHub {
    private static final Logger log = LoggerFactory.getLogger(ModeStreamHub.class);
    private static final int MAX_BUFFER_SIZE = 1000;
    private static final long CLEANUP_TTL_MS = 30 * 60 * 1000L;
    private static final String RUN_ID_ATTRIBUTE = "runId";

    private final ObjectMapper objectMapper;
    private final Map<String, ModeStreamRun> runs = new ConcurrentHashMap<>();

    public ModeStreamHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String createRun(ConversationMode mode) {
        cleanupExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new ModeStreamRun(runId, mode, MAX_BUFFER_SIZE));
        log.debug("Created {} stream run {}.", mode.id(), runId);
        return runId;
    }

    public void registerSession(String runId, WebSocketSession session, long sinceId) throws IOException {
        ModeStreamRun run = runs.get(runId);
        if (run == null) {
            log.debug("Session {} asked for unknown run {}.", session.getId(), runId);
            session.close();
            return;
        }
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        run.attach(session);
        run.eventsAfter(sinceId).forEach(event -> send(session, event));
    }

    public void removeSession(WebSocketSession session) {
        Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        if (runId == null) {
            return;
        }
        ModeStreamRun run = runs.get(runId.toString());
        if (run != null) {
            run.detach(session.getId());
        }
    }

    public void emit(String runId, String type, Object data) {
        ModeStreamRun run = runs.get(runId);
        if (run == null || !run.accepts(type)) {
            return;
        }
        broadcast(run, run.append(type, data));
    }

    /**
     * Marks the run cancelled and tells attached clients. Returns {@code false} only for unknown runs.
     */
    public boolean cancelRun(String runId) {
        ModeStreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        if (run.cancel()) {
            log.info("Run {} ({}) cancelled by client.", runId, run.mode().id());
            broadcast(run, run.append(StreamEventType.RUN_CANCEL, Map.of()));
        }
        return true;
    }

    public boolean isCancelled(String runId) {
        ModeStreamRun run = runs.get(runId);
        return run != null && run.status() == ModeStreamRun.Status.CANCELLED;
    }

    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    private void broadcast(ModeStreamRun run, StreamEvent event) {
        run.sessions().forEach(session -> send(session, event));
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send stream event {} to session {}: {}", event.id(), session.getId(),
                    ex.getMessage());
        }
    }

    private void cleanupExpiredRuns() {
        long cutoff = System.currentTimeMillis() - CLEANUP_TTL_MS;
        runs.values().removeIf(run -> run.expired(cutoff));
    }
}
