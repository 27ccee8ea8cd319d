package com.bko.ensemble.stream;

import com.bko.ensemble.orchestration.model.ConversationMode;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class ModeStreamRun {

    enum Status {
        RUNNING, COMPLETED, CANCELLED
    }

    private final String runId;
    private final ConversationMode mode;
    private final int capacity;
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private long lastEventId;
    private volatile Status status = Status.RUNNING;
    private volatile long touchedAt = System.currentTimeMillis();

    ModeStreamRun(String runId, ConversationMode mode, int capacity) {
        this.runId = runId;
        this.mode = mode;
        this.capacity = capacity;
    }

    String runId() {
        return runId;
    }

    ConversationMode mode() {
        return mode;
    }

    Status status() {
        return status;
    }

    /**
     * Once cancelled, only terminal events are buffered.
     */
    boolean accepts(String type) {
        return status != Status.CANCELLED || StreamEventType.isTerminal(type);
    }

    synchronized StreamEvent append(String type, Object data) {
        StreamEvent event = new StreamEvent(++lastEventId, runId, mode.id(), Instant.now(), type, data);
        buffer.addLast(event);
        while (buffer.size() > capacity) {
            buffer.removeFirst();
        }
        touchedAt = event.timestamp().toEpochMilli();
        if (StreamEventType.RUN_COMPLETE.equals(type) && status == Status.RUNNING) {
            status = Status.COMPLETED;
        }
        return event;
    }

    synchronized List<StreamEvent> eventsAfter(long sinceId) {
        return buffer.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
    }

    /**
     * @return {@code false} when the run was already cancelled
     */
    synchronized boolean cancel() {
        if (status == Status.CANCELLED) {
            return false;
        }
        status = Status.CANCELLED;
        touchedAt = System.currentTimeMillis();
        return true;
    }

    void attach(WebSocketSession session) {
        sessions.put(session.getId(), session);
    }

    void detach(String sessionId) {
        sessions.remove(sessionId);
    }

    Collection<WebSocketSession> sessions() {
        return sessions.values();
    }

    boolean expired(long cutoffMillis) {
        return status != Status.RUNNING && sessions.isEmpty() && touchedAt < cutoffMillis;
    }
}
