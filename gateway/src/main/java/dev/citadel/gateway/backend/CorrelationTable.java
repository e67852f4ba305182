package dev.citadel.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * In-flight calls of one backend connection, keyed by the gateway-assigned id. Not thread
 * safe: only the owning connection's thread touches it. {@link #size()} is the exception and
 * may be read from anywhere.
 */
final class CorrelationTable {

    static final int RELEASED_HISTORY = 1024;

    private final LongSupplier idSource;
    private final Map<Long, PendingCall> pending = new LinkedHashMap<>();
    private final Set<Long> released = new HashSet<>();
    private final Deque<Long> releasedOrder = new ArrayDeque<>();

    private volatile int inFlight;

    CorrelationTable() {
        this(new AtomicLong()::incrementAndGet);
    }

    CorrelationTable(LongSupplier idSource) {
        this.idSource = idSource;
    }

    long nextId() {
        return idSource.getAsLong();
    }

    void register(PendingCall call) {
        if (pending.containsKey(call.gatewayId())) {
            throw new IllegalStateException("Gateway id " + call.gatewayId() + " is already in flight");
        }
        pending.put(call.gatewayId(), call);
        inFlight = pending.size();
    }

    /**
     * Remove and return the call for {@code gatewayId}, or {@code null} if it is not in flight.
     */
    PendingCall resolve(long gatewayId) {
        PendingCall call = pending.remove(gatewayId);
        inFlight = pending.size();
        return call;
    }

    PendingCall find(String sessionId, JsonNode clientId) {
        for (PendingCall call : pending.values()) {
            if (call.sessionId().equals(sessionId) && call.clientId().equals(clientId)) {
                return call;
            }
        }
        return null;
    }

    /**
     * Drop every call of a session, remembering the ids so late replies are discarded quietly.
     */
    List<PendingCall> releaseSession(String sessionId) {
        List<PendingCall> calls = new ArrayList<>();
        pending.values().removeIf(call -> {
            if (call.sessionId().equals(sessionId)) {
                calls.add(call);
                return true;
            }
            return false;
        });
        inFlight = pending.size();
        calls.forEach(call -> markReleased(call.gatewayId()));
        return calls;
    }

    void markReleased(long gatewayId) {
        if (released.add(gatewayId)) {
            releasedOrder.addLast(gatewayId);
            if (releasedOrder.size() > RELEASED_HISTORY) {
                released.remove(releasedOrder.removeFirst());
            }
        }
    }

    boolean wasReleased(long gatewayId) {
        return released.contains(gatewayId);
    }

    List<PendingCall> drain() {
        List<PendingCall> calls = new ArrayList<>(pending.values());
        pending.clear();
        inFlight = 0;
        return calls;
    }

    int size() {
        return inFlight;
    }
}
