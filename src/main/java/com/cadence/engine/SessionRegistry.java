package com.cadence.engine;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live session workers by session id
 */
@Component
public class SessionRegistry {

    private final ConcurrentMap<String, SessionWorker> workers = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the session id is already registered
     */
    public void register(SessionWorker worker) {
        SessionWorker existing = workers.putIfAbsent(worker.getSessionId(), worker);
        if (existing != null) {
            throw new IllegalStateException("Session already active: " + worker.getSessionId());
        }
    }

    public Optional<SessionWorker> find(String sessionId) {
        return Optional.ofNullable(workers.get(sessionId));
    }

    public Optional<SessionWorker> remove(String sessionId) {
        return Optional.ofNullable(workers.remove(sessionId));
    }

    public Set<String> sessionIds() {
        return Set.copyOf(workers.keySet());
    }

    public int size() {
        return workers.size();
    }
}
