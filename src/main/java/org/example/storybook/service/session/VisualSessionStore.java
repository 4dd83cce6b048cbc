package org.example.storybook.service.session;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of visual sessions keyed by story id, plus one lock per story guarding
 * initialization. Sessions live only as long as the process.
 */
@Component
public class VisualSessionStore {

    private final ConcurrentHashMap<String, VisualSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Optional<VisualSession> get(String storyId) {
        if (storyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(storyId));
    }

    public void put(VisualSession session) {
        sessions.put(session.storyId(), session);
    }

    /**
     * Lock the story and return the held lock. A waiter whose lock was retired by {@link #removeLocked}
     * while it waited starts over on the story's current lock.
     */
    public ReentrantLock acquire(String storyId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(storyId, key -> new ReentrantLock());
            lock.lock();
            if (locks.get(storyId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /**
     * Remove the story's session and retire its lock. The caller must hold {@code lock} from
     * {@link #acquire} and release it afterwards.
     */
    public Optional<VisualSession> removeLocked(String storyId, ReentrantLock lock) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock for story " + storyId + " is not held by this thread");
        }
        Optional<VisualSession> removed = Optional.ofNullable(sessions.remove(storyId));
        locks.remove(storyId, lock);
        return removed;
    }

    int lockCount() {
        return locks.size();
    }

    public int size() {
        return sessions.size();
    }
}
