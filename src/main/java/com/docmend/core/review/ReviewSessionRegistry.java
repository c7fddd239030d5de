package com.docmend.core.review;

import com.docmend.core.model.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds open review sessions behind opaque handles so a remote caller can drive
 * one review across several requests. Sessions live in memory only and are
 * discarded after their terminal apply.
 * <p>
 * Idle sessions expire, and the number of open sessions is capped; both are
 * enforced whenever a new session is opened.
 */
@Service
public class ReviewSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionRegistry.class);

    private static final class Entry {
        final ReviewSession session;
        volatile Instant lastAccess;

        Entry(ReviewSession session, Instant lastAccess) {
            this.session = session;
            this.lastAccess = lastAccess;
        }
    }

    private final ConcurrentHashMap<String, Entry> sessions = new ConcurrentHashMap<>();
    private final int maxOpen;
    private final Duration idleTimeout;
    private final Clock clock;

    @Autowired
    public ReviewSessionRegistry(ReviewProperties properties) {
        this(properties.getMaxOpen(), Duration.ofMinutes(properties.getIdleMinutes()), Clock.systemUTC());
    }

    ReviewSessionRegistry(int maxOpen, Duration idleTimeout, Clock clock) {
        this.maxOpen = Math.max(1, maxOpen);
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    public String open(List<Suggestion> suggestions) {
        evictStale();
        String handle = UUID.randomUUID().toString();
        sessions.put(handle, new Entry(new ReviewSession(suggestions), clock.instant()));
        log.info("Opened review {} with {} suggestion(s)", handle, suggestions.size());
        return handle;
    }

    public Optional<ReviewSession> find(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        Entry entry = sessions.get(handle);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            sessions.remove(handle, entry);
            log.info("Review {} expired", handle);
            return Optional.empty();
        }
        entry.lastAccess = clock.instant();
        return Optional.of(entry.session);
    }

    /**
     * Removes the session and hands it to the caller. Of several concurrent
     * callers with the same handle, exactly one receives the session.
     */
    public Optional<ReviewSession> take(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        Entry entry = sessions.remove(handle);
        if (entry == null || isExpired(entry, clock.instant())) {
            return Optional.empty();
        }
        log.info("Closed review {}", handle);
        return Optional.of(entry.session);
    }

    public boolean discard(String handle) {
        boolean removed = handle != null && sessions.remove(handle) != null;
        if (removed) {
            log.info("Discarded review {}", handle);
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return entry.lastAccess.plus(idleTimeout).isBefore(now);
    }

    private void evictStale() {
        Instant now = clock.instant();
        sessions.entrySet().removeIf(e -> {
            boolean expired = isExpired(e.getValue(), now);
            if (expired) {
                log.info("Review {} expired", e.getKey());
            }
            return expired;
        });
        while (sessions.size() >= maxOpen) {
            Optional<String> oldest = sessions.entrySet().stream()
                    .min(Comparator.comparing((Map.Entry<String, Entry> e) -> e.getValue().lastAccess))
                    .map(Map.Entry::getKey);
            if (oldest.isEmpty()) {
                break;
            }
            sessions.remove(oldest.get());
            log.warn("Review limit {} reached, dropped least recently used review {}", maxOpen, oldest.get());
        }
    }
}
