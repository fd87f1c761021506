package com.flagship.shipping_workflow.session;

import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.workflow.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-node session store.
 *
 * Each operation runs inside {@link ConcurrentMap#compute} for its key, which
 * gives the same per-key atomicity as the SQL store. Archive and delete
 * happen in one compute call, so hand-off is atomic here too.
 */
@Component
@ConditionalOnProperty(name = "workflow.session.store", havingValue = "memory")
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<CompletionRecord> archive = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public InMemorySessionStore(Clock clock, WorkflowProperties properties) {
        this(clock, properties.getSession().getTtl());
    }

    public InMemorySessionStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Session getOrCreate(String userKey, FieldPatch initialFields) {
        Instant now = clock.instant();
        return sessions.compute(userKey, (key, existing) -> {
            if (existing == null || existing.isExpired(now, ttl)) {
                if (existing != null) {
                    log.info("Discarded expired session before re-creating: userKey={}", userKey);
                }
                return Session.start(key, OrderCorrelationIds.generate(now), initialFields, now);
            }
            return existing.touch(now);
        });
    }

    @Override
    public Optional<Session> updateAtomic(String userKey, WorkflowStep step, FieldPatch patch) {
        Instant now = clock.instant();
        AtomicReference<Session> updated = new AtomicReference<>();
        sessions.computeIfPresent(userKey, (key, existing) -> {
            if (existing.isExpired(now, ttl)) {
                return null;
            }
            Session next = existing.apply(step, patch, now);
            updated.set(next);
            return next;
        });
        return Optional.ofNullable(updated.get());
    }

    @Override
    public Optional<Session> get(String userKey) {
        Session session = sessions.get(userKey);
        if (session == null || session.isExpired(clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    public void clear(String userKey) {
        sessions.remove(userKey);
    }

    @Override
    public void finalizeAndArchive(String userKey, CompletionRecord record) {
        sessions.compute(userKey, (key, existing) -> {
            archive.add(record);
            return null;
        });
        log.info("Session archived: userKey={}, orderCorrelationId={}",
                userKey, record.getOrderCorrelationId());
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        sessions.forEach((key, session) -> {
            if (sessions.computeIfPresent(key, (k, s) -> s.isExpired(now, ttl) ? null : s) == null) {
                removed.incrementAndGet();
            }
        });
        return removed.get();
    }

    public List<CompletionRecord> getArchive() {
        return List.copyOf(archive);
    }
}
