package com.threadfeedback.slackfeedback.session;

import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * In-memory feedback sessions with TTL.
 *
 * <p>All mutations go through {@link ConcurrentMap#compute}, so updates to one key are applied one
 * at a time while different keys proceed in parallel. Mutator functions must not block: no
 * network or database calls inside them.
 */
@Service
@Slf4j
public class ConversationStateStore {

  private final ConcurrentMap<SessionKey, Entry> map = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public ConversationStateStore(FeedbackProperties properties, Clock clock) {
    this.ttl = properties.sessionTtl();
    this.clock = clock;
  }

  public Optional<FeedbackSession> get(SessionKey key) {
    Entry e = map.get(key);
    if (e == null) {
      return Optional.empty();
    }
    if (isExpired(e, clock.instant())) {
      map.remove(key, e);
      return Optional.empty();
    }
    return Optional.of(e.session);
  }

  /**
   * Atomically replaces the session under {@code key}.
   *
   * @param mutator receives the live session, or {@code null} when absent or expired; must return
   *     the new session
   */
  public FeedbackSession upsert(SessionKey key, UnaryOperator<FeedbackSession> mutator) {
    Instant now = clock.instant();
    Entry updated =
        map.compute(
            key,
            (k, old) -> {
              FeedbackSession current = old == null || isExpired(old, now) ? null : old.session;
              FeedbackSession next = mutator.apply(current);
              if (next == null) {
                throw new IllegalStateException("Mutator returned no session for " + k);
              }
              return current == next ? old : new Entry(next, now.plus(ttl));
            });
    return updated.session;
  }

  /**
   * Like {@link #upsert} but leaves absent or expired keys untouched.
   *
   * @return the session after the update, empty if there was none
   */
  public Optional<FeedbackSession> updateIfPresent(
      SessionKey key, UnaryOperator<FeedbackSession> mutator) {
    Instant now = clock.instant();
    Entry updated =
        map.computeIfPresent(
            key,
            (k, old) -> {
              if (isExpired(old, now)) {
                return null;
              }
              FeedbackSession next = mutator.apply(old.session);
              if (next == null) {
                throw new IllegalStateException("Mutator returned no session for " + k);
              }
              return next == old.session ? old : new Entry(next, now.plus(ttl));
            });
    return updated == null ? Optional.empty() : Optional.of(updated.session);
  }

  public void remove(SessionKey key) {
    map.remove(key);
  }

  public int size() {
    return map.size();
  }

  @Scheduled(fixedDelayString = "${feedback.purge-interval:PT10M}")
  public int purgeExpired() {
    Instant now = clock.instant();
    AtomicInteger purged = new AtomicInteger();
    map.forEach(
        (key, entry) -> {
          if (isExpired(entry, now) && map.remove(key, entry)) {
            purged.incrementAndGet();
          }
        });
    if (purged.get() > 0) {
      log.debug("Purged {} expired feedback sessions", purged.get());
    }
    return purged.get();
  }

  private static boolean isExpired(Entry e, Instant now) {
    return e.expiresAt.isBefore(now);
  }

  private record Entry(FeedbackSession session, Instant expiresAt) {}
}
