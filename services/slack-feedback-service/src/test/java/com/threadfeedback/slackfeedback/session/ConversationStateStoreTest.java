package com.threadfeedback.slackfeedback.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import com.threadfeedback.slackfeedback.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConversationStateStoreTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-10T10:00:00Z"));
  private final ConversationStateStore store =
      new ConversationStateStore(
          new FeedbackProperties(null, null, 1, 10, Duration.ofMinutes(30), null, null), clock);
  private final SessionKey key = new SessionKey("U1", "C1", "1700.0001");
  private ExecutorService pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.shutdownNow();
    }
  }

  @Test
  void upsertCreatesAndThenMutatesSession() {
    FeedbackSession created =
        store.upsert(key, s -> FeedbackSession.prompted(key, Map.of(), clock.instant()));
    FeedbackSession rated =
        store.upsert(key, s -> s.withStatus(SessionStatus.FORM_DISPLAYED).withRating(7));

    assertThat(created.status()).isEqualTo(SessionStatus.PROMPTED);
    assertThat(rated.rating()).isEqualTo(7);
    assertThat(store.get(key)).contains(rated);
  }

  @Test
  void updateIfPresentLeavesUnknownKeysAlone() {
    assertThat(store.updateIfPresent(key, s -> s.withRating(3))).isEmpty();
    assertThat(store.get(key)).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void expiredSessionsReadAsAbsent() {
    store.upsert(key, s -> FeedbackSession.prompted(key, Map.of(), clock.instant()));
    clock.advance(Duration.ofMinutes(31));

    assertThat(store.get(key)).isEmpty();
    assertThat(store.updateIfPresent(key, s -> s)).isEmpty();
    FeedbackSession fresh =
        store.upsert(
            key,
            s -> {
              assertThat(s).isNull();
              return FeedbackSession.prompted(key, Map.of("ticket_id", "T-1"), clock.instant());
            });
    assertThat(fresh.metadata()).containsEntry("ticket_id", "T-1");
  }

  @Test
  void everyUpdateExtendsTheTtl() {
    store.upsert(key, s -> FeedbackSession.prompted(key, Map.of(), clock.instant()));
    clock.advance(Duration.ofMinutes(20));
    store.updateIfPresent(key, s -> s.withStatus(SessionStatus.FORM_DISPLAYED));
    clock.advance(Duration.ofMinutes(20));

    assertThat(store.get(key)).isPresent();
  }

  @Test
  void purgeRemovesOnlyExpiredEntries() {
    SessionKey other = new SessionKey("U2", "C1", "1700.0001");
    store.upsert(key, s -> FeedbackSession.prompted(key, Map.of(), clock.instant()));
    clock.advance(Duration.ofMinutes(20));
    store.upsert(other, s -> FeedbackSession.prompted(other, Map.of(), clock.instant()));
    clock.advance(Duration.ofMinutes(15));

    assertThat(store.purgeExpired()).isEqualTo(1);
    assertThat(store.get(key)).isEmpty();
    assertThat(store.get(other)).isPresent();
  }

  @Test
  void removeDropsSession() {
    store.upsert(key, s -> FeedbackSession.prompted(key, Map.of(), clock.instant()));
    store.remove(key);

    assertThat(store.get(key)).isEmpty();
  }

  @Test
  void mutatorMustReturnSession() {
    assertThatThrownBy(() -> store.upsert(key, s -> null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void closedSessionRejectsRatingChanges() {
    FeedbackSession submitted =
        FeedbackSession.prompted(key, Map.of(), clock.instant())
            .withStatus(SessionStatus.SUBMITTED);

    assertThatThrownBy(() -> submitted.withRating(2)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> submitted.withComments("x"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void concurrentUpdatesOnOneKeyAreLinearized() throws Exception {
    store.upsert(
        key,
        s ->
            FeedbackSession.prompted(key, Map.of(), clock.instant())
                .withStatus(SessionStatus.FORM_DISPLAYED)
                .withComments(""));
    int threads = 8;
    int perThread = 250;
    pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    for (int t = 0; t < threads; t++) {
      pool.submit(
          () -> {
            start.await();
            for (int i = 0; i < perThread; i++) {
              store.updateIfPresent(key, s -> s.withComments(s.comments() + "x"));
            }
            return null;
          });
    }
    start.countDown();
    pool.shutdown();
    assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    assertThat(store.get(key).orElseThrow().comments()).hasSize(threads * perThread);
  }
}
