package com.threadfeedback.slackfeedback.session;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a feedback conversation. Every change produces a new instance which the
 * {@link ConversationStateStore} swaps in atomically.
 *
 * <p>Rating and comments only change while the session is {@link SessionStatus#isOpen() open}.
 */
public record FeedbackSession(
    SessionKey key,
    SessionStatus status,
    Integer rating,
    String comments,
    String promptMessageTs,
    String formMessageTs,
    Map<String, String> metadata,
    Instant createdAt) {

  public FeedbackSession {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static FeedbackSession prompted(
      SessionKey key, Map<String, String> metadata, Instant createdAt) {
    return new FeedbackSession(
        key, SessionStatus.PROMPTED, null, null, null, null, metadata, createdAt);
  }

  public boolean isSubmitted() {
    return status == SessionStatus.SUBMITTED;
  }

  public FeedbackSession withStatus(SessionStatus next) {
    return new FeedbackSession(
        key, next, rating, comments, promptMessageTs, formMessageTs, metadata, createdAt);
  }

  public FeedbackSession withRating(int value) {
    requireOpen();
    return new FeedbackSession(
        key, status, value, comments, promptMessageTs, formMessageTs, metadata, createdAt);
  }

  public FeedbackSession withComments(String text) {
    requireOpen();
    return new FeedbackSession(
        key, status, rating, text, promptMessageTs, formMessageTs, metadata, createdAt);
  }

  public FeedbackSession withPromptMessage(String ts) {
    return new FeedbackSession(
        key, status, rating, comments, ts, formMessageTs, metadata, createdAt);
  }

  public FeedbackSession withFormMessage(String ts) {
    return new FeedbackSession(
        key, status, rating, comments, promptMessageTs, ts, metadata, createdAt);
  }

  /** New keys win; existing values are kept for keys the update does not carry. */
  public FeedbackSession withMetadata(Map<String, String> update) {
    if (update == null || update.isEmpty()) {
      return this;
    }
    Map<String, String> merged = new LinkedHashMap<>(metadata);
    merged.putAll(update);
    return new FeedbackSession(
        key, status, rating, comments, promptMessageTs, formMessageTs, merged, createdAt);
  }

  private void requireOpen() {
    if (!status.isOpen()) {
      throw new IllegalStateException("Session " + key + " is " + status);
    }
  }
}
