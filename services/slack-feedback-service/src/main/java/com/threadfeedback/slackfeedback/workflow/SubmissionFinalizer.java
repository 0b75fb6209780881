package com.threadfeedback.slackfeedback.workflow;

import com.threadfeedback.slackfeedback.client.SlackApiClient;
import com.threadfeedback.slackfeedback.common.web.PersistenceFailureException;
import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import com.threadfeedback.slackfeedback.event.FormState;
import com.threadfeedback.slackfeedback.event.MetadataExtractor;
import com.threadfeedback.slackfeedback.persistence.FeedbackRecordEntity;
import com.threadfeedback.slackfeedback.persistence.FeedbackRecordRepository;
import com.threadfeedback.slackfeedback.render.MessageComposer;
import com.threadfeedback.slackfeedback.session.ConversationStateStore;
import com.threadfeedback.slackfeedback.session.FeedbackSession;
import com.threadfeedback.slackfeedback.session.SessionKey;
import com.threadfeedback.slackfeedback.session.SessionStatus;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a completed session into a stored {@link FeedbackRecordEntity}, at most once per session.
 *
 * <p>The submit is split in three steps around the blocking calls:
 *
 * <ol>
 *   <li>claim: atomically move an open session with a valid rating to {@code SUBMITTING};
 *   <li>write: resolve display names and save the record;
 *   <li>commit: mark the session {@code SUBMITTED}, or release the claim if the write failed.
 * </ol>
 *
 * A second submit racing the first sees {@code SUBMITTING} or {@code SUBMITTED} and is turned
 * away without touching Slack or the database.
 */
@Service
@Slf4j
public class SubmissionFinalizer {

  private final ConversationStateStore store;
  private final FeedbackRecordRepository repository;
  private final SlackApiClient slack;
  private final MessageComposer composer;
  private final FeedbackProperties properties;
  private final Clock clock;

  public SubmissionFinalizer(
      ConversationStateStore store,
      FeedbackRecordRepository repository,
      SlackApiClient slack,
      MessageComposer composer,
      FeedbackProperties properties,
      Clock clock) {
    this.store = store;
    this.repository = repository;
    this.slack = slack;
    this.composer = composer;
    this.properties = properties;
    this.clock = clock;
  }

  public SubmissionOutcome submit(SessionKey key, String sourceMessageTs) {
    return submit(key, sourceMessageTs, FormState.EMPTY);
  }

  /**
   * @param sourceMessageTs message the submit button was clicked in; this is the form that gets
   *     closed, the session's own form reference is the fallback
   * @param form input values sent with the click; they are the latest values and override what
   *     earlier actions stored
   */
  public SubmissionOutcome submit(SessionKey key, String sourceMessageTs, FormState form) {
    AtomicReference<SubmissionOutcome.Status> verdict = new AtomicReference<>();
    Optional<FeedbackSession> claimed =
        store.updateIfPresent(
            key,
            s -> {
              if (!s.status().isOpen()) {
                verdict.set(SubmissionOutcome.Status.ALREADY_SUBMITTED);
                return s;
              }
              FeedbackSession merged = applyFormState(s, form);
              if (merged.rating() == null || !properties.isValidRating(merged.rating())) {
                verdict.set(SubmissionOutcome.Status.RATING_REQUIRED);
                return s;
              }
              verdict.set(SubmissionOutcome.Status.SUBMITTED);
              return merged.withStatus(SessionStatus.SUBMITTING);
            });

    if (claimed.isEmpty()) {
      log.debug("Submit for unknown session {}", key);
      return SubmissionOutcome.of(SubmissionOutcome.Status.NO_SESSION);
    }
    if (verdict.get() != SubmissionOutcome.Status.SUBMITTED) {
      log.info("Submit rejected for session {}: {}", key, verdict.get());
      return SubmissionOutcome.of(verdict.get());
    }

    FeedbackSession session = claimed.get();
    FeedbackRecordEntity saved;
    try {
      saved = repository.save(toRecord(session));
    } catch (RuntimeException e) {
      store.updateIfPresent(
          key,
          s ->
              s.status() == SessionStatus.SUBMITTING
                  ? s.withStatus(SessionStatus.FORM_DISPLAYED)
                  : s);
      throw new PersistenceFailureException("Could not store feedback for session " + key, e);
    }

    store.upsert(key, s -> (s == null ? session : s).withStatus(SessionStatus.SUBMITTED));
    log.info("Feedback submitted for session {} (record id={})", key, saved.getId());

    closeForm(session, sourceMessageTs);
    return new SubmissionOutcome(SubmissionOutcome.Status.SUBMITTED, saved);
  }

  private FeedbackSession applyFormState(FeedbackSession session, FormState form) {
    FeedbackSession merged = session;
    Integer rating = parseRating(form.rating());
    if (rating != null) {
      merged = merged.withRating(rating);
    }
    if (form.comments() != null) {
      merged = merged.withComments(form.comments().trim());
    }
    return merged;
  }

  private Integer parseRating(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int r = Integer.parseInt(value.trim());
      return properties.isValidRating(r) ? r : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private FeedbackRecordEntity toRecord(FeedbackSession session) {
    SessionKey key = session.key();
    String comments = session.comments() == null ? "" : session.comments();
    return new FeedbackRecordEntity(
        key.channelId(),
        slack.channelName(key.channelId()),
        key.threadTs(),
        key.userId(),
        slack.userDisplayName(key.userId()),
        session.rating(),
        comments,
        session.metadata().get(MetadataExtractor.TICKET_ID),
        session.metadata().get(MetadataExtractor.CORRELATION_ID),
        clock.instant());
  }

  private void closeForm(FeedbackSession session, String sourceMessageTs) {
    SessionKey key = session.key();
    String formTs =
        sourceMessageTs != null && !sourceMessageTs.isBlank()
            ? sourceMessageTs
            : session.formMessageTs();
    slack.updateMessage(
        key.channelId(), formTs, composer.confirmation(session.rating(), session.comments()));
    slack.postMessage(key.channelId(), key.threadTs(), composer.thankYou(key.userId()));
  }
}
