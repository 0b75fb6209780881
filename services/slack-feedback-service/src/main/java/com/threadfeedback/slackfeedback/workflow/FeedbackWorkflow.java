package com.threadfeedback.slackfeedback.workflow;

import com.threadfeedback.slackfeedback.client.SlackApiClient;
import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import com.threadfeedback.slackfeedback.event.ActionEvent;
import com.threadfeedback.slackfeedback.event.FormState;
import com.threadfeedback.slackfeedback.event.MetadataExtractor;
import com.threadfeedback.slackfeedback.event.SlackEvent;
import com.threadfeedback.slackfeedback.render.MessageComposer;
import com.threadfeedback.slackfeedback.session.ConversationStateStore;
import com.threadfeedback.slackfeedback.session.FeedbackSession;
import com.threadfeedback.slackfeedback.session.SessionKey;
import com.threadfeedback.slackfeedback.session.SessionStatus;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-thread feedback conversation: prompt, form, rating/comment updates, submit.
 *
 * <p>Session transitions happen inside the store's atomic update; Slack calls are made outside of
 * it and their results (message timestamps) are written back in a second update.
 */
@Service
@Slf4j
public class FeedbackWorkflow {

  private final ConversationStateStore store;
  private final SubmissionFinalizer finalizer;
  private final MessageComposer composer;
  private final SlackApiClient slack;
  private final MetadataExtractor metadataExtractor;
  private final FeedbackProperties properties;
  private final Clock clock;

  public FeedbackWorkflow(
      ConversationStateStore store,
      SubmissionFinalizer finalizer,
      MessageComposer composer,
      SlackApiClient slack,
      MetadataExtractor metadataExtractor,
      FeedbackProperties properties,
      Clock clock) {
    this.store = store;
    this.finalizer = finalizer;
    this.composer = composer;
    this.slack = slack;
    this.metadataExtractor = metadataExtractor;
    this.properties = properties;
    this.clock = clock;
  }

  private boolean isTrigger(String text) {
    return matchesTrigger(text) || matchesResolution(text);
  }

  /**
   * Starts (or re-prompts) the feedback conversation for the message author in its thread.
   *
   * <p>An open session is kept as is; only the prompt reference and any newly extracted metadata
   * are updated. A submitted session is replaced by a fresh one.
   *
   * @return false if the text carries no trigger
   */
  public boolean onTrigger(SlackEvent.Message message) {
    if (!isTrigger(message.text())) {
      return false;
    }

    Map<String, String> metadata =
        matchesResolution(message.text()) ? metadataExtractor.extract(message.text()) : Map.of();
    SessionKey key = new SessionKey(message.userId(), message.channelId(), message.threadTs());

    store.upsert(
        key,
        current -> {
          if (current == null || current.isSubmitted()) {
            return FeedbackSession.prompted(key, metadata, clock.instant());
          }
          return current.withMetadata(metadata);
        });

    Optional<String> promptTs =
        slack.postMessage(key.channelId(), key.threadTs(), composer.prompt(key.userId()));
    promptTs.ifPresent(ts -> store.updateIfPresent(key, s -> s.withPromptMessage(ts)));
    log.info("Feedback prompt sent for session {}", key);
    return true;
  }

  public ActionReply onAction(ActionEvent action) {
    if (action.userId() == null || action.userId().isBlank()
        || action.threadTs() == null || action.threadTs().isBlank()) {
      log.debug("Action {} without user or thread reference; ignored", action.actionId());
      return ActionReply.empty();
    }
    SessionKey key = new SessionKey(action.userId(), action.channelId(), action.threadTs());

    return switch (action.kind()) {
      case SHOW_FORM -> showForm(key);
      case RATING_SELECTED -> selectRating(key, action.value());
      case COMMENT_ENTERED -> enterComment(key, action.value());
      case SUBMIT -> submit(key, action.messageTs(), action.formState());
      case UNKNOWN -> {
        log.debug("Unrecognized action_id '{}' acknowledged", action.actionId());
        yield ActionReply.empty();
      }
    };
  }

  private ActionReply showForm(SessionKey key) {
    FeedbackSession session =
        store.upsert(
            key,
            current -> {
              if (current == null) {
                return FeedbackSession.prompted(key, Map.of(), clock.instant())
                    .withStatus(SessionStatus.FORM_DISPLAYED);
              }
              return current.status() == SessionStatus.PROMPTED
                  ? current.withStatus(SessionStatus.FORM_DISPLAYED)
                  : current;
            });

    if (!session.status().isOpen()) {
      return ActionReply.text(composer.alreadySubmitted());
    }

    Optional<String> formTs = slack.postMessage(key.channelId(), key.threadTs(), composer.form());
    formTs.ifPresent(ts -> store.updateIfPresent(key, s -> s.withFormMessage(ts)));
    log.info("Feedback form shown for session {}", key);
    return ActionReply.empty();
  }

  private ActionReply selectRating(SessionKey key, String value) {
    Integer rating = parseRating(value);
    if (rating == null) {
      return ActionReply.text(composer.ratingOutOfRange());
    }

    Optional<FeedbackSession> updated =
        store.updateIfPresent(key, s -> s.status().isOpen() ? s.withRating(rating) : s);
    if (updated.isEmpty()) {
      log.debug("Rating for unknown session {}; stale form", key);
    }
    return ActionReply.empty();
  }

  private ActionReply enterComment(SessionKey key, String text) {
    String comments = text == null ? "" : text.trim();
    Optional<FeedbackSession> updated =
        store.updateIfPresent(key, s -> s.status().isOpen() ? s.withComments(comments) : s);
    if (updated.isEmpty()) {
      log.debug("Comment for unknown session {}; stale form", key);
    }
    return ActionReply.empty();
  }

  private ActionReply submit(SessionKey key, String sourceMessageTs, FormState form) {
    SubmissionOutcome outcome = finalizer.submit(key, sourceMessageTs, form);
    return switch (outcome.status()) {
      case SUBMITTED -> ActionReply.empty();
      case RATING_REQUIRED -> ActionReply.text(composer.ratingRequired());
      case ALREADY_SUBMITTED -> ActionReply.text(composer.alreadySubmitted());
      case NO_SESSION -> ActionReply.text(composer.formExpired());
    };
  }

  private Integer parseRating(String value) {
    if (value == null) {
      return null;
    }
    try {
      int r = Integer.parseInt(value.trim());
      return properties.isValidRating(r) ? r : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private boolean matchesTrigger(String text) {
    return containsIgnoreCase(text, properties.triggerPhrase());
  }

  private boolean matchesResolution(String text) {
    return containsIgnoreCase(text, properties.resolutionTrigger());
  }

  private static boolean containsIgnoreCase(String text, String phrase) {
    if (text == null || phrase == null || phrase.isBlank()) {
      return false;
    }
    return text.toLowerCase(Locale.ROOT).contains(phrase.toLowerCase(Locale.ROOT));
  }
}
