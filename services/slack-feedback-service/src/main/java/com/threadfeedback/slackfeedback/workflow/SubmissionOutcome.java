package com.threadfeedback.slackfeedback.workflow;

import com.threadfeedback.slackfeedback.persistence.FeedbackRecordEntity;

/** Result of one submit attempt. {@code record} is set only for {@link Status#SUBMITTED}. */
public record SubmissionOutcome(Status status, FeedbackRecordEntity record) {

  public enum Status {
    SUBMITTED,
    RATING_REQUIRED,
    ALREADY_SUBMITTED,
    NO_SESSION
  }

  static SubmissionOutcome of(Status status) {
    return new SubmissionOutcome(status, null);
  }
}
