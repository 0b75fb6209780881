package com.threadfeedback.slackfeedback.session;

public enum SessionStatus {
  PROMPTED,
  FORM_DISPLAYED,
  /** A submit has claimed the session and the record is being written. */
  SUBMITTING,
  SUBMITTED;

  public boolean isOpen() {
    return this == PROMPTED || this == FORM_DISPLAYED;
  }
}
