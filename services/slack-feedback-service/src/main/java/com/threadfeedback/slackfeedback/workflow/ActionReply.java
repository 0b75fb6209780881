package com.threadfeedback.slackfeedback.workflow;

/** Acknowledgement for an interactive action; {@code text} is shown to the user when present. */
public record ActionReply(String text) {

  private static final ActionReply EMPTY = new ActionReply(null);

  public static ActionReply empty() {
    return EMPTY;
  }

  public static ActionReply text(String text) {
    return new ActionReply(text);
  }

  public boolean hasText() {
    return text != null && !text.isBlank();
  }
}
