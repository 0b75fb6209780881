package com.threadfeedback.slackfeedback.event;

import java.util.Arrays;

/** Interactive element identifiers understood by the feedback workflow. */
public enum ActionKind {
  SHOW_FORM("show_form"),
  RATING_SELECTED("rating_select"),
  COMMENT_ENTERED("feedback_text"),
  SUBMIT("submit_feedback"),
  UNKNOWN("");

  private final String actionId;

  ActionKind(String actionId) {
    this.actionId = actionId;
  }

  public String actionId() {
    return actionId;
  }

  public static ActionKind fromActionId(String actionId) {
    if (actionId == null || actionId.isBlank()) {
      return UNKNOWN;
    }
    return Arrays.stream(values())
        .filter(k -> k != UNKNOWN && k.actionId.equals(actionId))
        .findFirst()
        .orElse(UNKNOWN);
  }
}
