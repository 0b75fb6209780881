package com.threadfeedback.slackfeedback.event;

/**
 * First action of a {@code block_actions} payload.
 *
 * @param messageTs timestamp of the message carrying the clicked element
 * @param threadTs thread the message lives in; equals {@code messageTs} for top-level messages
 * @param value button value, selected option value or text input value, whichever applies
 * @param formState input values reported alongside the action
 */
public record ActionEvent(
    ActionKind kind,
    String actionId,
    String userId,
    String userName,
    String channelId,
    String messageTs,
    String threadTs,
    String value,
    FormState formState) {

  public ActionEvent {
    formState = formState == null ? FormState.EMPTY : formState;
  }

  public ActionEvent(
      ActionKind kind,
      String actionId,
      String userId,
      String userName,
      String channelId,
      String messageTs,
      String threadTs,
      String value) {
    this(kind, actionId, userId, userName, channelId, messageTs, threadTs, value, FormState.EMPTY);
  }
}
