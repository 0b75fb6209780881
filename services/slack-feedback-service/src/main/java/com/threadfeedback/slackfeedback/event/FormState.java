package com.threadfeedback.slackfeedback.event;

/**
 * Values of the feedback form's inputs as Slack reports them in {@code state.values} of a
 * {@code block_actions} payload. Slack sends the current input values with every click, so a
 * comment typed without pressing Enter still arrives with the submit.
 *
 * @param rating selected rating option value, or null when nothing is selected
 * @param comments text of the comment input; null when the payload does not report the input,
 *     empty when the input is reported but blank
 */
public record FormState(String rating, String comments) {

  public static final String RATING_BLOCK_ID = "feedback_form";
  public static final String COMMENT_BLOCK_ID = "feedback_comment";

  public static final FormState EMPTY = new FormState(null, null);

  public boolean isEmpty() {
    return rating == null && comments == null;
  }
}
