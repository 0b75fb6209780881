package com.threadfeedback.slackfeedback.render;

import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import com.threadfeedback.slackfeedback.event.ActionKind;
import com.threadfeedback.slackfeedback.event.FormState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the Block Kit payloads of the feedback conversation.
 *
 * <p>Pure: output depends only on the arguments and the configured rating range. Maps are
 * insertion-ordered so serialized JSON is stable.
 */
@Component
public class MessageComposer {

  private final int ratingMin;
  private final int ratingMax;

  public MessageComposer(FeedbackProperties properties) {
    this.ratingMin = properties.ratingMin();
    this.ratingMax = properties.ratingMax();
  }

  /** Invitation with a single "yes" button that opens the form. */
  public SlackMessage prompt(String userId) {
    String text = "Hi <@" + userId + ">! Would you like to share feedback on this conversation?";
    List<Map<String, Object>> blocks = new ArrayList<>();
    blocks.add(section(text));
    blocks.add(
        actions(
            "feedback_prompt",
            List.of(button(ActionKind.SHOW_FORM.actionId(), "Yes, give feedback", "yes"))));
    return new SlackMessage(text, blocks);
  }

  /** Rating select, free-text comment input and submit button. */
  public SlackMessage form() {
    String text = "Please rate your experience from " + ratingMin + " to " + ratingMax + ".";

    List<Map<String, Object>> options = new ArrayList<>();
    for (int r = ratingMin; r <= ratingMax; r++) {
      options.add(option(String.valueOf(r), String.valueOf(r)));
    }
    Map<String, Object> select = new LinkedHashMap<>();
    select.put("type", "static_select");
    select.put("action_id", ActionKind.RATING_SELECTED.actionId());
    select.put("placeholder", plainText("Select a rating"));
    select.put("options", options);

    Map<String, Object> ratingSection = section(text);
    ratingSection.put("block_id", FormState.RATING_BLOCK_ID);
    ratingSection.put("accessory", select);

    Map<String, Object> input = new LinkedHashMap<>();
    input.put("type", "plain_text_input");
    input.put("action_id", ActionKind.COMMENT_ENTERED.actionId());
    input.put("multiline", false);
    input.put("placeholder", plainText("Anything else you'd like to tell us?"));
    input.put("dispatch_action_config", Map.of("trigger_actions_on", List.of("on_enter_pressed")));

    Map<String, Object> commentBlock = new LinkedHashMap<>();
    commentBlock.put("type", "input");
    commentBlock.put("block_id", FormState.COMMENT_BLOCK_ID);
    commentBlock.put("dispatch_action", true);
    commentBlock.put("optional", true);
    commentBlock.put("label", plainText("Comments (optional)"));
    commentBlock.put("element", input);

    List<Map<String, Object>> blocks = new ArrayList<>();
    blocks.add(ratingSection);
    blocks.add(commentBlock);
    blocks.add(
        actions(
            "feedback_submit",
            List.of(button(ActionKind.SUBMIT.actionId(), "Submit feedback", "submit"))));
    return new SlackMessage(text, blocks);
  }

  /** Replacement for the form once the record is stored: no interactive elements left. */
  public SlackMessage confirmation(int rating, String comments) {
    StringBuilder sb = new StringBuilder();
    sb.append("Feedback received. Rating: ").append(rating).append("/").append(ratingMax);
    if (comments != null && !comments.isBlank()) {
      sb.append("\nComments: ").append(escape(comments));
    }
    String text = sb.toString();

    Map<String, Object> context = new LinkedHashMap<>();
    context.put("type", "context");
    context.put("elements", List.of(markdown(":white_check_mark: Submitted")));

    List<Map<String, Object>> blocks = new ArrayList<>();
    blocks.add(section(text));
    blocks.add(context);
    return new SlackMessage(text, blocks);
  }

  public SlackMessage thankYou(String userId) {
    return SlackMessage.plain("Thank you for your feedback, <@" + userId + ">!");
  }

  public String ratingRequired() {
    return "Please select a rating before submitting.";
  }

  public String ratingOutOfRange() {
    return "Please pick a rating between " + ratingMin + " and " + ratingMax + ".";
  }

  public String alreadySubmitted() {
    return "You've already submitted feedback for this conversation. Thank you!";
  }

  public String formExpired() {
    return "This feedback form has expired. Mention feedback in the thread to start again.";
  }

  /** Slack control characters, so user text cannot turn into mentions or links. */
  static String escape(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }

  private static Map<String, Object> section(String text) {
    Map<String, Object> block = new LinkedHashMap<>();
    block.put("type", "section");
    block.put("text", markdown(text));
    return block;
  }

  private static Map<String, Object> actions(String blockId, List<Map<String, Object>> elements) {
    Map<String, Object> block = new LinkedHashMap<>();
    block.put("type", "actions");
    block.put("block_id", blockId);
    block.put("elements", elements);
    return block;
  }

  private static Map<String, Object> button(String actionId, String label, String value) {
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("type", "button");
    b.put("action_id", actionId);
    b.put("text", plainText(label));
    b.put("value", value);
    b.put("style", "primary");
    return b;
  }

  private static Map<String, Object> option(String label, String value) {
    Map<String, Object> o = new LinkedHashMap<>();
    o.put("text", plainText(label));
    o.put("value", value);
    return o;
  }

  private static Map<String, Object> plainText(String text) {
    Map<String, Object> t = new LinkedHashMap<>();
    t.put("type", "plain_text");
    t.put("text", text);
    return t;
  }

  private static Map<String, Object> markdown(String text) {
    Map<String, Object> t = new LinkedHashMap<>();
    t.put("type", "mrkdwn");
    t.put("text", text);
    return t;
  }
}
