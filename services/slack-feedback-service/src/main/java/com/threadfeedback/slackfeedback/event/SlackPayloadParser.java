package com.threadfeedback.slackfeedback.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Turns raw webhook bodies into {@link SlackEvent}s and {@link ActionEvent}s. */
@Component
public class SlackPayloadParser {

  private final ObjectMapper mapper;

  public SlackPayloadParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public SlackEvent parseEvent(String body) {
    JsonNode root = readJson(body);
    String type = root.path("type").asText("");

    if ("url_verification".equals(type)) {
      return new SlackEvent.Challenge(root.path("challenge").asText(""));
    }
    if (!"event_callback".equals(type)) {
      return new SlackEvent.Ignored("type:" + type);
    }

    JsonNode event = root.path("event");
    String eventType = event.path("type").asText("");
    if (!"message".equals(eventType)) {
      return new SlackEvent.Ignored("event:" + eventType);
    }
    // bot_message, message_changed etc. all carry a subtype; our own posts carry bot_id
    if (event.hasNonNull("subtype")) {
      return new SlackEvent.Ignored("subtype:" + event.path("subtype").asText());
    }
    if (event.hasNonNull("bot_id")) {
      return new SlackEvent.Ignored("bot");
    }

    String userId = event.path("user").asText("");
    String channelId = event.path("channel").asText("");
    String ts = event.path("ts").asText("");
    if (userId.isBlank() || channelId.isBlank() || ts.isBlank()) {
      return new SlackEvent.Ignored("incomplete");
    }
    String threadTs = event.path("thread_ts").asText(ts);
    return new SlackEvent.Message(channelId, userId, event.path("text").asText(""), ts, threadTs);
  }

  /**
   * Parses the form-encoded body of an interactivity request.
   *
   * @return the first action, or empty for payloads without actions or of another type
   */
  public Optional<ActionEvent> parseAction(String formBody) {
    String payload = formField(formBody, "payload");
    if (payload == null || payload.isBlank()) {
      throw new IllegalArgumentException("Missing payload field");
    }

    JsonNode root = readJson(payload);
    if (!"block_actions".equals(root.path("type").asText(""))) {
      return Optional.empty();
    }
    JsonNode action = root.path("actions").path(0);
    if (action.isMissingNode()) {
      return Optional.empty();
    }

    JsonNode user = root.path("user");
    JsonNode container = root.path("container");
    JsonNode message = root.path("message");

    String channelId =
        root.path("channel").path("id").asText(container.path("channel_id").asText(""));
    String messageTs = container.path("message_ts").asText(message.path("ts").asText(""));
    String threadTs =
        firstNonBlank(
            container.path("thread_ts").asText(null),
            message.path("thread_ts").asText(null),
            messageTs);
    String actionId = action.path("action_id").asText("");

    return Optional.of(
        new ActionEvent(
            ActionKind.fromActionId(actionId),
            actionId,
            user.path("id").asText(""),
            firstNonBlank(user.path("username").asText(null), user.path("name").asText(null)),
            channelId,
            messageTs,
            threadTs,
            actionValue(action),
            formState(root.path("state").path("values"))));
  }

  private static FormState formState(JsonNode values) {
    JsonNode rating =
        values
            .path(FormState.RATING_BLOCK_ID)
            .path(ActionKind.RATING_SELECTED.actionId())
            .path("selected_option")
            .path("value");
    JsonNode comment =
        values.path(FormState.COMMENT_BLOCK_ID).path(ActionKind.COMMENT_ENTERED.actionId());
    // a reported but empty input comes as {"type":"plain_text_input","value":null}
    String comments = comment.isMissingNode() ? null : comment.path("value").asText("");
    return new FormState(textOrNull(rating), comments);
  }

  private static String textOrNull(JsonNode node) {
    return node.isMissingNode() || node.isNull() ? null : node.asText();
  }

  private static String actionValue(JsonNode action) {
    JsonNode selected = action.path("selected_option");
    if (!selected.isMissingNode() && !selected.isNull()) {
      return selected.path("value").asText(null);
    }
    JsonNode value = action.path("value");
    return value.isMissingNode() || value.isNull() ? null : value.asText();
  }

  private JsonNode readJson(String body) {
    if (body == null || body.isBlank()) {
      throw new IllegalArgumentException("Empty body");
    }
    try {
      return mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON body", e);
    }
  }

  static String formField(String formBody, String name) {
    if (formBody == null) {
      return null;
    }
    for (String pair : formBody.split("&")) {
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
        return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  private static String firstNonBlank(String... values) {
    for (String v : values) {
      if (v != null && !v.isBlank()) {
        return v;
      }
    }
    return null;
  }
}
