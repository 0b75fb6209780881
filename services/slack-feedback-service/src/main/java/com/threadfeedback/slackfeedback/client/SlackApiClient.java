package com.threadfeedback.slackfeedback.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.threadfeedback.slackfeedback.render.SlackMessage;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Thin Slack Web API client.
 *
 * <p>Failures are logged and swallowed: posting returns an empty reference and lookups fall back
 * to the raw id. Nothing here retries.
 */
@Service
@Slf4j
public class SlackApiClient {

  private final RestClient rest;
  private final String botToken;

  public SlackApiClient(
      RestClient.Builder builder,
      @Value("${slack.bot-token:}") String botToken,
      @Value("${slack.api-base-url:https://slack.com/api}") String baseUrl) {
    this.botToken = botToken == null ? "" : botToken.trim();
    this.rest = builder.baseUrl(baseUrl).build();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  /**
   * Posts a message, into {@code threadTs}'s thread when given.
   *
   * @return the {@code ts} of the new message
   */
  public Optional<String> postMessage(String channelId, String threadTs, SlackMessage message) {
    if (!isConfigured()) {
      log.warn("Slack bot token is not configured; skip posting to channel={}", channelId);
      return Optional.empty();
    }

    Map<String, Object> body = new HashMap<>();
    body.put("channel", channelId);
    body.put("text", message.text());
    if (threadTs != null && !threadTs.isBlank()) {
      body.put("thread_ts", threadTs);
    }
    if (!message.blocks().isEmpty()) {
      body.put("blocks", message.blocks());
    }

    JsonNode res = call("chat.postMessage", body);
    if (res == null) {
      return Optional.empty();
    }
    String ts = res.path("ts").asText("");
    return ts.isBlank() ? Optional.empty() : Optional.of(ts);
  }

  /** Replaces text and blocks of an existing message; an empty block list removes all blocks. */
  public boolean updateMessage(String channelId, String messageTs, SlackMessage message) {
    if (!isConfigured()) {
      log.warn("Slack bot token is not configured; skip chat.update");
      return false;
    }
    if (messageTs == null || messageTs.isBlank()) {
      return false;
    }

    Map<String, Object> body = new HashMap<>();
    body.put("channel", channelId);
    body.put("ts", messageTs);
    body.put("text", message.text());
    body.put("blocks", message.blocks());
    return call("chat.update", body) != null;
  }

  public String userDisplayName(String userId) {
    if (!isConfigured() || userId == null || userId.isBlank()) {
      return userId;
    }
    JsonNode res = get("users.info?user={id}", userId);
    if (res == null) {
      return userId;
    }
    JsonNode user = res.path("user");
    String display = user.path("profile").path("display_name").asText("");
    if (display.isBlank()) {
      display = user.path("real_name").asText("");
    }
    if (display.isBlank()) {
      display = user.path("name").asText("");
    }
    return display.isBlank() ? userId : display;
  }

  public String channelName(String channelId) {
    if (!isConfigured() || channelId == null || channelId.isBlank()) {
      return channelId;
    }
    JsonNode res = get("conversations.info?channel={id}", channelId);
    if (res == null) {
      return channelId;
    }
    String name = res.path("channel").path("name").asText("");
    return name.isBlank() ? channelId : name;
  }

  private JsonNode call(String method, Map<String, Object> body) {
    try {
      JsonNode res =
          rest.post()
              .uri("/" + method)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + botToken)
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
      return checkOk(method, res);
    } catch (Exception e) {
      log.warn("Slack {} failed: {}", method, e.getMessage());
      return null;
    }
  }

  private JsonNode get(String methodWithQuery, String id) {
    String method = methodWithQuery.substring(0, methodWithQuery.indexOf('?'));
    try {
      JsonNode res =
          rest.get()
              .uri("/" + methodWithQuery, id)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + botToken)
              .retrieve()
              .body(JsonNode.class);
      return checkOk(method, res);
    } catch (Exception e) {
      log.warn("Slack {} failed: {}", method, e.getMessage());
      return null;
    }
  }

  // Slack answers HTTP 200 with {"ok": false, "error": "..."} for API-level errors
  private static JsonNode checkOk(String method, JsonNode res) {
    if (res == null || !res.path("ok").asBoolean(false)) {
      log.warn(
          "Slack {} returned error: {}",
          method,
          res == null ? "empty response" : res.path("error").asText("unknown"));
      return null;
    }
    return res;
  }
}
