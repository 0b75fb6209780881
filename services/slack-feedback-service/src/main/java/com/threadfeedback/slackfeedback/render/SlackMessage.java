package com.threadfeedback.slackfeedback.render;

import java.util.List;
import java.util.Map;

/**
 * Outbound message content: fallback text plus Block Kit blocks.
 *
 * <p>{@code blocks} may be empty for plain-text messages.
 */
public record SlackMessage(String text, List<Map<String, Object>> blocks) {

  public SlackMessage {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }

  public static SlackMessage plain(String text) {
    return new SlackMessage(text, List.of());
  }
}
