package com.threadfeedback.slackfeedback.session;

/** One participant's feedback conversation within one message thread. */
public record SessionKey(String userId, String channelId, String threadTs) {

  public SessionKey {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    if (threadTs == null || threadTs.isBlank()) {
      throw new IllegalArgumentException("threadTs is required");
    }
    channelId = channelId == null ? "" : channelId;
  }

  @Override
  public String toString() {
    return userId + "|" + channelId + "|" + threadTs;
  }
}
