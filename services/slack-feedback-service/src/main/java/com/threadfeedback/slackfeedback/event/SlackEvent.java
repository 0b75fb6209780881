package com.threadfeedback.slackfeedback.event;

/** One parsed delivery of the Slack Events API. */
public interface SlackEvent {

  /** {@code url_verification} handshake; the token is echoed back verbatim. */
  record Challenge(String token) implements SlackEvent {}

  /**
   * A user-authored channel message. {@code threadTs} is the thread anchor: the parent's {@code
   * thread_ts} for replies, the message's own {@code ts} otherwise.
   */
  record Message(String channelId, String userId, String text, String ts, String threadTs)
      implements SlackEvent {}

  /** Anything the router does not act on (other event types, bot echoes, edits). */
  record Ignored(String reason) implements SlackEvent {}
}
