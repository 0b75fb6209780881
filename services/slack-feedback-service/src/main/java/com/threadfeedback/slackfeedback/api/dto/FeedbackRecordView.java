package com.threadfeedback.slackfeedback.api.dto;

import com.threadfeedback.slackfeedback.persistence.FeedbackRecordEntity;
import java.time.Instant;

public record FeedbackRecordView(
    Long id,
    String channelId,
    String channelName,
    String threadTs,
    String userId,
    String userName,
    int rating,
    String comments,
    String ticketId,
    String correlationId,
    Instant submittedAt) {

  public static FeedbackRecordView from(FeedbackRecordEntity e) {
    return new FeedbackRecordView(
        e.getId(),
        e.getChannelId(),
        e.getChannelName(),
        e.getThreadTs(),
        e.getUserId(),
        e.getUserName(),
        e.getRating(),
        e.getComments(),
        e.getTicketId(),
        e.getCorrelationId(),
        e.getSubmittedAt());
  }
}
