package com.threadfeedback.slackfeedback.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Feedback handed in directly rather than through the Slack form. */
public record FeedbackSubmissionRequest(
    @NotBlank @Size(max = 32) String channelId,
    @Size(max = 128) String channelName,
    @NotBlank @Size(max = 32) String threadTs,
    @NotBlank @Size(max = 32) String userId,
    @Size(max = 128) String userName,
    @NotNull Integer rating,
    String comments,
    @Size(max = 64) String ticketId,
    @Size(max = 128) String correlationId) {}
