package com.threadfeedback.slackfeedback.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Feedback workflow settings.
 *
 * <p>Trigger phrases are matched case-insensitively as substrings. Both patterns must carry one
 * capture group holding the extracted value.
 */
@ConfigurationProperties(prefix = "feedback")
public record FeedbackProperties(
    String triggerPhrase,
    String resolutionTrigger,
    Integer ratingMin,
    Integer ratingMax,
    Duration sessionTtl,
    String ticketPattern,
    String correlationPattern) {

  public static final String DEFAULT_TICKET_PATTERN =
      "(?i)\\bticket(?:\\s*(?:id|number|no\\.?))?\\s*[:#]?\\s*([A-Za-z]+-\\d+|\\d+)";
  public static final String DEFAULT_CORRELATION_PATTERN =
      "(?i)\\bsession(?:\\s*id)?\\s*[:#]?\\s*([A-Za-z0-9][A-Za-z0-9_-]*)";

  public FeedbackProperties {
    triggerPhrase = blankToDefault(triggerPhrase, "feedback");
    resolutionTrigger = blankToDefault(resolutionTrigger, "resolved");
    ratingMin = ratingMin == null ? 1 : ratingMin;
    ratingMax = ratingMax == null ? 5 : ratingMax;
    sessionTtl = sessionTtl == null ? Duration.ofHours(24) : sessionTtl;
    ticketPattern = blankToDefault(ticketPattern, DEFAULT_TICKET_PATTERN);
    correlationPattern = blankToDefault(correlationPattern, DEFAULT_CORRELATION_PATTERN);
    if (ratingMin > ratingMax) {
      throw new IllegalArgumentException(
          "feedback.rating-min must not exceed feedback.rating-max");
    }
  }

  public static FeedbackProperties defaults() {
    return new FeedbackProperties(null, null, null, null, null, null, null);
  }

  public boolean isValidRating(int rating) {
    return rating >= ratingMin && rating <= ratingMax;
  }

  private static String blankToDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
