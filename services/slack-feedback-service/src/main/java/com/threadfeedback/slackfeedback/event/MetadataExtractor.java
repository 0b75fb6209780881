package com.threadfeedback.slackfeedback.event;

import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Pulls ticket and correlation identifiers out of a resolution message. */
@Component
public class MetadataExtractor {

  public static final String TICKET_ID = "ticket_id";
  public static final String CORRELATION_ID = "correlation_id";

  private final Pattern ticketPattern;
  private final Pattern correlationPattern;

  public MetadataExtractor(FeedbackProperties properties) {
    this.ticketPattern = Pattern.compile(properties.ticketPattern());
    this.correlationPattern = Pattern.compile(properties.correlationPattern());
  }

  /** Missing fields are simply absent from the returned map. */
  public Map<String, String> extract(String text) {
    Map<String, String> out = new LinkedHashMap<>();
    if (text == null || text.isBlank()) {
      return out;
    }
    String normalized = normalize(text);
    find(ticketPattern, normalized).ifPresent(v -> out.put(TICKET_ID, v));
    find(correlationPattern, normalized).ifPresent(v -> out.put(CORRELATION_ID, v));
    return out;
  }

  static String normalize(String text) {
    return text.replaceAll("\\s+", " ").trim();
  }

  private static Optional<String> find(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    if (!m.find() || m.groupCount() < 1 || m.group(1) == null) {
      return Optional.empty();
    }
    return Optional.of(m.group(1));
  }
}
