package com.threadfeedback.slackfeedback.api;

import com.threadfeedback.slackfeedback.common.web.InvalidSignatureException;
import com.threadfeedback.slackfeedback.event.SlackEventRouter;
import com.threadfeedback.slackfeedback.event.SlackPayloadParser;
import com.threadfeedback.slackfeedback.security.SlackRequestVerifier;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Slack Events API and interactivity endpoints.
 *
 * <p>The raw body is read straight from the request stream: the signature covers the exact bytes,
 * so nothing may parse the body before it is verified.
 */
@RestController
@RequestMapping(path = "/slack", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class SlackWebhookController {

  private final SlackRequestVerifier verifier;
  private final SlackPayloadParser parser;
  private final SlackEventRouter router;

  public SlackWebhookController(
      SlackRequestVerifier verifier, SlackPayloadParser parser, SlackEventRouter router) {
    this.verifier = verifier;
    this.parser = parser;
    this.router = router;
  }

  @PostMapping("/events")
  public Map<String, Object> events(
      HttpServletRequest request,
      @RequestHeader(value = SlackRequestVerifier.TIMESTAMP_HEADER, required = false)
          String timestamp,
      @RequestHeader(value = SlackRequestVerifier.SIGNATURE_HEADER, required = false)
          String signature)
      throws IOException {
    String body = verifiedBody(request, timestamp, signature);
    return router.routeEvent(parser.parseEvent(body));
  }

  @PostMapping("/actions")
  public Map<String, Object> actions(
      HttpServletRequest request,
      @RequestHeader(value = SlackRequestVerifier.TIMESTAMP_HEADER, required = false)
          String timestamp,
      @RequestHeader(value = SlackRequestVerifier.SIGNATURE_HEADER, required = false)
          String signature)
      throws IOException {
    String body = verifiedBody(request, timestamp, signature);
    return parser.parseAction(body).map(router::routeAction).orElseGet(Map::of);
  }

  private String verifiedBody(HttpServletRequest request, String timestamp, String signature)
      throws IOException {
    String body = new String(request.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    if (!verifier.verify(body, signature, timestamp)) {
      log.warn("Slack signature rejected for {} {}", request.getMethod(), request.getRequestURI());
      throw new InvalidSignatureException();
    }
    return body;
  }
}
