package com.threadfeedback.slackfeedback.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Verifies Slack request signatures ({@code v0=HMAC-SHA256(secret, "v0:" + ts + ":" + body)}).
 *
 * <p>Requests whose timestamp is further than {@code slack.request-max-age} from now are rejected
 * before the signature is even computed.
 */
@Component
public class SlackRequestVerifier {

  public static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";
  public static final String SIGNATURE_HEADER = "X-Slack-Signature";

  private static final String VERSION = "v0";
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final byte[] signingSecret;
  private final Duration maxAge;
  private final Clock clock;

  public SlackRequestVerifier(
      @Value("${slack.signing-secret:}") String signingSecret,
      @Value("${slack.request-max-age:PT5M}") Duration maxAge,
      Clock clock) {
    String secret = signingSecret == null ? "" : signingSecret.trim();
    this.signingSecret = secret.getBytes(StandardCharsets.UTF_8);
    this.maxAge = maxAge;
    this.clock = clock;
  }

  public boolean verify(String body, String signature, String timestamp) {
    if (signingSecret.length == 0 || signature == null || timestamp == null) {
      return false;
    }

    long skew;
    try {
      long ts = Long.parseLong(timestamp.trim());
      skew = Math.abs(Math.subtractExact(clock.instant().getEpochSecond(), ts));
    } catch (NumberFormatException | ArithmeticException e) {
      return false;
    }
    // Math.abs(Long.MIN_VALUE) stays negative
    if (skew < 0 || skew > maxAge.toSeconds()) {
      return false;
    }

    String expected = sign(timestamp.trim(), body == null ? "" : body);
    byte[] provided = signature.trim().getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided);
  }

  String sign(String timestamp, String body) {
    String base = VERSION + ":" + timestamp + ":" + body;
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(signingSecret, HMAC_ALGORITHM));
      return VERSION + "=" + hex(mac.doFinal(base.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 is not available", e);
    }
  }

  private static String hex(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      sb.append(String.format("%02x", b));
    }
    return sb.toString();
  }
}
