package com.threadfeedback.slackfeedback.common.web;

/** 401 with a stable JSON payload via ApiExceptionHandler. */
public class InvalidSignatureException extends RuntimeException {
  public InvalidSignatureException() {
    super("invalid signature");
  }
}
