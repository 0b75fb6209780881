package com.threadfeedback.slackfeedback.common.web;

/** Feedback could not be stored; mapped to HTTP 500 by ApiExceptionHandler. */
public class PersistenceFailureException extends RuntimeException {
  public PersistenceFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
