package com.cgraph.auth.server.breach;

/**
 * The breach service could not be reached or answered unexpectedly. Callers treat this as
 * "no finding".
 */
public class BreachCheckException extends RuntimeException {

  public BreachCheckException(String message, Throwable cause) {
    super(message, cause);
  }
}
