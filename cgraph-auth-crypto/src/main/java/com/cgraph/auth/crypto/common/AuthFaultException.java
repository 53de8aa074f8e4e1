package com.cgraph.auth.crypto.common;

/**
 * Base type for infrastructure faults: a primitive or a store failed in a way the caller cannot
 * recover from. Faults are never turned into user-facing results. The HTTP edge logs them with a
 * correlation id and answers with an opaque internal error.
 */
public class AuthFaultException extends RuntimeException {

  public AuthFaultException(String message) {
    super(message);
  }

  public AuthFaultException(String message, Throwable cause) {
    super(message, cause);
  }
}
