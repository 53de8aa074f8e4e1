package com.cgraph.auth.server.store;

import com.cgraph.auth.crypto.common.AuthFaultException;

/**
 * The backing store failed or returned data that violates its own invariants.
 */
public class StoreException extends AuthFaultException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
