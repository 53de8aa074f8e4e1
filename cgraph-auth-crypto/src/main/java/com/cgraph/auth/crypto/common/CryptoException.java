package com.cgraph.auth.crypto.common;

/**
 * A cryptographic primitive failed unexpectedly (missing JCA provider, corrupt stored hash,
 * undecryptable sealed secret).
 */
public class CryptoException extends AuthFaultException {

  public CryptoException(String message) {
    super(message);
  }

  public CryptoException(String message, Throwable cause) {
    super(message, cause);
  }
}
