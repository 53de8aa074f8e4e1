package com.cgraph.auth.server.result;

import java.util.function.Function;

/**
 * Outcome of an authentication operation: either a value or an {@link AuthError}.
 * <p>
 * Every expected failure travels through this type. Infrastructure faults are thrown as
 * {@link com.cgraph.auth.crypto.common.AuthFaultException} instead and never appear here.
 *
 * @param <T> success value type
 */
public sealed interface AuthResult<T> permits AuthResult.Success, AuthResult.Failure {

  static <T> AuthResult<T> success(T value) {
    return new Success<>(value);
  }

  static <T> AuthResult<T> failure(AuthError error) {
    return new Failure<>(error);
  }

  /**
   * Success without a meaningful value.
   *
   * @return a successful empty result
   */
  static AuthResult<Void> ok() {
    return new Success<>(null);
  }

  boolean isSuccess();

  /**
   * The success value.
   *
   * @return the value
   * @throws IllegalStateException if this is a failure
   */
  T get();

  /**
   * The failure kind.
   *
   * @return the error
   * @throws IllegalStateException if this is a success
   */
  AuthError getError();

  <U> AuthResult<U> map(Function<? super T, ? extends U> mapper);

  <U> AuthResult<U> flatMap(Function<? super T, AuthResult<U>> mapper);

  /**
   * Re-types a failure. Only valid on failures.
   *
   * @param <U> target type
   * @return the same error under another value type
   */
  default <U> AuthResult<U> propagate() {
    return failure(getError());
  }

  record Success<T>(T value) implements AuthResult<T> {

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T get() {
      return value;
    }

    @Override
    public AuthError getError() {
      throw new IllegalStateException("Result is a success");
    }

    @Override
    public <U> AuthResult<U> map(Function<? super T, ? extends U> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <U> AuthResult<U> flatMap(Function<? super T, AuthResult<U>> mapper) {
      return mapper.apply(value);
    }
  }

  record Failure<T>(AuthError error) implements AuthResult<T> {

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T get() {
      throw new IllegalStateException("Result is a failure: " + error.code());
    }

    @Override
    public AuthError getError() {
      return error;
    }

    @Override
    public <U> AuthResult<U> map(Function<? super T, ? extends U> mapper) {
      return new Failure<>(error);
    }

    @Override
    public <U> AuthResult<U> flatMap(Function<? super T, AuthResult<U>> mapper) {
      return new Failure<>(error);
    }
  }
}
