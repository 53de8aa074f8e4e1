package com.cgraph.auth.server.breach;

/**
 * Looks a password up in a corpus of breached passwords.
 */
public interface PasswordBreachChecker {

  /**
   * @param sha1Hex upper-case hex SHA-1 of the password
   * @return the finding
   * @throws BreachCheckException if the corpus is unavailable
   */
  BreachStatus check(String sha1Hex);
}
