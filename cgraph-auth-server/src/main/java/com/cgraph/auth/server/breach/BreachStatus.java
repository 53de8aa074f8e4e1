package com.cgraph.auth.server.breach;

/**
 * Result of a breach lookup.
 *
 * @param breached    whether the password appears in the corpus
 * @param occurrences how many times, 0 when not breached or unknown
 */
public record BreachStatus(boolean breached, long occurrences) {

  public static final BreachStatus CLEAN = new BreachStatus(false, 0);

  public static BreachStatus found(long occurrences) {
    return new BreachStatus(true, occurrences);
  }
}
