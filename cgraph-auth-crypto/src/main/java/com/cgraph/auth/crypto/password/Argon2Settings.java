package com.cgraph.auth.crypto.password;

/**
 * Argon2id cost parameters.
 *
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost
 * @param parallelism lanes
 */
public record Argon2Settings(int memoryKib, int iterations, int parallelism) {

  /**
   * Production defaults: 64 MiB, 3 passes, one lane.
   */
  public static final Argon2Settings DEFAULT = new Argon2Settings(65536, 3, 1);

  public Argon2Settings {
    if (memoryKib < 8 * parallelism || iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("Invalid Argon2id parameters");
    }
  }
}
