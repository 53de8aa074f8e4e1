package com.cgraph.auth.server.manager;

import java.util.List;

/**
 * Candidate second-factor material returned by setup. Nothing here is persisted.
 *
 * @param secretBase32    the secret for manual entry
 * @param provisioningUri {@code otpauth://} URI
 * @param backupCodes     plaintext codes in {@code XXXX-XXXX} form
 */
public record SecondFactorSetup(String secretBase32, String provisioningUri, List<String> backupCodes) {

  public SecondFactorSetup {
    backupCodes = List.copyOf(backupCodes);
  }
}
