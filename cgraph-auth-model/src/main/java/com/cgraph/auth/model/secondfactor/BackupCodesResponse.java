package com.cgraph.auth.model.secondfactor;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A regenerated backup-code set. Earlier codes no longer work.
 *
 * @param backupCodes plaintext codes, shown once
 */
public record BackupCodesResponse(@JsonProperty("backupCodes") List<String> backupCodes) {
}
