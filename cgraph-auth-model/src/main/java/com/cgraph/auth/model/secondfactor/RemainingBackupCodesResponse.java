package com.cgraph.auth.model.secondfactor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param remaining unused backup codes left after the operation
 */
public record RemainingBackupCodesResponse(@JsonProperty("remaining") int remaining) {
}
