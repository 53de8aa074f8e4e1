package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of an on-demand breach lookup. An unavailable breach service reports
 * {@code breached=false}.
 *
 * @param breached    whether the password appears in the corpus
 * @param occurrences how many times it appears
 */
public record PasswordExposureResponse(
    @JsonProperty("breached") boolean breached,
    @JsonProperty("occurrences") long occurrences) {
}
