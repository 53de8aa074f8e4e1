package com.cgraph.auth.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body for every non-2xx answer.
 *
 * @param error         stable snake_case error code
 * @param correlationId present only for {@code internal_error}; matches the server log line
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("correlationId") String correlationId) {

  public ErrorResponse(String error) {
    this(error, null);
  }
}
