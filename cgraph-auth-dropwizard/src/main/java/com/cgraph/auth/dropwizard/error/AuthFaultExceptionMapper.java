package com.cgraph.auth.dropwizard.error;

import com.cgraph.auth.crypto.common.AuthFaultException;
import com.cgraph.auth.model.error.ErrorResponse;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns infrastructure faults into an opaque 500. The details go to the log under a fresh
 * correlation id; the client only sees {@code internal_error} and that id.
 */
@Provider
public class AuthFaultExceptionMapper implements ExceptionMapper<AuthFaultException> {

  private static final Logger log = LoggerFactory.getLogger(AuthFaultExceptionMapper.class);
  static final String INTERNAL_ERROR = "internal_error";

  @Override
  public Response toResponse(AuthFaultException exception) {
    String correlationId = UUID.randomUUID().toString();
    log.error("Authentication fault correlationId={}", correlationId, exception);
    return Response.serverError()
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(INTERNAL_ERROR, correlationId))
        .build();
  }
}
