package com.cgraph.auth.dropwizard;

import com.cgraph.auth.server.store.StoreException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Test-only endpoint whose storage is always down.
 */
@Path("/api/fault")
@Produces(MediaType.APPLICATION_JSON)
public class FaultResource {

  @GET
  public String fail() {
    throw new StoreException("connection refused: db.internal:5432");
  }
}
