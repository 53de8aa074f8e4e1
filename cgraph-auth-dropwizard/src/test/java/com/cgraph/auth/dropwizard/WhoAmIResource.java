package com.cgraph.auth.dropwizard;

import com.cgraph.auth.dropwizard.auth.CgraphPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Test-only protected endpoint that returns the authenticated user's id.
 * Demonstrates how consumers protect their own routes using {@code @Auth CgraphPrincipal}.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  @GET
  public Map<String, String> whoAmI(@Auth CgraphPrincipal principal) {
    return Map.of("userId", principal.userId());
  }
}
