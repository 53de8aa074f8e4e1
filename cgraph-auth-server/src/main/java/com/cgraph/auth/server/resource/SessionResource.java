package com.cgraph.auth.server.resource;

import com.cgraph.auth.model.session.SessionListResponse;
import com.cgraph.auth.model.session.SessionView;
import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.manager.SessionRegistry;
import com.cgraph.auth.server.store.Session;
import com.cgraph.auth.server.store.UserRecord;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.stream.Collectors;

/**
 * Session listing and revocation for the bearer of an access token.
 */
@Path("/auth/sessions")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

  private final SessionRegistry sessionRegistry;
  private final AuthenticationService authenticationService;

  public SessionResource(SessionRegistry sessionRegistry, AuthenticationService authenticationService) {
    this.sessionRegistry = sessionRegistry;
    this.authenticationService = authenticationService;
  }

  @GET
  public SessionListResponse list(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    return new SessionListResponse(sessionRegistry.listActive(user.id()).stream()
        .map(SessionResource::toView)
        .collect(Collectors.toList()));
  }

  @DELETE
  @Path("/{id}")
  public Response revoke(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                         @PathParam("id") String sessionId) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.unwrap(sessionRegistry.revokeOwned(user.id(), sessionId));
    return Response.noContent().build();
  }

  @DELETE
  public Response revokeAll(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    sessionRegistry.revokeAll(user.id());
    return Response.noContent().build();
  }

  private static SessionView toView(Session session) {
    return new SessionView(session.id(), session.userAgent(), session.ipAddress(),
        session.createdAt().toString(), session.lastActiveAt().toString(),
        session.expiresAt().toString());
  }
}
