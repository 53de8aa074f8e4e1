package com.cgraph.auth.server.manager;

/**
 * Request metadata captured on a new session.
 *
 * @param userAgent user agent header, may be null
 * @param clientIp  best guess at the client address, may be null
 */
public record SessionContext(String userAgent, String clientIp) {

  public static final SessionContext UNKNOWN = new SessionContext(null, null);

  /**
   * Picks the client address, preferring the first hop of {@code X-Forwarded-For} over the
   * socket address so deployments behind a reverse proxy record the real client.
   *
   * @param userAgent     user agent header
   * @param forwardedFor  raw {@code X-Forwarded-For} header, may be null
   * @param remoteAddress socket peer address, may be null
   * @return the context
   */
  public static SessionContext of(String userAgent, String forwardedFor, String remoteAddress) {
    String ip = remoteAddress;
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String first = forwardedFor.split(",", 2)[0].strip();
      if (!first.isEmpty()) {
        ip = first;
      }
    }
    return new SessionContext(userAgent, ip);
  }
}
