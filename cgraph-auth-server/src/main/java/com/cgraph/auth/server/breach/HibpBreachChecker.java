package com.cgraph.auth.server.breach;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pwned Passwords range API client (k-anonymity). Only the first five hex characters of the SHA-1
 * leave the process; the suffix is matched locally against the returned list.
 */
public class HibpBreachChecker implements PasswordBreachChecker {

  private static final Logger log = LoggerFactory.getLogger(HibpBreachChecker.class);

  public static final URI DEFAULT_ENDPOINT = URI.create("https://api.pwnedpasswords.com/range/");
  private static final int PREFIX_LENGTH = 5;

  private final HttpClient httpClient;
  private final URI endpoint;
  private final Duration timeout;

  /**
   * Creates a checker.
   *
   * @param httpClient client used for the range request
   * @param endpoint   range endpoint, ending in {@code /}
   * @param timeout    per-request timeout
   */
  public HibpBreachChecker(HttpClient httpClient, URI endpoint, Duration timeout) {
    this.httpClient = httpClient;
    this.endpoint = endpoint;
    this.timeout = timeout;
  }

  @Override
  public BreachStatus check(String sha1Hex) {
    String prefix = sha1Hex.substring(0, PREFIX_LENGTH);
    String suffix = sha1Hex.substring(PREFIX_LENGTH);
    HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint.resolve(prefix))
        .timeout(timeout)
        .header("Add-Padding", "true")
        .header("User-Agent", "cgraph-auth")
        .GET()
        .build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new BreachCheckException("Breach service returned HTTP " + response.statusCode(), null);
      }
      return parse(response.body(), suffix);
    } catch (IOException e) {
      throw new BreachCheckException("Breach service request failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BreachCheckException("Breach service request interrupted", e);
    }
  }

  static BreachStatus parse(String body, String suffix) {
    for (String line : body.split("\r?\n")) {
      int colon = line.indexOf(':');
      if (colon < 0) {
        continue;
      }
      if (line.substring(0, colon).strip().equalsIgnoreCase(suffix)) {
        long count;
        try {
          count = Long.parseLong(line.substring(colon + 1).strip());
        } catch (NumberFormatException e) {
          log.debug("Unparseable count in breach response line");
          count = 1;
        }
        // padding entries carry a zero count
        return count > 0 ? BreachStatus.found(count) : BreachStatus.CLEAN;
      }
    }
    return BreachStatus.CLEAN;
  }
}
