package com.cgraph.auth.dropwizard;

import com.cgraph.auth.crypto.common.RandomProvider;
import com.cgraph.auth.crypto.password.Argon2PasswordHasher;
import com.cgraph.auth.crypto.password.Argon2Settings;
import com.cgraph.auth.crypto.seal.SecretSealer;
import com.cgraph.auth.crypto.totp.Totp;
import com.cgraph.auth.dropwizard.auth.BearerTokenAuthenticator;
import com.cgraph.auth.dropwizard.auth.CgraphPrincipal;
import com.cgraph.auth.dropwizard.error.AuthFaultExceptionMapper;
import com.cgraph.auth.dropwizard.health.AuthCoreHealthCheck;
import com.cgraph.auth.server.breach.BreachCheckService;
import com.cgraph.auth.server.breach.HibpBreachChecker;
import com.cgraph.auth.server.manager.AccountLifecycleManager;
import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.manager.PasswordAuthenticator;
import com.cgraph.auth.server.manager.SecondFactorEngine;
import com.cgraph.auth.server.manager.SessionRegistry;
import com.cgraph.auth.server.manager.WalletChallengeAuthenticator;
import com.cgraph.auth.server.resource.AuthResource;
import com.cgraph.auth.server.resource.SecondFactorResource;
import com.cgraph.auth.server.resource.SessionResource;
import com.cgraph.auth.server.resource.WalletResource;
import com.cgraph.auth.server.store.InMemoryRefreshTokenDenylist;
import com.cgraph.auth.server.store.InMemorySessionStore;
import com.cgraph.auth.server.store.InMemoryUserStore;
import com.cgraph.auth.server.store.InMemoryWalletChallengeStore;
import com.cgraph.auth.server.store.RefreshTokenDenylist;
import com.cgraph.auth.server.store.SessionStore;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.store.WalletChallengeStore;
import com.cgraph.auth.server.token.TokenIssuer;
import com.cgraph.auth.server.token.TokenSettings;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the authentication core into an existing Dropwizard application.
 * <p>
 * Registers the auth JAX-RS resources, the health check, the fault mapper and a bearer-token
 * filter, so sibling resources can take an {@code @Auth CgraphPrincipal} parameter.
 * Requires a {@link CgraphAuthConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new CgraphAuthBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new CgraphAuthBundle<>(userStore, sessionStore, challengeStore, denylist));
 * }</pre>
 * The managers built in {@link #run} are available from the bundle afterwards, for example to
 * ban a user from an admin task.
 */
@Singleton
public class CgraphAuthBundle<C extends CgraphAuthConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(CgraphAuthBundle.class);

  private static final int MIN_KEY_BYTES = 32;
  private static final int BREACH_CHECK_QUEUE = 256;

  private final UserStore userStore;
  private final SessionStore sessionStore;
  private final WalletChallengeStore challengeStore;
  private final RefreshTokenDenylist denylist;
  private final Clock clock;

  private AuthenticationService authenticationService;
  private AccountLifecycleManager accountLifecycleManager;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only: users, sessions and spent refresh tokens are lost on restart.
   */
  public CgraphAuthBundle() {
    this(new InMemoryUserStore(), new InMemorySessionStore(), new InMemoryWalletChallengeStore(),
        new InMemoryRefreshTokenDenylist());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory authentication stores.               #
        # All users and sessions will be lost on restart.               #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   */
  @Inject
  public CgraphAuthBundle(UserStore userStore,
                          SessionStore sessionStore,
                          WalletChallengeStore challengeStore,
                          RefreshTokenDenylist denylist) {
    this(userStore, sessionStore, challengeStore, denylist, Clock.systemUTC());
  }

  CgraphAuthBundle(UserStore userStore, SessionStore sessionStore,
                   WalletChallengeStore challengeStore, RefreshTokenDenylist denylist, Clock clock) {
    this.userStore = userStore;
    this.sessionStore = sessionStore;
    this.challengeStore = challengeStore;
    this.denylist = denylist;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider random = new RandomProvider();
    Argon2PasswordHasher hasher = new Argon2PasswordHasher(new Argon2Settings(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism()), random);
    TokenIssuer tokenIssuer = new TokenIssuer(buildTokenSettings(configuration), denylist, userStore,
        clock);
    SessionRegistry sessionRegistry = new SessionRegistry(sessionStore, random, clock,
        Duration.ofDays(configuration.getSessionTtlDays()));
    BreachCheckService breachCheckService = buildBreachCheckService(configuration, environment);

    PasswordAuthenticator passwordAuthenticator = new PasswordAuthenticator(userStore, hasher,
        breachCheckService, sessionRegistry, clock);
    WalletChallengeAuthenticator walletAuthenticator = new WalletChallengeAuthenticator(
        challengeStore, userStore, random, clock, configuration.getAppName(),
        Duration.ofSeconds(configuration.getWalletChallengeTtlSeconds()));
    SecretSealer sealer = new SecretSealer(
        keyOrRandom(configuration.getTotpEncryptionKeyHex(), "totpEncryptionKeyHex", random), random);
    SecondFactorEngine secondFactorEngine = new SecondFactorEngine(userStore, sessionRegistry, sealer,
        Totp.standard(), random, clock, configuration.getAppName(), configuration.getBackupCodeCount());

    authenticationService = new AuthenticationService(passwordAuthenticator, walletAuthenticator,
        secondFactorEngine, tokenIssuer, sessionRegistry, userStore, clock);
    accountLifecycleManager = new AccountLifecycleManager(userStore, sessionRegistry, clock);

    environment.jersey().register(new AuthResource(authenticationService, passwordAuthenticator,
        breachCheckService));
    environment.jersey().register(new WalletResource(walletAuthenticator, authenticationService));
    environment.jersey().register(new SecondFactorResource(secondFactorEngine, authenticationService));
    environment.jersey().register(new SessionResource(sessionRegistry, authenticationService));
    environment.jersey().register(new AuthFaultExceptionMapper());
    environment.healthChecks().register("auth-core", new AuthCoreHealthCheck(tokenIssuer, hasher));

    // Bearer auth filter for sibling resources
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<CgraphPrincipal>()
            .setAuthenticator(new BearerTokenAuthenticator(authenticationService))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(CgraphPrincipal.class));
  }

  /**
   * Available once {@link #run} has completed.
   *
   * @return the login orchestrator
   */
  public AuthenticationService getAuthenticationService() {
    return requireRunning(authenticationService);
  }

  /**
   * Available once {@link #run} has completed.
   *
   * @return ban, unban and deactivate operations
   */
  public AccountLifecycleManager getAccountLifecycleManager() {
    return requireRunning(accountLifecycleManager);
  }

  private TokenSettings buildTokenSettings(C configuration) {
    return new TokenSettings(
        keyOrRandom(configuration.getJwtSecretHex(), "jwtSecretHex", new RandomProvider()),
        configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getAccessTokenTtlSeconds()),
        Duration.ofSeconds(configuration.getRefreshTokenTtlSeconds()),
        Duration.ofSeconds(configuration.getSecondFactorTokenTtlSeconds()));
  }

  private BreachCheckService buildBreachCheckService(C configuration, Environment environment) {
    BreachCheckConfiguration breach = configuration.getBreachCheck();
    Duration timeout = Duration.ofMillis(breach.getTimeoutMillis());
    ExecutorService executor = environment.lifecycle()
        .executorService("breach-check-%d")
        .minThreads(1)
        .maxThreads(1)
        .workQueue(new LinkedBlockingQueue<>(BREACH_CHECK_QUEUE))
        .build();
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    return new BreachCheckService(
        new HibpBreachChecker(httpClient, URI.create(breach.getEndpoint()), timeout),
        breach.isEnabled(),
        executor,
        clock,
        Duration.ofSeconds(breach.getCacheTtlSeconds()),
        Duration.ofSeconds(breach.getLogCooldownSeconds()));
  }

  private static byte[] keyOrRandom(String hex, String name, RandomProvider random) {
    if (hex == null || hex.isEmpty()) {
      log.warn("No {} configured, generating randomly. "
          + "Data bound to it is invalidated on restart. Do not use in production.", name);
      return random.randomBytes(MIN_KEY_BYTES);
    }
    byte[] key = HexFormat.of().parseHex(hex);
    if (key.length < MIN_KEY_BYTES) {
      throw new IllegalStateException(name + " must encode at least " + MIN_KEY_BYTES + " bytes");
    }
    return key;
  }

  private static <T> T requireRunning(T component) {
    if (component == null) {
      throw new IllegalStateException("CgraphAuthBundle has not been run yet");
    }
    return component;
  }
}
