package com.cgraph.auth.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore}.
 * <p>
 * <strong>Not suitable for production.</strong> All users are lost on restart.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<String, UserRecord> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> emailIndex = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> walletIndex = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> usernameIndex = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using in-memory user store. Not suitable for production.");
  }

  @Override
  public synchronized boolean insert(UserRecord user) {
    if (byId.containsKey(user.id())
        || (user.email() != null && emailIndex.containsKey(user.email()))
        || (user.walletAddress() != null && walletIndex.containsKey(user.walletAddress()))
        || (user.username() != null && usernameIndex.containsKey(user.username()))) {
      return false;
    }
    if (user.email() != null) {
      emailIndex.put(user.email(), user.id());
    }
    if (user.walletAddress() != null) {
      walletIndex.put(user.walletAddress(), user.id());
    }
    if (user.username() != null) {
      usernameIndex.put(user.username(), user.id());
    }
    byId.put(user.id(), user.withVersion(0));
    log.debug("Inserted user id={}", user.id());
    return true;
  }

  @Override
  public Optional<UserRecord> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<UserRecord> findByEmail(String email) {
    return Optional.ofNullable(emailIndex.get(email)).map(byId::get);
  }

  @Override
  public Optional<UserRecord> findByWalletAddress(String address) {
    return Optional.ofNullable(walletIndex.get(address)).map(byId::get);
  }

  @Override
  public Optional<UserRecord> compareAndSet(UserRecord current, UserRecord replacement) {
    if (!current.id().equals(replacement.id())) {
      throw new StoreException("compareAndSet cannot change the user id");
    }
    UserRecord next = replacement.withVersion(current.version() + 1);
    AtomicReference<UserRecord> written = new AtomicReference<>();
    byId.computeIfPresent(current.id(), (id, existing) -> {
      if (existing.version() != current.version()) {
        return existing;
      }
      written.set(next);
      return next;
    });
    return Optional.ofNullable(written.get());
  }
}
