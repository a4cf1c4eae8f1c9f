/*
 * Copyright 2026 The identitygate Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.identitygate.auth;

import com.google.api.client.util.Clock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;

import io.identitygate.auth.user.AuthKind;
import io.identitygate.auth.user.Identity;
import io.identitygate.auth.user.LookupKey;
import io.identitygate.auth.user.LookupType;
import io.identitygate.auth.user.UserConflictException;
import io.identitygate.auth.user.UserProvisioner;
import io.identitygate.auth.user.UserRecordCache;
import io.identitygate.auth.user.UserStore;
import io.identitygate.auth.user.UserStoreException;
import io.identitygate.auth.user.UserUpdate;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import javax.annotation.Nullable;

/**
 * Resolves bearer tokens to identities.
 *
 * <p>A token is first looked up in the {@link AuthResultCache}. On a miss the remote verifier is
 * tried, then the local one; the first to accept the token decides the identity:
 *
 * <ul>
 * <li>a remote user token resolves to the user record with the token's subject or email, which
 * is created on first sight and updated in place when the token carries a subject, an email or
 * roles the record lacks;
 * <li>a remote service token resolves to a service identity that is never stored;
 * <li>a local token resolves to the existing user record with the token's email. Local tokens
 * never create records.
 * </ul>
 *
 * <p>When every enabled method refuses the token an {@link UnauthenticatedException} with
 * {@link AuthErrorCode#UNAUTHORIZED} is thrown, unless a refusal was caused by an unreachable
 * dependency, in which case a {@link DependencyUnavailableException} is thrown instead.
 *
 * <p>Instances are created by {@link IdentityResolverFactory}.
 */
public class IdentityResolver implements AutoCloseable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final String SERVICE_ID_PREFIX = "app_";

  @Nullable private final TokenVerifier remoteVerifier;
  @Nullable private final TokenVerifier localVerifier;
  @Nullable private final KeySetCache keySetCache;
  private final UserStore userStore;
  private final UserRecordCache userCache;
  private final UserProvisioner provisioner;
  private final AuthResultCache authResultCache;
  private final ExecutorService backgroundExecutor;
  private final Clock clock;

  /**
   * Constructor.
   *
   * @param remoteVerifier verifies remote tokens; {@code null} when remote authentication is off
   * @param localVerifier verifies local tokens; {@code null} when local authentication is off
   * @param keySetCache the remote key cache; {@code null} when remote authentication is off
   * @param backgroundExecutor runs last-authenticated writes; shut down by {@link #close()}
   */
  IdentityResolver(@Nullable TokenVerifier remoteVerifier, @Nullable TokenVerifier localVerifier,
      @Nullable KeySetCache keySetCache, UserStore userStore, UserRecordCache userCache,
      UserProvisioner provisioner, AuthResultCache authResultCache,
      ExecutorService backgroundExecutor, Clock clock) {
    Preconditions.checkArgument(remoteVerifier != null || localVerifier != null,
        "at least one authentication method must be enabled");
    this.remoteVerifier = remoteVerifier;
    this.localVerifier = localVerifier;
    this.keySetCache = keySetCache;
    this.userStore = Preconditions.checkNotNull(userStore);
    this.userCache = Preconditions.checkNotNull(userCache);
    this.provisioner = Preconditions.checkNotNull(provisioner);
    this.authResultCache = Preconditions.checkNotNull(authResultCache);
    this.backgroundExecutor = Preconditions.checkNotNull(backgroundExecutor);
    this.clock = Preconditions.checkNotNull(clock);
  }

  /**
   * Resolves {@code token} to an identity.
   *
   * @throws UnauthenticatedException if no enabled method accepts the token, or a verified remote
   *         identity cannot be bound to a user record
   * @throws DependencyUnavailableException if the user store or the key provider is unreachable
   */
  public Identity resolve(String token) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(token), "token cannot be empty");

    String tokenHash = AuthResultCache.hash(token);
    Optional<Identity> cached = authResultCache.get(tokenHash);
    if (cached.isPresent()) {
      return cached.get();
    }
    String tokenRef = tokenHash.substring(0, 8);

    VerificationResult remoteResult = null;
    if (remoteVerifier != null) {
      remoteResult = remoteVerifier.verify(token);
      if (remoteResult.isSuccess()) {
        Identity identity = resolveRemote(remoteResult.getToken());
        authResultCache.set(tokenHash, identity);
        logger.atFine().log("Token %s resolved remotely to %s", tokenRef, identity.getId());
        return identity;
      }
      logger.atFine().log("Token %s refused by the remote verifier: %s", tokenRef,
          remoteResult.getErrorCode());
    }

    VerificationResult localResult = null;
    if (localVerifier != null) {
      localResult = localVerifier.verify(token);
      if (localResult.isSuccess()) {
        Identity identity = resolveLocal(localResult.getToken());
        authResultCache.set(tokenHash, identity);
        logger.atFine().log("Token %s resolved locally to %s", tokenRef, identity.getId());
        return identity;
      }
      logger.atFine().log("Token %s refused by the local verifier: %s", tokenRef,
          localResult.getErrorCode());
    }

    throw refused(remoteResult, localResult);
  }

  /**
   * @return the statistics of each cache, by cache name
   */
  public ImmutableMap<String, CacheStatistics> getCacheStats() {
    ImmutableMap.Builder<String, CacheStatistics> stats = ImmutableMap.builder();
    stats.put("authResults", authResultCache.stats());
    stats.put("userRecords", userCache.stats());
    if (keySetCache != null) {
      stats.put("keySet", keySetCache.stats());
    }
    return stats.build();
  }

  public void clearAuthCache() {
    authResultCache.clear();
    logger.atInfo().log("Cleared the auth result cache");
  }

  /**
   * Drops the identity cached for {@code token}, so its next use is verified again.
   */
  public void invalidateToken(String token) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(token), "token cannot be empty");
    authResultCache.invalidate(AuthResultCache.hash(token));
  }

  /**
   * Refetches the remote key set.
   *
   * @throws IllegalStateException if remote authentication is disabled
   */
  public void forceRefreshKeySet() {
    Preconditions.checkState(keySetCache != null, "remote authentication is disabled");
    keySetCache.forceRefresh();
    logger.atInfo().log("Refreshed the remote key set");
  }

  /**
   * Drops the user record cached under the given identifier.
   */
  public void invalidateUserCache(String identifier, LookupType lookupType) {
    userCache.invalidate(LookupKey.of(lookupType, identifier));
  }

  /**
   * Stops background work and drops the cached user records.
   */
  @Override
  public void close() {
    backgroundExecutor.shutdown();
    userCache.close();
  }

  private Identity resolveRemote(VerifiedToken token) {
    if (token.getKind() == AuthKind.REMOTE_SERVICE) {
      return Identity.newBuilder()
          .setId(SERVICE_ID_PREFIX + token.getApplicationId())
          .setDisplayName(token.getApplicationId())
          .setRoles(token.getRoles())
          .setAuthKind(AuthKind.REMOTE_SERVICE)
          .setLastAuthenticatedAt(now())
          .build();
    }

    String subject = token.getSubject();
    String email = token.getEmail();
    Optional<Identity> existing = userCache.getOrLoad(LookupKey.bySubject(subject));
    if (!existing.isPresent()) {
      existing = userCache.getOrLoad(LookupKey.byEmail(email));
    }
    if (!existing.isPresent()) {
      Identity created = provisioner.provision(subject, email, token.getRoles());
      recordAuthentication(created);
      return created;
    }

    Identity identity = existing.get();
    if (identity.getSubject() != null && !identity.getSubject().equals(subject)) {
      throw new UnauthenticatedException(AuthErrorCode.PROVISIONING_CONFLICT,
          String.format("User %s is already bound to another subject", identity.getId()));
    }
    UserUpdate.Builder update = UserUpdate.newBuilder();
    boolean changed = false;
    if (identity.getSubject() == null) {
      update.setSubject(subject);
      changed = true;
    }
    // Tokens carry the provider's current address; the record follows it.
    if (email != null && !email.equals(identity.getEmail())) {
      update.setEmail(email);
      changed = true;
    }
    // An empty roles claim keeps the record's roles.
    if (!token.getRoles().isEmpty() && !token.getRoles().equals(identity.getRoles())) {
      update.setRoles(token.getRoles());
      changed = true;
    }
    if (identity.getAuthKind() != AuthKind.REMOTE_USER) {
      update.setAuthKind(AuthKind.REMOTE_USER);
      changed = true;
    }
    if (changed) {
      identity = persist(identity, update.build());
    }
    recordAuthentication(identity);
    return identity;
  }

  private Identity resolveLocal(VerifiedToken token) {
    Optional<Identity> existing = userCache.getOrLoad(LookupKey.byEmail(token.getEmail()));
    if (!existing.isPresent()) {
      throw new UnauthenticatedException(AuthErrorCode.UNAUTHORIZED,
          "No user record matches the local token");
    }
    recordAuthentication(existing.get());
    return existing.get();
  }

  private Identity persist(Identity identity, UserUpdate update) {
    Identity updated;
    try {
      updated = userStore.update(identity.getId(), update);
    } catch (UserConflictException exception) {
      throw new UnauthenticatedException(AuthErrorCode.PROVISIONING_CONFLICT,
          String.format("Cannot update user %s: %s", identity.getId(), exception.getMessage()),
          exception);
    } catch (UserStoreException exception) {
      throw new DependencyUnavailableException(AuthErrorCode.STORE_UNAVAILABLE,
          "Cannot update user " + identity.getId(), exception);
    }
    logger.atInfo().log("Updated user %s: %s", identity.getId(), update);
    userCache.invalidateAll(identity);
    userCache.put(updated);
    return updated;
  }

  private void recordAuthentication(final Identity identity) {
    final UserUpdate update = UserUpdate.newBuilder().setLastAuthenticatedAt(now()).build();
    try {
      backgroundExecutor.execute(new Runnable() {
        @Override
        public void run() {
          try {
            userStore.update(identity.getId(), update);
            userCache.invalidateAll(identity);
          } catch (UserStoreException | RuntimeException exception) {
            logger.atWarning().withCause(exception)
                .log("Cannot record the authentication of user %s", identity.getId());
          }
        }
      });
    } catch (RejectedExecutionException exception) {
      logger.atWarning().withCause(exception)
          .log("Skipped recording the authentication of user %s", identity.getId());
    }
  }

  private RuntimeException refused(@Nullable VerificationResult remoteResult,
      @Nullable VerificationResult localResult) {
    StringBuilder reasons = new StringBuilder();
    AuthErrorCode infrastructureError = null;
    for (VerificationResult result : new VerificationResult[] {remoteResult, localResult}) {
      if (result == null) {
        continue;
      }
      if (reasons.length() > 0) {
        reasons.append("; ");
      }
      reasons.append(result == remoteResult ? "remote: " : "local: ").append(result.getMessage());
      if (result.getErrorCode().isInfrastructure()) {
        infrastructureError = result.getErrorCode();
      }
    }
    if (infrastructureError != null) {
      return new DependencyUnavailableException(infrastructureError, reasons.toString());
    }
    return new UnauthenticatedException(AuthErrorCode.UNAUTHORIZED,
        "No authentication method accepted the token (" + reasons + ")");
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.currentTimeMillis());
  }
}
