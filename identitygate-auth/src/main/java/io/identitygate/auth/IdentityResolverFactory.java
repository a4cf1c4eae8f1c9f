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

import com.google.api.client.http.HttpBackOffIOExceptionHandler;
import com.google.api.client.http.HttpBackOffUnsuccessfulResponseHandler;
import com.google.api.client.http.HttpBackOffUnsuccessfulResponseHandler.BackOffRequired;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.util.Clock;
import com.google.api.client.util.ExponentialBackOff;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.identitygate.auth.config.AuthConfig;
import io.identitygate.auth.config.AuthMethod;
import io.identitygate.auth.config.SystemEnvironment;
import io.identitygate.auth.user.ProvisioningLock;
import io.identitygate.auth.user.UserProvisioner;
import io.identitygate.auth.user.UserRecordCache;
import io.identitygate.auth.user.UserStore;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Builds an {@link IdentityResolver} and everything it depends on.
 *
 * <p>Each call creates its own caches and its own background threads, so a process should build
 * one resolver at start-up and share it. The remote key set is fetched before the resolver is
 * returned, and expired user records are swept on a fixed delay until the resolver is closed.
 */
public final class IdentityResolverFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String THREAD_NAME_FORMAT = "identitygate-background-%d";

  private IdentityResolverFactory() {}

  /**
   * Creates a resolver configured from the process environment.
   *
   * @throws IllegalArgumentException if a required environment variable is missing
   */
  public static IdentityResolver create(UserStore userStore) {
    return create(AuthConfig.fromEnvironment(SystemEnvironment.getInstance()), userStore);
  }

  public static IdentityResolver create(AuthConfig config, UserStore userStore) {
    return create(config, userStore, new NetHttpTransport(), Clock.SYSTEM);
  }

  @VisibleForTesting
  static IdentityResolver create(AuthConfig config, UserStore userStore,
      HttpTransport httpTransport, Clock clock) {
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setNameFormat(THREAD_NAME_FORMAT)
        .setDaemon(true)
        .build();
    return create(config, userStore, httpTransport, clock,
        Executors.newScheduledThreadPool(config.getBackgroundThreads(), threadFactory));
  }

  /**
   * @param executor runs every background task of the resolver; shut down by
   *        {@link IdentityResolver#close()}
   */
  @VisibleForTesting
  static IdentityResolver create(AuthConfig config, UserStore userStore,
      HttpTransport httpTransport, Clock clock, ScheduledExecutorService executor) {
    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(userStore);
    Preconditions.checkNotNull(httpTransport);
    Preconditions.checkNotNull(executor);

    AuthMethod authMethod = config.getAuthMethod();
    KeySetCache keySetCache = null;
    TokenVerifier remoteVerifier = null;
    if (authMethod.isRemoteEnabled()) {
      HttpRequestFactory requestFactory =
          httpTransport.createRequestFactory(newRequestInitializer(config));
      KeyUriSupplier keyUriSupplier = new DefaultKeyUriSupplier(requestFactory,
          config.getRemoteAuthority(), config.getRemoteJwksUri());
      keySetCache = new KeySetCache(new DefaultJwksSupplier(requestFactory, keyUriSupplier),
          config.getKeySetOptions());
      remoteVerifier = new RemoteTokenVerifier(keySetCache, config.getRemoteAudiences(),
          config.getRemoteIssuers(), config.getRemoteSubjectClaim(), clock);
    }
    TokenVerifier localVerifier = null;
    if (authMethod.isLocalEnabled()) {
      localVerifier = new LocalTokenVerifier(config.getLocalSecret(), config.getLocalAlgorithm(),
          clock);
    }

    UserRecordCache userCache =
        new UserRecordCache(userStore, config.getUserRecordOptions(), executor);
    ProvisioningLock provisioningLock =
        new ProvisioningLock(executor, config.getProvisioningGraceMillis());
    UserProvisioner provisioner = new UserProvisioner(userStore, userCache, provisioningLock);
    AuthResultCache authResultCache = new AuthResultCache(config.getAuthResultOptions());
    scheduleCleanUp(executor, userCache, config.getUserCacheCleanupMillis());

    if (keySetCache != null) {
      keySetCache.prime();
    }
    logger.atInfo().log("Created an identity resolver: %s", config);
    return new IdentityResolver(remoteVerifier, localVerifier, keySetCache, userStore, userCache,
        provisioner, authResultCache, executor, clock);
  }

  private static void scheduleCleanUp(ScheduledExecutorService executor,
      final UserRecordCache userCache, long intervalMillis) {
    executor.scheduleWithFixedDelay(new Runnable() {
      @Override
      public void run() {
        // An exception escaping here would cancel every later sweep.
        try {
          int removed = userCache.cleanUp();
          if (removed > 0) {
            logger.atFine().log("Dropped %d expired user records", removed);
          }
        } catch (RuntimeException exception) {
          logger.atWarning().withCause(exception).log("Cannot sweep the user record cache");
        }
      }
    }, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
  }

  private static HttpRequestInitializer newRequestInitializer(final AuthConfig config) {
    return new HttpRequestInitializer() {
      @Override
      public void initialize(HttpRequest request) throws IOException {
        request.setConnectTimeout(config.getConnectTimeoutMillis());
        request.setReadTimeout(config.getReadTimeoutMillis());
        request.setNumberOfRetries(config.getHttpRetries());
        request.setIOExceptionHandler(
            new HttpBackOffIOExceptionHandler(new ExponentialBackOff()));
        request.setUnsuccessfulResponseHandler(
            new HttpBackOffUnsuccessfulResponseHandler(new ExponentialBackOff())
                .setBackOffRequired(BackOffRequired.ON_SERVER_ERROR));
      }
    };
  }
}
