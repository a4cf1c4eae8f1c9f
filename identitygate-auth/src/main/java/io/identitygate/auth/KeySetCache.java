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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;

import io.identitygate.auth.config.CacheOptions;

import java.security.PublicKey;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caches the remote identity provider's signing keys.
 *
 * <p>The key set is replaced wholesale when it expires, and refetched once, ahead of its expiry,
 * when a token names a key id the cached set does not contain. Lookups read the current set
 * without locking; refreshes are serialized, and a refresh that finds the set already replaced by
 * another thread uses the new set instead of fetching again. When a refetch fails the previous
 * set keeps being served.
 *
 * <p>After a failed fetch, lookups do not contact the provider again for
 * {@link #RETRY_AFTER_MILLIS}: they use the cached set, or fail at once when there is none.
 * {@link #forceRefresh()} always fetches.
 */
public final class KeySetCache {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final long RETRY_AFTER_MILLIS = 10_000;

  private final JwksSupplier jwksSupplier;
  private final Ticker ticker;
  private final long ttlNanos;
  private final Object refreshLock = new Object();
  private volatile KeySet current;
  // Guarded by refreshLock.
  private boolean lastFetchFailed;
  private long lastFailureNanos;

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong fetches = new AtomicLong();
  private final AtomicLong forcedRefreshes = new AtomicLong();
  private final AtomicLong staleServes = new AtomicLong();
  private final AtomicLong fetchFailures = new AtomicLong();
  private final AtomicLong suppressedFetches = new AtomicLong();

  public KeySetCache(JwksSupplier jwksSupplier, CacheOptions options) {
    this(jwksSupplier, options, Ticker.systemTicker());
  }

  @VisibleForTesting
  KeySetCache(JwksSupplier jwksSupplier, CacheOptions options, Ticker ticker) {
    this.jwksSupplier = Preconditions.checkNotNull(jwksSupplier);
    this.ticker = Preconditions.checkNotNull(ticker);
    this.ttlNanos = TimeUnit.MILLISECONDS.toNanos(options.getTtlMillis());
  }

  /**
   * Returns the public key with the given id.
   *
   * @throws UnauthenticatedException with {@link AuthErrorCode#UNKNOWN_KEY} if the key is absent
   *         even after a forced refetch
   * @throws DependencyUnavailableException if no key set could ever be fetched
   */
  public PublicKey getKey(String keyId) {
    Preconditions.checkNotNull(keyId);

    KeySet keySet = current;
    if (keySet == null || !keySet.isCurrent(ticker.read(), ttlNanos)) {
      keySet = refresh(keySet, false, false);
    }
    PublicKey key = keySet.get(keyId);
    if (key != null) {
      hits.incrementAndGet();
      return key;
    }

    logger.atInfo().log("Key id %s is not in the cached key set, refetching", keyId);
    keySet = refresh(keySet, true, false);
    key = keySet.get(keyId);
    if (key == null) {
      misses.incrementAndGet();
      throw new UnauthenticatedException(AuthErrorCode.UNKNOWN_KEY,
          String.format("Key id %s is not in the provider's key set", keyId));
    }
    hits.incrementAndGet();
    return key;
  }

  /**
   * Fetches the key set ahead of the first request. A failure is logged, not thrown; the next
   * lookup tries again.
   */
  public void prime() {
    try {
      KeySet keySet = refresh(current, false, false);
      logger.atInfo().log("Primed the key set with %d keys", keySet.size());
    } catch (DependencyUnavailableException exception) {
      logger.atWarning().withCause(exception).log("Cannot prime the key set");
    }
  }

  /**
   * Refetches the key set regardless of its age.
   *
   * @throws DependencyUnavailableException if the fetch fails and no key set was ever fetched
   */
  public void forceRefresh() {
    refresh(current, true, true);
  }

  public CacheStatistics stats() {
    KeySet keySet = current;
    CacheStatistics.Builder builder = CacheStatistics.newBuilder()
        .setHits(hits.get())
        .setMisses(misses.get())
        .setEntries(keySet == null ? 0 : keySet.size())
        .setCounter("fetches", fetches.get())
        .setCounter("forcedRefreshes", forcedRefreshes.get())
        .setCounter("staleServes", staleServes.get())
        .setCounter("fetchFailures", fetchFailures.get())
        .setCounter("suppressedFetches", suppressedFetches.get());
    if (keySet != null) {
      builder.setCounter("ageMillis",
          TimeUnit.NANOSECONDS.toMillis(ticker.read() - keySet.getFetchedNanos()));
    }
    return builder.build();
  }

  /**
   * Replaces the key set observed by the caller, unless another thread already did.
   *
   * @param observed the set the caller found wanting, or {@code null} if none was cached
   * @param forced whether to refetch even if the set is still current
   * @param explicit whether to fetch even within the retry window of a failed fetch
   */
  private KeySet refresh(KeySet observed, boolean forced, boolean explicit) {
    synchronized (refreshLock) {
      KeySet latest = current;
      long now = ticker.read();
      if (latest != null && latest != observed && (forced || latest.isCurrent(now, ttlNanos))) {
        return latest;
      }
      if (latest != null && !forced && latest.isCurrent(now, ttlNanos)) {
        return latest;
      }

      if (!explicit && lastFetchFailed
          && now - lastFailureNanos < TimeUnit.MILLISECONDS.toNanos(RETRY_AFTER_MILLIS)) {
        suppressedFetches.incrementAndGet();
        if (latest == null) {
          throw new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
              String.format("The key provider failed %d ms ago, not retrying yet",
                  TimeUnit.NANOSECONDS.toMillis(now - lastFailureNanos)));
        }
        return latest;
      }

      if (forced) {
        forcedRefreshes.incrementAndGet();
      }
      fetches.incrementAndGet();
      try {
        KeySet fetched = KeySet.from(jwksSupplier.supply(), ticker.read());
        current = fetched;
        lastFetchFailed = false;
        return fetched;
      } catch (DependencyUnavailableException exception) {
        fetchFailures.incrementAndGet();
        lastFetchFailed = true;
        lastFailureNanos = ticker.read();
        if (latest == null) {
          throw exception;
        }
        staleServes.incrementAndGet();
        logger.atWarning().withCause(exception)
            .log("Cannot refresh the key set, serving the cached one");
        return latest;
      }
    }
  }
}
