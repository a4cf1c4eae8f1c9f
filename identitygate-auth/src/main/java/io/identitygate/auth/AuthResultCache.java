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
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.hash.Hashing;

import io.identitygate.auth.config.CacheOptions;
import io.identitygate.auth.user.Identity;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Caches resolved identities by the SHA-256 hash of the token they were resolved from.
 *
 * <p>Raw tokens are never stored. Entries expire a fixed time after they were written.
 */
public final class AuthResultCache {
  private final Cache<String, Identity> cache;

  public AuthResultCache(CacheOptions options) {
    this(options, Ticker.systemTicker());
  }

  @VisibleForTesting
  AuthResultCache(CacheOptions options, Ticker ticker) {
    this.cache = CacheBuilder.newBuilder()
        .maximumSize(options.getNumEntries())
        .expireAfterWrite(options.getTtlMillis(), TimeUnit.MILLISECONDS)
        .ticker(ticker)
        .recordStats()
        .build();
  }

  /**
   * @return the lower-case hex SHA-256 digest of {@code token}
   */
  public static String hash(String token) {
    Preconditions.checkNotNull(token);
    return Hashing.sha256().hashString(token, StandardCharsets.UTF_8).toString();
  }

  public Optional<Identity> get(String tokenHash) {
    Preconditions.checkNotNull(tokenHash);
    return Optional.fromNullable(cache.getIfPresent(tokenHash));
  }

  public void set(String tokenHash, Identity identity) {
    Preconditions.checkNotNull(tokenHash);
    Preconditions.checkNotNull(identity);
    cache.put(tokenHash, identity);
  }

  public void invalidate(String tokenHash) {
    Preconditions.checkNotNull(tokenHash);
    cache.invalidate(tokenHash);
  }

  public void clear() {
    cache.invalidateAll();
  }

  public CacheStatistics stats() {
    cache.cleanUp();
    CacheStats stats = cache.stats();
    return CacheStatistics.newBuilder()
        .setHits(stats.hitCount())
        .setMisses(stats.missCount())
        .setEvictions(stats.evictionCount())
        .setEntries(cache.size())
        .build();
  }
}
