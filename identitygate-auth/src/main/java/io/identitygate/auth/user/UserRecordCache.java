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


package io.identitygate.auth.user;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;

import io.identitygate.auth.AuthErrorCode;
import io.identitygate.auth.CacheStatistics;
import io.identitygate.auth.DependencyUnavailableException;
import io.identitygate.auth.config.CacheOptions;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caches user records read from a {@link UserStore} under each of their lookup keys.
 *
 * <p>Entries expire a fixed time after insertion. A hit on an entry older than the configured
 * refresh threshold is served immediately and re-read from the store in the background, with at
 * most one refresh in flight per key. When the cache is full the entry inserted first is evicted.
 * Misses are not cached.
 */
public final class UserRecordCache implements AutoCloseable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Reads one record from the store.
   */
  public interface Fetcher {
    Optional<Identity> fetch() throws UserStoreException;
  }

  private final UserStore store;
  private final CacheOptions options;
  private final Executor refreshExecutor;
  private final Ticker ticker;
  private final long ttlNanos;
  private final long refreshAfterNanos;

  // Insertion-ordered; guarded by itself.
  private final LinkedHashMap<LookupKey, CachedRecord> cache = new LinkedHashMap<>();
  private final Set<LookupKey> refreshing = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();
  private final AtomicLong storeQueries = new AtomicLong();
  private final AtomicLong backgroundRefreshes = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();

  /**
   * Constructor.
   *
   * @param store the store records are read from
   * @param options the size, lifetime and refresh threshold of the cache
   * @param refreshExecutor runs background refreshes
   */
  public UserRecordCache(UserStore store, CacheOptions options, Executor refreshExecutor) {
    this(store, options, refreshExecutor, Ticker.systemTicker());
  }

  @VisibleForTesting
  UserRecordCache(UserStore store, CacheOptions options, Executor refreshExecutor,
      Ticker ticker) {
    this.store = Preconditions.checkNotNull(store);
    this.options = Preconditions.checkNotNull(options);
    this.refreshExecutor = Preconditions.checkNotNull(refreshExecutor);
    this.ticker = Preconditions.checkNotNull(ticker);
    this.ttlNanos = TimeUnit.MILLISECONDS.toNanos(options.getTtlMillis());
    this.refreshAfterNanos = TimeUnit.MILLISECONDS.toNanos(options.getRefreshAfterMillis());
  }

  /**
   * Returns the cached record without consulting the store. A stale hit still schedules a
   * background refresh through the store lookup matching the key's type.
   */
  public Optional<Identity> get(LookupKey key) {
    Preconditions.checkNotNull(key);
    Identity identity = lookup(key, storeFetcher(key));
    if (identity == null) {
      misses.incrementAndGet();
      return Optional.absent();
    }
    return Optional.of(identity);
  }

  /**
   * Returns the cached record, or runs {@code fetcher} on a miss and caches its result under
   * every key of the fetched record.
   *
   * @throws DependencyUnavailableException if the fetch fails
   */
  public Optional<Identity> getOrFetch(LookupKey key, Fetcher fetcher) {
    Preconditions.checkNotNull(key);
    Preconditions.checkNotNull(fetcher);

    Identity cached = lookup(key, fetcher);
    if (cached != null) {
      return Optional.of(cached);
    }
    misses.incrementAndGet();
    Optional<Identity> fetched = fetch(key, fetcher);
    if (fetched.isPresent()) {
      put(key, fetched.get());
    }
    return fetched;
  }

  /**
   * Like {@link #getOrFetch(LookupKey, Fetcher)}, reading from the store by the key's type.
   */
  public Optional<Identity> getOrLoad(LookupKey key) {
    return getOrFetch(key, storeFetcher(key));
  }

  /**
   * Caches {@code identity} under its id, its email and its subject.
   */
  public void put(Identity identity) {
    Preconditions.checkNotNull(identity);
    long now = ticker.read();
    synchronized (cache) {
      for (LookupKey key : LookupKey.allKeysOf(identity)) {
        insert(key, identity, now);
      }
    }
  }

  /**
   * Drops the record cached under {@code key}, together with the record's other keys.
   */
  public void invalidate(LookupKey key) {
    Preconditions.checkNotNull(key);
    synchronized (cache) {
      CachedRecord record = cache.remove(key);
      if (record != null) {
        for (LookupKey other : LookupKey.allKeysOf(record.identity)) {
          CachedRecord cached = cache.get(other);
          if (cached != null && cached.identity.getId().equals(record.identity.getId())) {
            cache.remove(other);
          }
        }
      }
    }
  }

  /**
   * Drops every key {@code identity} is cached under.
   */
  public void invalidateAll(Identity identity) {
    Preconditions.checkNotNull(identity);
    synchronized (cache) {
      for (LookupKey key : LookupKey.allKeysOf(identity)) {
        cache.remove(key);
      }
    }
  }

  public void clear() {
    synchronized (cache) {
      cache.clear();
    }
  }

  /**
   * Drops expired entries.
   *
   * @return the number of entries dropped
   */
  public int cleanUp() {
    long now = ticker.read();
    int removed = 0;
    synchronized (cache) {
      Iterator<CachedRecord> it = cache.values().iterator();
      while (it.hasNext()) {
        if (!it.next().isCurrent(now)) {
          it.remove();
          removed++;
        }
      }
    }
    return removed;
  }

  public CacheStatistics stats() {
    int entries;
    synchronized (cache) {
      entries = cache.size();
    }
    return CacheStatistics.newBuilder()
        .setHits(hits.get())
        .setMisses(misses.get())
        .setEvictions(evictions.get())
        .setEntries(entries)
        .setCounter("maxEntries", options.getNumEntries())
        .setCounter("storeQueries", storeQueries.get())
        .setCounter("backgroundRefreshes", backgroundRefreshes.get())
        .setCounter("refreshesInFlight", refreshing.size())
        .setCounter("errors", errors.get())
        .build();
  }

  /**
   * Stops scheduling background refreshes and drops every entry. The refresh executor is owned by
   * the caller and is not shut down.
   */
  @Override
  public void close() {
    closed = true;
    clear();
  }

  private Identity lookup(LookupKey key, Fetcher refreshFetcher) {
    long now = ticker.read();
    CachedRecord record;
    synchronized (cache) {
      record = cache.get(key);
      if (record != null && !record.isCurrent(now)) {
        cache.remove(key);
        record = null;
      }
    }
    if (record == null) {
      return null;
    }
    hits.incrementAndGet();
    if (now - record.insertedNanos >= refreshAfterNanos) {
      scheduleRefresh(key, refreshFetcher);
    }
    return record.identity;
  }

  private Optional<Identity> fetch(LookupKey key, Fetcher fetcher) {
    storeQueries.incrementAndGet();
    try {
      return fetcher.fetch();
    } catch (UserStoreException exception) {
      errors.incrementAndGet();
      throw new DependencyUnavailableException(AuthErrorCode.STORE_UNAVAILABLE,
          String.format("Cannot read the user record for %s", key.getType()), exception);
    }
  }

  private void put(LookupKey requestedKey, Identity identity) {
    long now = ticker.read();
    synchronized (cache) {
      for (LookupKey key : LookupKey.allKeysOf(identity)) {
        insert(key, identity, now);
      }
      if (!cache.containsKey(requestedKey)) {
        insert(requestedKey, identity, now);
      }
    }
  }

  // Callers hold the cache lock.
  private void insert(LookupKey key, Identity identity, long now) {
    // Re-inserting moves the key to the end of the eviction order.
    cache.remove(key);
    cache.put(key, new CachedRecord(identity, now, ttlNanos));
    while (cache.size() > options.getNumEntries()) {
      Iterator<Map.Entry<LookupKey, CachedRecord>> eldest = cache.entrySet().iterator();
      eldest.next();
      eldest.remove();
      evictions.incrementAndGet();
    }
  }

  private void scheduleRefresh(final LookupKey key, final Fetcher fetcher) {
    if (closed || !refreshing.add(key)) {
      return;
    }
    try {
      refreshExecutor.execute(new Runnable() {
        @Override
        public void run() {
          try {
            refresh(key, fetcher);
          } finally {
            refreshing.remove(key);
          }
        }
      });
    } catch (RejectedExecutionException exception) {
      refreshing.remove(key);
      logger.atWarning().withCause(exception).log("Background refresh of %s was rejected", key);
    }
  }

  private void refresh(LookupKey key, Fetcher fetcher) {
    backgroundRefreshes.incrementAndGet();
    storeQueries.incrementAndGet();
    try {
      Optional<Identity> fetched = fetcher.fetch();
      if (closed) {
        return;
      }
      if (fetched.isPresent()) {
        put(key, fetched.get());
      } else {
        invalidate(key);
      }
    } catch (UserStoreException | RuntimeException exception) {
      errors.incrementAndGet();
      logger.atWarning().withCause(exception).log("Background refresh of %s failed", key);
    }
  }

  private Fetcher storeFetcher(final LookupKey key) {
    return new Fetcher() {
      @Override
      public Optional<Identity> fetch() throws UserStoreException {
        switch (key.getType()) {
          case ID:
            return store.getById(key.getValue());
          case EMAIL:
            return store.getByEmail(key.getValue());
          case SUBJECT:
            return store.getBySubject(key.getValue());
          default:
            throw new IllegalArgumentException("Unknown lookup type: " + key.getType());
        }
      }
    };
  }

  private static final class CachedRecord {
    private final Identity identity;
    private final long insertedNanos;
    private final long ttlNanos;

    CachedRecord(Identity identity, long insertedNanos, long ttlNanos) {
      this.identity = identity;
      this.insertedNanos = insertedNanos;
      this.ttlNanos = ttlNanos;
    }

    boolean isCurrent(long now) {
      return now - insertedNanos < ttlNanos;
    }
  }
}
