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


package io.identitygate.auth.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.concurrent.TimeUnit;

/**
 * Holds values used to configure one of the identity caches.
 */
public final class CacheOptions {
  /**
   * The default key set lifetime: one hour.
   */
  public static final long DEFAULT_KEY_SET_TTL_MILLIS = TimeUnit.HOURS.toMillis(1);

  /**
   * The default user record lifetime: fifteen minutes.
   */
  public static final long DEFAULT_USER_RECORD_TTL_MILLIS = TimeUnit.MINUTES.toMillis(15);

  /**
   * The default number of user records kept.
   */
  public static final int DEFAULT_USER_RECORD_NUM_ENTRIES = 2000;

  /**
   * The default fraction of the user record lifetime after which a hit triggers a background
   * refresh.
   */
  public static final double DEFAULT_REFRESH_THRESHOLD = 0.8;

  /**
   * The default resolved identity lifetime: five minutes.
   */
  public static final long DEFAULT_AUTH_RESULT_TTL_MILLIS = TimeUnit.MINUTES.toMillis(5);

  /**
   * The default number of resolved identities kept.
   */
  public static final int DEFAULT_AUTH_RESULT_NUM_ENTRIES = 10000;

  private final int numEntries;
  private final long ttlMillis;
  private final double refreshThreshold;

  /**
   * Constructor
   *
   * @param numEntries is the maximum number of entries kept in the cache
   * @param ttlMillis is the lifetime of an entry, measured from its insertion
   * @param refreshThreshold is the fraction of {@code ttlMillis} after which a cache hit schedules
   *        a background refresh. A value of {@code 1} or more disables background refresh.
   */
  public CacheOptions(int numEntries, long ttlMillis, double refreshThreshold) {
    Preconditions.checkArgument(numEntries > 0, "numEntries must be positive: %s", numEntries);
    Preconditions.checkArgument(ttlMillis > 0, "ttlMillis must be positive: %s", ttlMillis);
    Preconditions.checkArgument(refreshThreshold > 0,
        "refreshThreshold must be positive: %s", refreshThreshold);
    this.numEntries = numEntries;
    this.ttlMillis = ttlMillis;
    this.refreshThreshold = refreshThreshold;
  }

  public static CacheOptions keySetDefaults() {
    return new CacheOptions(1, DEFAULT_KEY_SET_TTL_MILLIS, 1.0);
  }

  public static CacheOptions userRecordDefaults() {
    return new CacheOptions(DEFAULT_USER_RECORD_NUM_ENTRIES, DEFAULT_USER_RECORD_TTL_MILLIS,
        DEFAULT_REFRESH_THRESHOLD);
  }

  public static CacheOptions authResultDefaults() {
    return new CacheOptions(DEFAULT_AUTH_RESULT_NUM_ENTRIES, DEFAULT_AUTH_RESULT_TTL_MILLIS, 1.0);
  }

  /**
   * @return the maximum number of entries kept in the cache
   */
  public int getNumEntries() {
    return numEntries;
  }

  /**
   * @return the lifetime of an entry in milliseconds
   */
  public long getTtlMillis() {
    return ttlMillis;
  }

  public double getRefreshThreshold() {
    return refreshThreshold;
  }

  /**
   * @return the entry age in milliseconds after which a hit schedules a background refresh
   */
  public long getRefreshAfterMillis() {
    return (long) (ttlMillis * refreshThreshold);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("numEntries", numEntries)
        .add("ttlMillis", ttlMillis)
        .add("refreshThreshold", refreshThreshold)
        .toString();
  }
}
