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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable snapshot of one cache's counters.
 *
 * <p>Every cache reports hits, misses, evictions and its current number of entries; the counters
 * specific to a cache, such as background refreshes or stale serves, are available through
 * {@link #getCounter(String)}.
 */
public final class CacheStatistics {
  private final long hits;
  private final long misses;
  private final long evictions;
  private final long entries;
  private final ImmutableMap<String, Long> counters;

  private CacheStatistics(Builder builder) {
    this.hits = builder.hits;
    this.misses = builder.misses;
    this.evictions = builder.evictions;
    this.entries = builder.entries;
    this.counters = ImmutableMap.copyOf(builder.counters);
  }

  public long getHits() {
    return hits;
  }

  public long getMisses() {
    return misses;
  }

  public long getEvictions() {
    return evictions;
  }

  public long getEntries() {
    return entries;
  }

  /**
   * @return the fraction of lookups served from the cache, or {@code 0} before any lookup
   */
  public double getHitRate() {
    long total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }

  /**
   * @return the named cache-specific counter, or {@code 0} when the cache does not report it
   */
  public long getCounter(String name) {
    Long value = counters.get(name);
    return value == null ? 0L : value;
  }

  public ImmutableMap<String, Long> getCounters() {
    return counters;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CacheStatistics)) {
      return false;
    }
    CacheStatistics other = (CacheStatistics) obj;
    return hits == other.hits
        && misses == other.misses
        && evictions == other.evictions
        && entries == other.entries
        && counters.equals(other.counters);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(hits, misses, evictions, entries, counters);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("hits", hits)
        .add("misses", misses)
        .add("evictions", evictions)
        .add("entries", entries)
        .add("counters", counters)
        .toString();
  }

  /**
   * Builder for {@link CacheStatistics}.
   */
  public static final class Builder {
    private long hits;
    private long misses;
    private long evictions;
    private long entries;
    private final Map<String, Long> counters = new LinkedHashMap<>();

    private Builder() {}

    public Builder setHits(long hits) {
      this.hits = hits;
      return this;
    }

    public Builder setMisses(long misses) {
      this.misses = misses;
      return this;
    }

    public Builder setEvictions(long evictions) {
      this.evictions = evictions;
      return this;
    }

    public Builder setEntries(long entries) {
      this.entries = entries;
      return this;
    }

    public Builder setCounter(String name, long value) {
      this.counters.put(Preconditions.checkNotNull(name), value);
      return this;
    }

    public CacheStatistics build() {
      return new CacheStatistics(this);
    }
  }
}
