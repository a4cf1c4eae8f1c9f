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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.identitygate.auth.config.CacheOptions;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link KeySetCache}.
 */
@RunWith(JUnit4.class)
public final class KeySetCacheTest {
  private static final RsaJsonWebKey KEY_1 = TestUtils.generateRsaJsonWebKey("key-1");
  private static final RsaJsonWebKey KEY_2 = TestUtils.generateRsaJsonWebKey("key-2");

  private final JwksSupplier jwksSupplier = mock(JwksSupplier.class);
  private final FakeTicker ticker = new FakeTicker();
  private final KeySetCache keySetCache =
      new KeySetCache(jwksSupplier, CacheOptions.keySetDefaults(), ticker);

  @Test
  public void testGetKeyFetchesOnceWithinTtl() {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(KEY_1));

    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
    ticker.tick(59, TimeUnit.MINUTES);
    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));

    verify(jwksSupplier, times(1)).supply();
  }

  @Test
  public void testGetKeyRefetchesAfterTtl() {
    when(jwksSupplier.supply())
        .thenReturn(new JsonWebKeySet(KEY_1))
        .thenReturn(new JsonWebKeySet(KEY_2));

    keySetCache.getKey("key-1");
    ticker.tick(61, TimeUnit.MINUTES);

    assertEquals(KEY_2.getPublicKey(), keySetCache.getKey("key-2"));
    verify(jwksSupplier, times(2)).supply();
  }

  @Test
  public void testUnknownKeyIdForcesOneRefetch() {
    when(jwksSupplier.supply())
        .thenReturn(new JsonWebKeySet(KEY_1))
        .thenReturn(new JsonWebKeySet(KEY_1, KEY_2));

    keySetCache.getKey("key-1");
    assertEquals(KEY_2.getPublicKey(), keySetCache.getKey("key-2"));

    verify(jwksSupplier, times(2)).supply();
    assertEquals(1, keySetCache.stats().getCounter("forcedRefreshes"));
  }

  @Test
  public void testKeyStillUnknownAfterRefetch() {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(KEY_1));
    keySetCache.getKey("key-1");

    try {
      keySetCache.getKey("rotated-away");
      fail("Expected UnauthenticatedException.");
    } catch (UnauthenticatedException exception) {
      assertEquals(AuthErrorCode.UNKNOWN_KEY, exception.getErrorCode());
    }
    // One fetch to fill the cache, exactly one forced refetch for the unknown key id.
    verify(jwksSupplier, times(2)).supply();
  }

  @Test
  public void testRefreshFailureServesStaleKeySet() {
    when(jwksSupplier.supply())
        .thenReturn(new JsonWebKeySet(KEY_1))
        .thenThrow(new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "down"));

    keySetCache.getKey("key-1");
    ticker.tick(2, TimeUnit.HOURS);

    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
    CacheStatistics stats = keySetCache.stats();
    assertEquals(1, stats.getCounter("staleServes"));
    assertEquals(1, stats.getCounter("fetchFailures"));
  }

  @Test
  public void testFirstFetchFailureIsThrown() {
    when(jwksSupplier.supply()).thenThrow(
        new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, "down"));

    try {
      keySetCache.getKey("key-1");
      fail("Expected DependencyUnavailableException.");
    } catch (DependencyUnavailableException exception) {
      assertEquals(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, exception.getErrorCode());
    }
  }

  @Test
  public void testPrimeLogsFailureInsteadOfThrowing() {
    when(jwksSupplier.supply())
        .thenThrow(new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "down"))
        .thenReturn(new JsonWebKeySet(KEY_1));

    keySetCache.prime();
    assertEquals(0, keySetCache.stats().getEntries());

    ticker.tick(KeySetCache.RETRY_AFTER_MILLIS, TimeUnit.MILLISECONDS);
    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
  }

  @Test
  public void testFailedFetchIsNotRetriedWithinWindow() {
    when(jwksSupplier.supply())
        .thenThrow(new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "down"))
        .thenReturn(new JsonWebKeySet(KEY_1));
    expectUnavailable("key-1");

    ticker.tick(KeySetCache.RETRY_AFTER_MILLIS - 1, TimeUnit.MILLISECONDS);
    expectUnavailable("key-1");
    verify(jwksSupplier, times(1)).supply();

    ticker.tick(1, TimeUnit.MILLISECONDS);
    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
    verify(jwksSupplier, times(2)).supply();
    assertEquals(1, keySetCache.stats().getCounter("suppressedFetches"));
  }

  @Test
  public void testStaleKeySetServedWithoutRefetchWithinWindow() {
    when(jwksSupplier.supply())
        .thenReturn(new JsonWebKeySet(KEY_1))
        .thenThrow(new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "down"));
    keySetCache.getKey("key-1");
    ticker.tick(2, TimeUnit.HOURS);

    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
    try {
      keySetCache.getKey("key-2");
      fail("Expected UnauthenticatedException.");
    } catch (UnauthenticatedException exception) {
      assertEquals(AuthErrorCode.UNKNOWN_KEY, exception.getErrorCode());
    }

    // Every lookup after the failure skips a fetch; the unknown key id skips two.
    verify(jwksSupplier, times(2)).supply();
    assertEquals(3, keySetCache.stats().getCounter("suppressedFetches"));
  }

  @Test
  public void testForceRefreshIgnoresRetryWindow() {
    when(jwksSupplier.supply())
        .thenThrow(new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "down"))
        .thenReturn(new JsonWebKeySet(KEY_1));
    keySetCache.prime();

    keySetCache.forceRefresh();

    assertEquals(KEY_1.getPublicKey(), keySetCache.getKey("key-1"));
    verify(jwksSupplier, times(2)).supply();
  }

  @Test
  public void testPrimeFetchesAhead() {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(KEY_1, KEY_2));

    keySetCache.prime();
    keySetCache.getKey("key-1");
    keySetCache.getKey("key-2");

    verify(jwksSupplier, times(1)).supply();
    assertEquals(2, keySetCache.stats().getEntries());
  }

  @Test
  public void testForceRefreshReplacesCurrentKeySet() {
    when(jwksSupplier.supply())
        .thenReturn(new JsonWebKeySet(KEY_1))
        .thenReturn(new JsonWebKeySet(KEY_2));
    keySetCache.getKey("key-1");

    keySetCache.forceRefresh();

    assertEquals(KEY_2.getPublicKey(), keySetCache.getKey("key-2"));
    verify(jwksSupplier, times(2)).supply();
  }

  @Test
  public void testKeysWithoutKeyIdAreSkipped() {
    RsaJsonWebKey anonymous = TestUtils.generateRsaJsonWebKey(null);
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(KEY_1, anonymous));

    keySetCache.prime();

    assertEquals(1, keySetCache.stats().getEntries());
  }

  @Test
  public void testStatsBeforeFirstFetch() {
    CacheStatistics stats = keySetCache.stats();

    assertEquals(0, stats.getEntries());
    assertThat(stats.getCounters()).doesNotContainKey("ageMillis");
    verify(jwksSupplier, never()).supply();
  }

  @Test
  public void testStatsReportAge() {
    when(jwksSupplier.supply()).thenReturn(new JsonWebKeySet(new JsonWebKey[] {KEY_1}));
    keySetCache.prime();
    ticker.tick(90, TimeUnit.SECONDS);

    CacheStatistics stats = keySetCache.stats();
    assertEquals(90000, stats.getCounter("ageMillis"));
    assertEquals(1, stats.getCounter("fetches"));
  }

  private void expectUnavailable(String keyId) {
    try {
      keySetCache.getKey(keyId);
      fail("Expected DependencyUnavailableException.");
    } catch (DependencyUnavailableException exception) {
      assertEquals(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, exception.getErrorCode());
    }
  }
}
