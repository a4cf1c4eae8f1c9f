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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.PublicJsonWebKey;

import java.security.PublicKey;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

/**
 * An immutable snapshot of the provider's public keys, indexed by key id.
 */
final class KeySet {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableMap<String, PublicKey> keys;
  private final long fetchedNanos;

  private KeySet(ImmutableMap<String, PublicKey> keys, long fetchedNanos) {
    this.keys = keys;
    this.fetchedNanos = fetchedNanos;
  }

  /**
   * Indexes the public keys of {@code jwks}. Keys without an id, and keys that are not public
   * keys, are skipped.
   */
  static KeySet from(JsonWebKeySet jwks, long fetchedNanos) {
    Map<String, PublicKey> keys = new LinkedHashMap<>();
    for (JsonWebKey jwk : jwks.getJsonWebKeys()) {
      if (Strings.isNullOrEmpty(jwk.getKeyId())) {
        logger.atFine().log("Skipping a %s key without a key id", jwk.getKeyType());
        continue;
      }
      if (!(jwk instanceof PublicJsonWebKey)) {
        logger.atFine().log("Skipping non-public key %s", jwk.getKeyId());
        continue;
      }
      if (!keys.containsKey(jwk.getKeyId())) {
        keys.put(jwk.getKeyId(), ((PublicJsonWebKey) jwk).getPublicKey());
      }
    }
    return new KeySet(ImmutableMap.copyOf(keys), fetchedNanos);
  }

  @Nullable
  PublicKey get(String keyId) {
    return keys.get(keyId);
  }

  int size() {
    return keys.size();
  }

  long getFetchedNanos() {
    return fetchedNanos;
  }

  boolean isCurrent(long now, long ttlNanos) {
    return now - fetchedNanos < ttlNanos;
  }
}
