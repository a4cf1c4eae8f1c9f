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

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jose4j.jwk.EllipticCurveJsonWebKey;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.keys.X509Util;
import org.jose4j.lang.JoseException;

import java.io.IOException;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Fetches the provider's signing keys over HTTP.
 *
 * <p>The document is either a JWKS ({@code {"keys": [...]}}) or an object mapping each key id to
 * a PEM encoded X.509 certificate. Timeouts and transport retries come from the request factory's
 * initializer.
 */
public class DefaultJwksSupplier implements JwksSupplier {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting
  static final String PEM_HEADER = "-----BEGIN CERTIFICATE-----";
  @VisibleForTesting
  static final String PEM_FOOTER = "-----END CERTIFICATE-----";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HttpRequestFactory requestFactory;
  private final KeyUriSupplier keyUriSupplier;

  public DefaultJwksSupplier(HttpRequestFactory requestFactory, KeyUriSupplier keyUriSupplier) {
    this.requestFactory = Preconditions.checkNotNull(requestFactory);
    this.keyUriSupplier = Preconditions.checkNotNull(keyUriSupplier);
  }

  @Override
  public JsonWebKeySet supply() {
    GenericUrl location = keyUriSupplier.supply();
    String body = download(location);

    JsonNode document;
    try {
      document = MAPPER.readTree(body);
    } catch (IOException e) {
      throw unavailable("The key set document from " + location + " is not JSON", e);
    }
    if (document == null || !document.isObject()) {
      throw unavailable("The key set document from " + location + " is not a JSON object", null);
    }

    JsonWebKeySet keySet = document.has("keys") ? fromJwks(body) : fromCertificates(document);
    logger.atFine().log("Loaded %d signing keys from %s",
        keySet.getJsonWebKeys().size(), location);
    return keySet;
  }

  private String download(GenericUrl location) {
    HttpResponse response = null;
    try {
      response = requestFactory.buildGetRequest(location).execute();
      return response.parseAsString();
    } catch (IOException e) {
      throw unavailable("Unable to download the key set from " + location, e);
    } finally {
      if (response != null) {
        try {
          response.disconnect();
        } catch (IOException e) {
          logger.atFine().withCause(e).log("Failed to release the connection to %s", location);
        }
      }
    }
  }

  private static JsonWebKeySet fromJwks(String body) {
    try {
      return new JsonWebKeySet(body);
    } catch (JoseException e) {
      throw unavailable("The JWKS document is malformed", e);
    }
  }

  private static JsonWebKeySet fromCertificates(JsonNode document) {
    List<JsonWebKey> keys = Lists.newArrayList();
    X509Util x509 = new X509Util();
    Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String keyId = field.getKey();
      if (!field.getValue().isTextual()) {
        throw unavailable("The certificate for key " + keyId + " is not a string", null);
      }
      JsonWebKey key;
      try {
        key = wrap(x509.fromBase64Der(stripPem(field.getValue().asText())).getPublicKey());
      } catch (JoseException e) {
        throw unavailable("The certificate for key " + keyId + " cannot be decoded", e);
      }
      key.setKeyId(keyId);
      keys.add(key);
    }
    return new JsonWebKeySet(keys);
  }

  @VisibleForTesting
  static String stripPem(String pem) {
    String base64 = pem.replace(PEM_HEADER, "").replace(PEM_FOOTER, "");
    return CharMatcher.whitespace().removeFrom(base64);
  }

  private static JsonWebKey wrap(PublicKey publicKey) {
    if (publicKey instanceof RSAPublicKey) {
      return new RsaJsonWebKey((RSAPublicKey) publicKey);
    }
    if (publicKey instanceof ECPublicKey) {
      return new EllipticCurveJsonWebKey((ECPublicKey) publicKey);
    }
    throw unavailable("Certificates holding " + publicKey.getAlgorithm()
        + " keys are not supported", null);
  }

  private static DependencyUnavailableException unavailable(String message, Throwable cause) {
    return new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, message,
        cause);
  }
}
