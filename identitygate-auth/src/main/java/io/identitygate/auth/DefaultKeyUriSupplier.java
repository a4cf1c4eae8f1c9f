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
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;

import javax.annotation.Nullable;

/**
 * Default implementation of {@link KeyUriSupplier}.
 *
 * <p>Returns the configured key set URI, or discovers it from the authority's OpenID provider
 * metadata. A successful discovery is remembered; a failed one is retried on the next call.
 */
public final class DefaultKeyUriSupplier implements KeyUriSupplier {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String DEFAULT_SCHEME_PREFIX = "https://";
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String DISCOVERY_DOCUMENT_PATH = ".well-known/openid-configuration";

  private final HttpRequestFactory requestFactory;
  private final String authority;
  private volatile GenericUrl jwksUri;

  /**
   * Constructor.
   *
   * @param requestFactory is the factory used to make HTTP requests.
   * @param authority is the identity provider's authority URL, used for discovery.
   * @param jwksUri is the configured key set URI; discovery is used when it is absent.
   */
  public DefaultKeyUriSupplier(HttpRequestFactory requestFactory, String authority,
      Optional<String> jwksUri) {
    Preconditions.checkNotNull(requestFactory);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(authority), "authority cannot be empty");
    Preconditions.checkNotNull(jwksUri);

    this.requestFactory = requestFactory;
    this.authority = authority;
    this.jwksUri = jwksUri.isPresent() ? new GenericUrl(jwksUri.get()) : null;
  }

  @Override
  public GenericUrl supply() {
    GenericUrl uri = jwksUri;
    if (uri != null) {
      return uri;
    }
    synchronized (this) {
      if (jwksUri == null) {
        jwksUri = discoverJwksUri(discoveryUrl(authority));
        logger.atInfo().log("Discovered key set URI %s", jwksUri);
      }
      return jwksUri;
    }
  }

  private GenericUrl discoverJwksUri(String metadataUrl) {
    try {
      HttpResponse response =
          requestFactory.buildGetRequest(new GenericUrl(metadataUrl)).execute();
      String json;
      try {
        json = response.parseAsString();
      } finally {
        response.disconnect();
      }
      ProviderMetadata metadata = MAPPER.readValue(json, ProviderMetadata.class);
      if (Strings.isNullOrEmpty(metadata.jwksUri)) {
        throw new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "OpenID provider metadata at " + metadataUrl + " has no jwks_uri");
      }
      try {
        return new GenericUrl(metadata.jwksUri);
      } catch (IllegalArgumentException exception) {
        throw new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
            "OpenID provider metadata at " + metadataUrl + " has a malformed jwks_uri: "
                + metadata.jwksUri, exception);
      }
    } catch (IOException exception) {
      throw new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE,
          "Cannot retrieve or parse OpenID provider metadata", exception);
    }
  }

  // <authority>/v2.0/.well-known/openid-configuration, defaulting to https.
  private static String discoveryUrl(String authority) {
    String url = authority;
    if (!URI.create(authority).isAbsolute()) {
      url = DEFAULT_SCHEME_PREFIX + authority;
    }
    if (!url.endsWith("/")) {
      url += "/";
    }
    if (!url.endsWith("/v2.0/")) {
      url += "v2.0/";
    }
    return url + DISCOVERY_DOCUMENT_PATH;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class ProviderMetadata {
    @Nullable
    @JsonProperty("jwks_uri")
    private String jwksUri;
  }
}
