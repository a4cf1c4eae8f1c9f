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


package io.identitygate.servlet;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.HttpHeaders;

import io.identitygate.auth.DependencyUnavailableException;
import io.identitygate.auth.IdentityResolver;
import io.identitygate.auth.UnauthenticatedException;
import io.identitygate.auth.user.Identity;

import javax.annotation.Nullable;
import javax.servlet.http.HttpServletRequest;

/**
 * Authenticator that extracts the bearer token from the HTTP authorization header or from the
 * "access_token" query parameter, and resolves it to an {@link Identity}.
 *
 * <p>The resolved identity is also stored as a request attribute, see {@link #getIdentity}.
 */
public final class BearerTokenAuthenticator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting
  static final String IDENTITY_ATTRIBUTE = BearerTokenAuthenticator.class.getName() + ".identity";

  private static final String ACCESS_TOKEN_PARAM_NAME = "access_token";
  private static final String BEARER_TOKEN_PREFIX = "Bearer ";

  private final IdentityResolver identityResolver;

  public BearerTokenAuthenticator(IdentityResolver identityResolver) {
    this.identityResolver = Preconditions.checkNotNull(identityResolver);
  }

  /**
   * Resolves the request's bearer token.
   *
   * @return the identity, or {@code null} when the request carries no usable token or the token
   *         is refused
   * @throws DependencyUnavailableException if the user store or the key provider is unreachable
   */
  @Nullable
  public Identity authenticate(HttpServletRequest request) {
    Preconditions.checkNotNull(request);

    Optional<String> token = extractAuthToken(request);
    if (!token.isPresent()) {
      logger.atInfo().log("No auth token is contained in the HTTP request");
      return null;
    }

    try {
      Identity identity = identityResolver.resolve(token.get());
      request.setAttribute(IDENTITY_ATTRIBUTE, identity);
      return identity;
    } catch (UnauthenticatedException exception) {
      logger.atWarning().withCause(exception).log("Authentication failed: %s",
          exception.getErrorCode());
      return null;
    }
  }

  /**
   * @return the identity a previous {@link #authenticate} stored on {@code request}, or
   *         {@code null}
   */
  @Nullable
  public static Identity getIdentity(HttpServletRequest request) {
    Object identity = request.getAttribute(IDENTITY_ATTRIBUTE);
    return identity instanceof Identity ? (Identity) identity : null;
  }

  private static Optional<String> extractAuthToken(HttpServletRequest request) {
    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader != null) {
      // A present header wins over the query parameter, even when it is not a bearer header.
      if (authHeader.startsWith(BEARER_TOKEN_PREFIX)) {
        String token = authHeader.substring(BEARER_TOKEN_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.<String>absent() : Optional.of(token);
      }
      return Optional.absent();
    }

    String accessToken = request.getParameter(ACCESS_TOKEN_PARAM_NAME);
    if (accessToken != null && !accessToken.isEmpty()) {
      return Optional.of(accessToken);
    }
    return Optional.absent();
  }
}
