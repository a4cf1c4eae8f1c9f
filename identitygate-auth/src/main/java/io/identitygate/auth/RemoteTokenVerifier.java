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

import com.google.api.client.util.Clock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;

import io.identitygate.auth.user.Identity;

import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import java.security.PublicKey;
import java.time.Instant;
import java.util.List;

import javax.annotation.Nullable;

/**
 * Verifies tokens issued by the remote identity provider.
 *
 * <p>The signing key is looked up by the token's key id in a {@link KeySetCache}. Besides the
 * signature the token's expiration, not-before time, audience and issuer are checked. A verified
 * token is classified as a user token when it names both a person and an email, and as a service
 * token when it is an application-only token.
 */
public final class RemoteTokenVerifier implements TokenVerifier {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting
  static final ImmutableList<String> EMAIL_CLAIMS =
      ImmutableList.of("preferred_username", "email", "upn", "unique_name");

  private static final String ROLES_CLAIM = "roles";
  private static final String SCOPE_CLAIM = "scp";
  private static final String APP_ID_CLAIM = "appid";
  private static final String AUTHORIZED_PARTY_CLAIM = "azp";
  private static final String APP_ID_ACR_CLAIM = "appidacr";

  private final KeySetCache keySetCache;
  private final String[] audiences;
  private final String[] issuers;
  private final String subjectClaim;
  private final Clock clock;

  /**
   * Constructor.
   *
   * @param keySetCache supplies the provider's signing keys
   * @param audiences the accepted {@code aud} values
   * @param issuers the accepted {@code iss} values
   * @param subjectClaim the claim holding the provider's stable id of a person
   */
  public RemoteTokenVerifier(KeySetCache keySetCache, List<String> audiences,
      List<String> issuers, String subjectClaim) {
    this(keySetCache, audiences, issuers, subjectClaim, Clock.SYSTEM);
  }

  RemoteTokenVerifier(KeySetCache keySetCache, List<String> audiences, List<String> issuers,
      String subjectClaim, Clock clock) {
    Preconditions.checkArgument(!audiences.isEmpty(), "at least one audience is required");
    Preconditions.checkArgument(!issuers.isEmpty(), "at least one issuer is required");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(subjectClaim),
        "subjectClaim cannot be empty");
    this.keySetCache = Preconditions.checkNotNull(keySetCache);
    this.audiences = audiences.toArray(new String[0]);
    this.issuers = issuers.toArray(new String[0]);
    this.subjectClaim = subjectClaim;
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Override
  public VerificationResult verify(String token) {
    Preconditions.checkNotNull(token);

    String keyId;
    try {
      JsonWebSignature jws = new JsonWebSignature();
      jws.setCompactSerialization(token);
      keyId = jws.getKeyIdHeaderValue();
    } catch (JoseException exception) {
      logger.atFine().withCause(exception).log("Remote token header is malformed");
      return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
          "The remote token header is malformed");
    }
    if (Strings.isNullOrEmpty(keyId)) {
      return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
          "The remote token header has no key id");
    }

    PublicKey key;
    try {
      key = keySetCache.getKey(keyId);
    } catch (UnauthenticatedException exception) {
      return VerificationResult.failure(exception.getErrorCode(), exception.getMessage());
    } catch (DependencyUnavailableException exception) {
      logger.atWarning().withCause(exception).log("The key provider is unavailable");
      return VerificationResult.failure(exception.getErrorCode(), exception.getMessage());
    }

    JwtConsumer jwtConsumer = new JwtConsumerBuilder()
        .setRequireExpirationTime()
        .setEvaluationTime(NumericDate.fromMilliseconds(clock.currentTimeMillis()))
        .setExpectedAudience(true, audiences)
        .setExpectedIssuers(true, issuers)
        .setVerificationKey(key)
        .setJwsAlgorithmConstraints(
            new AlgorithmConstraints(ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256))
        .build();
    JwtClaims claims;
    try {
      claims = jwtConsumer.processToClaims(token);
    } catch (InvalidJwtException exception) {
      if (exception.hasExpired()) {
        return VerificationResult.failure(AuthErrorCode.EXPIRED_TOKEN,
            "The remote token has expired");
      }
      logger.atFine().withCause(exception).log("Remote token rejected");
      return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
          "The remote token failed validation");
    }

    try {
      return classify(claims);
    } catch (MalformedClaimException exception) {
      logger.atFine().withCause(exception).log("Remote token has malformed claims");
      return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
          "The remote token has malformed claims");
    }
  }

  private VerificationResult classify(JwtClaims claims) throws MalformedClaimException {
    Instant expiration = Instant.ofEpochSecond(claims.getExpirationTime().getValue());
    boolean rolesClaimPresent = claims.hasClaim(ROLES_CLAIM);
    List<String> roles = rolesClaimPresent
        ? claims.getStringListClaimValue(ROLES_CLAIM)
        : ImmutableList.<String>of();

    String subject = stringClaim(claims, subjectClaim);
    String email = null;
    for (String claimName : EMAIL_CLAIMS) {
      email = Identity.normalizeEmail(stringClaim(claims, claimName));
      if (email != null) {
        break;
      }
    }
    if (subject != null && email != null) {
      return VerificationResult.success(
          VerifiedToken.remoteUser(subject, email, roles, rolesClaimPresent, expiration));
    }

    String applicationId = stringClaim(claims, APP_ID_CLAIM);
    if (applicationId == null) {
      applicationId = stringClaim(claims, AUTHORIZED_PARTY_CLAIM);
    }
    if (applicationId != null) {
      boolean appOnlyAuth = "1".equals(stringClaim(claims, APP_ID_ACR_CLAIM));
      boolean appRolesOnly = !roles.isEmpty() && !claims.hasClaim(SCOPE_CLAIM);
      if (appOnlyAuth || appRolesOnly) {
        return VerificationResult.success(
            VerifiedToken.remoteService(applicationId, roles, rolesClaimPresent, expiration));
      }
    }
    return VerificationResult.failure(AuthErrorCode.UNSUPPORTED_IDENTITY,
        "The remote token identifies neither a user nor a service");
  }

  @Nullable
  private static String stringClaim(JwtClaims claims, String name) {
    Object value = claims.getClaimValue(name);
    if (value instanceof String && !((String) value).trim().isEmpty()) {
      return ((String) value).trim();
    }
    return null;
  }
}
