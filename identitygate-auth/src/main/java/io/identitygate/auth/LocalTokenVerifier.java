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
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;

import io.identitygate.auth.user.Identity;

import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Verifies tokens signed with the locally held shared secret.
 *
 * <p>The token must carry an expiration time, and its subject is taken to be the user's email.
 */
public final class LocalTokenVerifier implements TokenVerifier {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final HmacKey key;
  private final String algorithm;
  private final Clock clock;

  /**
   * Constructor.
   *
   * @param secret the shared secret tokens are signed with
   * @param algorithm the HMAC algorithm tokens must use, such as {@code HS256}
   */
  public LocalTokenVerifier(String secret, String algorithm) {
    this(secret, algorithm, Clock.SYSTEM);
  }

  LocalTokenVerifier(String secret, String algorithm, Clock clock) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(secret), "secret cannot be empty");
    Preconditions.checkArgument(algorithm != null && algorithm.startsWith("HS"),
        "%s is not an HMAC algorithm", algorithm);
    this.key = new HmacKey(secret.getBytes(StandardCharsets.UTF_8));
    this.algorithm = algorithm;
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Override
  public VerificationResult verify(String token) {
    Preconditions.checkNotNull(token);

    JwtConsumer jwtConsumer = new JwtConsumerBuilder()
        .setRequireExpirationTime()
        .setEvaluationTime(NumericDate.fromMilliseconds(clock.currentTimeMillis()))
        .setSkipDefaultAudienceValidation()
        .setVerificationKey(key)
        .setRelaxVerificationKeyValidation()
        .setJwsAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, algorithm))
        .build();
    JwtClaims claims;
    try {
      claims = jwtConsumer.processToClaims(token);
    } catch (InvalidJwtException exception) {
      if (exception.hasExpired()) {
        return VerificationResult.failure(AuthErrorCode.EXPIRED_TOKEN,
            "The local token has expired");
      }
      logger.atFine().withCause(exception).log("Local token rejected");
      return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
          "The local token is malformed or its signature is invalid");
    }

    try {
      String email = Identity.normalizeEmail(claims.getSubject());
      if (email == null) {
        return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
            "The local token has no subject");
      }
      NumericDate expiration = claims.getExpirationTime();
      return VerificationResult.success(VerifiedToken.local(email,
          Instant.ofEpochSecond(expiration.getValue())));
    } catch (MalformedClaimException exception) {
      logger.atFine().withCause(exception).log("Local token has malformed claims");
      return VerificationResult.failure(AuthErrorCode.INVALID_TOKEN,
          "The local token has malformed claims");
    }
  }
}
