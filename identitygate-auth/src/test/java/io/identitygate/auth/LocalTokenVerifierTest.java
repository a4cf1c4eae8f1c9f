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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import io.identitygate.auth.user.AuthKind;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.keys.HmacKey;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Tests for {@link LocalTokenVerifier}.
 */
@RunWith(JUnit4.class)
public final class LocalTokenVerifierTest {
  private final LocalTokenVerifier verifier =
      new LocalTokenVerifier(TestUtils.LOCAL_SECRET, "HS256", TestUtils.FIXED_CLOCK);

  @Test
  public void testValidToken() {
    String token = TestUtils.generateLocalToken(" Alice@Example.COM ",
        TestUtils.secondsFromNow(600), TestUtils.LOCAL_SECRET);

    VerificationResult result = verifier.verify(token);

    assertTrue(result.isSuccess());
    VerifiedToken verified = result.getToken();
    assertEquals(AuthKind.LOCAL, verified.getKind());
    assertEquals("alice@example.com", verified.getEmail());
    assertNull(verified.getSubject());
    assertEquals(Instant.ofEpochMilli(TestUtils.NOW_MILLIS).plusSeconds(600),
        verified.getExpiration());
  }

  @Test
  public void testExpiredToken() {
    String token = TestUtils.generateLocalToken("alice@example.com",
        TestUtils.secondsFromNow(-10), TestUtils.LOCAL_SECRET);

    VerificationResult result = verifier.verify(token);

    assertFalse(result.isSuccess());
    assertEquals(AuthErrorCode.EXPIRED_TOKEN, result.getErrorCode());
  }

  @Test
  public void testTokenWithoutExpirationIsRefused() {
    String token = TestUtils.generateLocalToken("alice@example.com", null,
        TestUtils.LOCAL_SECRET);

    assertEquals(AuthErrorCode.INVALID_TOKEN, verifier.verify(token).getErrorCode());
  }

  @Test
  public void testWrongSecret() {
    String token = TestUtils.generateLocalToken("alice@example.com",
        TestUtils.secondsFromNow(600), "another-secret-that-is-at-least-32-bytes-long");

    assertEquals(AuthErrorCode.INVALID_TOKEN, verifier.verify(token).getErrorCode());
  }

  @Test
  public void testMissingSubject() {
    String token = TestUtils.generateLocalToken(null, TestUtils.secondsFromNow(600),
        TestUtils.LOCAL_SECRET);

    VerificationResult result = verifier.verify(token);

    assertEquals(AuthErrorCode.INVALID_TOKEN, result.getErrorCode());
  }

  @Test
  public void testOtherAlgorithmIsRefused() {
    JwtClaims claims = new JwtClaims();
    claims.setSubject("alice@example.com");
    claims.setExpirationTime(TestUtils.secondsFromNow(600));
    String token = TestUtils.sign(claims,
        new HmacKey(TestUtils.LOCAL_SECRET.getBytes(StandardCharsets.UTF_8)),
        AlgorithmIdentifiers.HMAC_SHA512, null);

    assertEquals(AuthErrorCode.INVALID_TOKEN, verifier.verify(token).getErrorCode());
  }

  @Test
  public void testGarbage() {
    assertEquals(AuthErrorCode.INVALID_TOKEN, verifier.verify("not-a-token").getErrorCode());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonHmacAlgorithmIsRejected() {
    new LocalTokenVerifier(TestUtils.LOCAL_SECRET, "RS256");
  }
}
