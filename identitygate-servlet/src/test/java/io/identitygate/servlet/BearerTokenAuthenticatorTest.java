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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.identitygate.auth.AuthErrorCode;
import io.identitygate.auth.DependencyUnavailableException;
import io.identitygate.auth.IdentityResolver;
import io.identitygate.auth.UnauthenticatedException;
import io.identitygate.auth.user.Identity;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import org.springframework.mock.web.MockHttpServletRequest;

/**
 * Test for {@link BearerTokenAuthenticator}.
 */
@RunWith(MockitoJUnitRunner.class)
public class BearerTokenAuthenticatorTest {
  private static final String TOKEN = "header.payload.signature";
  private static final Identity IDENTITY =
      Identity.newBuilder().setId("user-1").setEmail("user@email.com").build();

  @Mock private IdentityResolver identityResolver;

  private BearerTokenAuthenticator authenticator;
  private MockHttpServletRequest request;

  @Before
  public void setUp() {
    this.authenticator = new BearerTokenAuthenticator(identityResolver);
    this.request = new MockHttpServletRequest();
  }

  @Test
  public void testAuthenticateWithHeader() {
    when(identityResolver.resolve(TOKEN)).thenReturn(IDENTITY);
    request.addHeader("Authorization", "Bearer " + TOKEN);

    assertSame(IDENTITY, authenticator.authenticate(request));
    assertSame(IDENTITY, BearerTokenAuthenticator.getIdentity(request));
  }

  @Test
  public void testAuthenticateWithQueryParameter() {
    when(identityResolver.resolve(TOKEN)).thenReturn(IDENTITY);
    request.setParameter("access_token", TOKEN);

    assertSame(IDENTITY, authenticator.authenticate(request));
  }

  @Test
  public void testHeaderWinsOverQueryParameter() {
    request.addHeader("Authorization", "Basic dXNlcjpwYXNz");
    request.setParameter("access_token", TOKEN);

    assertNull(authenticator.authenticate(request));
    verify(identityResolver, never()).resolve(anyString());
  }

  @Test
  public void testNoToken() {
    assertNull(authenticator.authenticate(request));
    assertNull(BearerTokenAuthenticator.getIdentity(request));
    verify(identityResolver, never()).resolve(anyString());
  }

  @Test
  public void testEmptyBearerToken() {
    request.addHeader("Authorization", "Bearer   ");

    assertNull(authenticator.authenticate(request));
    verify(identityResolver, never()).resolve(anyString());
  }

  @Test
  public void testHandleUnauthenticatedException() {
    when(identityResolver.resolve(TOKEN)).thenThrow(
        new UnauthenticatedException(AuthErrorCode.UNAUTHORIZED, "refused"));
    request.addHeader("Authorization", "Bearer " + TOKEN);

    assertNull(authenticator.authenticate(request));
    assertNull(BearerTokenAuthenticator.getIdentity(request));
  }

  @Test
  public void testDependencyUnavailablePropagates() {
    when(identityResolver.resolve(TOKEN)).thenThrow(
        new DependencyUnavailableException(AuthErrorCode.STORE_UNAVAILABLE, "store is down"));
    request.addHeader("Authorization", "Bearer " + TOKEN);

    try {
      authenticator.authenticate(request);
      fail("Expected DependencyUnavailableException.");
    } catch (DependencyUnavailableException exception) {
      assertEquals(AuthErrorCode.STORE_UNAVAILABLE, exception.getErrorCode());
    }
  }
}
