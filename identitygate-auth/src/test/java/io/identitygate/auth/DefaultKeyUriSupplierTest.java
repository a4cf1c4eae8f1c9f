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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.common.base.Optional;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Tests for {@link DefaultKeyUriSupplier}.
 */
@RunWith(JUnit4.class)
public final class DefaultKeyUriSupplierTest {
  private static final String JWKS_URI = "https://login.example.com/tenant-1/discovery/keys";

  private final RecordingHttpTransport httpTransport = new RecordingHttpTransport();

  @Test
  public void testConfiguredUriIsReturnedWithoutDiscovery() {
    DefaultKeyUriSupplier supplier = new DefaultKeyUriSupplier(
        httpTransport.createRequestFactory(), TestUtils.AUTHORITY, Optional.of(JWKS_URI));

    assertEquals(new GenericUrl(JWKS_URI), supplier.supply());
    assertEquals(0, httpTransport.urls.size());
  }

  @Test
  public void testDiscoveryIsMemoized() {
    httpTransport.content = "{\"issuer\": \"x\", \"jwks_uri\": \"" + JWKS_URI + "\"}";
    DefaultKeyUriSupplier supplier = new DefaultKeyUriSupplier(
        httpTransport.createRequestFactory(), TestUtils.AUTHORITY, Optional.<String>absent());

    assertEquals(new GenericUrl(JWKS_URI), supplier.supply());
    assertEquals(new GenericUrl(JWKS_URI), supplier.supply());

    assertEquals(1, httpTransport.urls.size());
    assertEquals(TestUtils.AUTHORITY + "/v2.0/.well-known/openid-configuration",
        httpTransport.urls.get(0));
  }

  @Test
  public void testDiscoveryAddsHttpsScheme() {
    httpTransport.content = "{\"jwks_uri\": \"" + JWKS_URI + "\"}";
    DefaultKeyUriSupplier supplier = new DefaultKeyUriSupplier(
        httpTransport.createRequestFactory(), "login.example.com/tenant-1/v2.0",
        Optional.<String>absent());

    supplier.supply();

    assertEquals("https://login.example.com/tenant-1/v2.0/.well-known/openid-configuration",
        httpTransport.urls.get(0));
  }

  @Test
  public void testMetadataWithoutJwksUri() {
    httpTransport.content = "{\"issuer\": \"x\"}";
    DefaultKeyUriSupplier supplier = new DefaultKeyUriSupplier(
        httpTransport.createRequestFactory(), TestUtils.AUTHORITY, Optional.<String>absent());

    try {
      supplier.supply();
      fail("Expected DependencyUnavailableException.");
    } catch (DependencyUnavailableException exception) {
      assertEquals(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, exception.getErrorCode());
    }
  }

  @Test
  public void testMetadataWithMalformedJwksUri() {
    httpTransport.content = "{\"jwks_uri\": \"not a url\"}";
    DefaultKeyUriSupplier supplier = new DefaultKeyUriSupplier(
        httpTransport.createRequestFactory(), TestUtils.AUTHORITY, Optional.<String>absent());

    try {
      supplier.supply();
      fail("Expected DependencyUnavailableException.");
    } catch (DependencyUnavailableException exception) {
      assertEquals(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, exception.getErrorCode());
      assertTrue(exception.getCause() instanceof IllegalArgumentException);
    }
  }

  @Test
  public void testFailedDiscoveryIsRetried() {
    httpTransport.ioException = new IOException("connection refused");
    DefaultKeyUriSupplier supplier = new DefaultKeyUriSupplier(
        httpTransport.createRequestFactory(), TestUtils.AUTHORITY, Optional.<String>absent());
    try {
      supplier.supply();
      fail("Expected DependencyUnavailableException.");
    } catch (DependencyUnavailableException exception) {
      assertEquals(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, exception.getErrorCode());
    }

    httpTransport.ioException = null;
    httpTransport.content = "{\"jwks_uri\": \"" + JWKS_URI + "\"}";
    assertEquals(new GenericUrl(JWKS_URI), supplier.supply());
  }

  private static final class RecordingHttpTransport extends MockHttpTransport {
    private final List<String> urls = new ArrayList<>();
    private String content;
    private IOException ioException;

    @Override
    public LowLevelHttpRequest buildRequest(String method, String url) throws IOException {
      urls.add(url);
      return new MockLowLevelHttpRequest() {
        @Override
        public LowLevelHttpResponse execute() throws IOException {
          if (ioException != null) {
            throw ioException;
          }
          MockLowLevelHttpResponse response = new MockLowLevelHttpResponse();
          response.setStatusCode(200);
          response.setContentType(Json.MEDIA_TYPE);
          response.setContent(content);
          return response;
        }
      };
    }
  }
}
