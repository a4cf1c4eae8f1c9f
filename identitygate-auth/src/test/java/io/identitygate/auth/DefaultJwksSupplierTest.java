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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.util.List;

/**
 * Tests for {@link DefaultJwksSupplier}.
 */
@RunWith(JUnit4.class)
public final class DefaultJwksSupplierTest {
  private static final GenericUrl KEYS_URL =
      new GenericUrl("https://login.example.com/tenant-1/discovery/v2.0/keys");

  private final KeyUriSupplier keyUriSupplier = mock(KeyUriSupplier.class);
  private final KeyDocumentTransport transport = new KeyDocumentTransport();
  private DefaultJwksSupplier supplier;

  @Before
  public void setUp() {
    when(keyUriSupplier.supply()).thenReturn(KEYS_URL);
    supplier = new DefaultJwksSupplier(transport.createRequestFactory(), keyUriSupplier);
  }

  @Test
  public void readsJwksDocument() {
    RsaJsonWebKey first = TestUtils.generateRsaJsonWebKey("kid-1");
    RsaJsonWebKey second = TestUtils.generateRsaJsonWebKey("kid-2");
    transport.body = TestUtils.toJwksJson(first, second);

    List<JsonWebKey> keys = supplier.supply().getJsonWebKeys();

    assertThat(keys).hasSize(2);
    assertEquals("kid-1", keys.get(0).getKeyId());
    assertEquals("kid-2", keys.get(1).getKeyId());
    assertThat(keys.get(1).getKey().getEncoded()).isEqualTo(second.getPublicKey().getEncoded());
    assertThat(transport.requestedUrls).containsExactly(KEYS_URL.build());
  }

  @Test
  public void readsCertificateMap() {
    RsaJsonWebKey signingKey = TestUtils.generateRsaJsonWebKey("cert-kid");
    String pem = TestUtils.generateX509Cert(signingKey);
    transport.body = "{\"cert-kid\": \"" + pem.replace("\r", "\\r").replace("\n", "\\n") + "\"}";

    JsonWebKey key = Iterables.getOnlyElement(supplier.supply().getJsonWebKeys());

    assertEquals("cert-kid", key.getKeyId());
    assertThat(key).isInstanceOf(RsaJsonWebKey.class);
    assertThat(key.getKey().getEncoded()).isEqualTo(signingKey.getPublicKey().getEncoded());
  }

  @Test
  public void stripPemRemovesArmorAndLineBreaks() {
    String pem = DefaultJwksSupplier.PEM_HEADER + "\r\nMIIB\r\nAAAA\r\n"
        + DefaultJwksSupplier.PEM_FOOTER + "\n";
    assertEquals("MIIBAAAA", DefaultJwksSupplier.stripPem(pem));
  }

  @Test
  public void transportFailureMeansProviderUnavailable() {
    transport.failure = new IOException("connect timed out");
    DependencyUnavailableException e = expectUnavailable();
    assertThat(e).hasCauseThat().isSameInstanceAs(transport.failure);
  }

  @Test
  public void errorStatusMeansProviderUnavailable() {
    transport.statusCode = 500;
    transport.body = "{}";
    expectUnavailable();
  }

  @Test
  public void nonJsonBodyMeansProviderUnavailable() {
    transport.body = "<html>maintenance</html>";
    expectUnavailable();
  }

  @Test
  public void jsonArrayMeansProviderUnavailable() {
    transport.body = "[1, 2]";
    expectUnavailable();
  }

  @Test
  public void nonStringCertificateMeansProviderUnavailable() {
    transport.body = "{\"kid\": 42}";
    DependencyUnavailableException e = expectUnavailable();
    assertThat(e).hasMessageThat().contains("kid");
  }

  @Test
  public void undecodableCertificateMeansProviderUnavailable() {
    transport.body = "{\"kid\": \"bm90IGEgY2VydGlmaWNhdGU=\"}";
    expectUnavailable();
  }

  @Test
  public void keyUriFailureIsRethrownUnchanged() {
    DependencyUnavailableException failure =
        new DependencyUnavailableException(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, "no metadata");
    when(keyUriSupplier.supply()).thenThrow(failure);
    try {
      supplier.supply();
      fail("Expected DependencyUnavailableException");
    } catch (DependencyUnavailableException e) {
      assertSame(failure, e);
    }
    assertThat(transport.requestedUrls).isEmpty();
  }

  private DependencyUnavailableException expectUnavailable() {
    try {
      supplier.supply();
      fail("Expected DependencyUnavailableException");
      return null;
    } catch (DependencyUnavailableException e) {
      assertEquals(AuthErrorCode.KEY_PROVIDER_UNAVAILABLE, e.getErrorCode());
      return e;
    }
  }

  /** Serves one configurable document, or fails, for every GET. */
  private static final class KeyDocumentTransport extends MockHttpTransport {
    final List<String> requestedUrls = Lists.newArrayList();
    String body = "{\"keys\": []}";
    int statusCode = 200;
    IOException failure;

    @Override
    public LowLevelHttpRequest buildRequest(String method, final String url) {
      requestedUrls.add(url);
      return new MockLowLevelHttpRequest(url) {
        @Override
        public LowLevelHttpResponse execute() throws IOException {
          if (failure != null) {
            throw failure;
          }
          return new MockLowLevelHttpResponse()
              .setStatusCode(statusCode)
              .setContentType(Json.MEDIA_TYPE)
              .setContent(body);
        }
      };
    }
  }
}
