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

/**
 * Verifies bearer tokens of one kind.
 */
public interface TokenVerifier {

  /**
   * Checks the token's signature and validity and extracts its claims.
   *
   * <p>Problems with the token itself are reported as a failed {@link VerificationResult}, never
   * thrown. An unreachable key provider is reported with
   * {@link AuthErrorCode#KEY_PROVIDER_UNAVAILABLE}.
   *
   * @param token the raw bearer token
   */
  VerificationResult verify(String token);
}
