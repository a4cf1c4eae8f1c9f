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
 * Classifies why a token could not be turned into an identity.
 */
public enum AuthErrorCode {
  /** Bad signature, malformed token or header, or a claim that fails validation. */
  INVALID_TOKEN(false),

  /** The token's expiration time has passed. */
  EXPIRED_TOKEN(false),

  /** The key id is absent from the provider's key set even after a forced refetch. */
  UNKNOWN_KEY(false),

  /** The token is valid but shaped like neither a user token nor a service token. */
  UNSUPPORTED_IDENTITY(false),

  /** Two writers raced to create the same user and the winner's record could not be read. */
  PROVISIONING_CONFLICT(false),

  /** The user store could not be reached or failed. */
  STORE_UNAVAILABLE(true),

  /** The remote key provider could not be reached and no key set was ever cached. */
  KEY_PROVIDER_UNAVAILABLE(true),

  /** No enabled authentication method validated the token. */
  UNAUTHORIZED(false);

  private final boolean infrastructure;

  AuthErrorCode(boolean infrastructure) {
    this.infrastructure = infrastructure;
  }

  /**
   * @return {@code true} when the failure comes from a downstream dependency rather than from
   *         the credentials themselves
   */
  public boolean isInfrastructure() {
    return infrastructure;
  }
}
