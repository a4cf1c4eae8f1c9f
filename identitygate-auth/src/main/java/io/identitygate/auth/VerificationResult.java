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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The outcome of one {@link TokenVerifier}: either the verified claims or the reason the token was
 * refused.
 */
public final class VerificationResult {
  private final VerifiedToken token;
  private final AuthErrorCode errorCode;
  private final String message;

  private VerificationResult(VerifiedToken token, AuthErrorCode errorCode, String message) {
    this.token = token;
    this.errorCode = errorCode;
    this.message = message;
  }

  public static VerificationResult success(VerifiedToken token) {
    return new VerificationResult(Preconditions.checkNotNull(token), null, null);
  }

  public static VerificationResult failure(AuthErrorCode errorCode, String message) {
    return new VerificationResult(null, Preconditions.checkNotNull(errorCode),
        Preconditions.checkNotNull(message));
  }

  public boolean isSuccess() {
    return token != null;
  }

  /**
   * @throws IllegalStateException if the verification failed
   */
  public VerifiedToken getToken() {
    Preconditions.checkState(token != null, "verification failed: %s", message);
    return token;
  }

  /**
   * @throws IllegalStateException if the verification succeeded
   */
  public AuthErrorCode getErrorCode() {
    Preconditions.checkState(errorCode != null, "verification succeeded");
    return errorCode;
  }

  /**
   * @throws IllegalStateException if the verification succeeded
   */
  public String getMessage() {
    Preconditions.checkState(message != null, "verification succeeded");
    return message;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return MoreObjects.toStringHelper(this).add("token", token).toString();
    }
    return MoreObjects.toStringHelper(this)
        .add("errorCode", errorCode)
        .add("message", message)
        .toString();
  }
}
