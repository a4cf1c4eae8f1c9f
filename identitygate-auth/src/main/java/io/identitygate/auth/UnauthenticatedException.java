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

import com.google.common.base.Preconditions;

/**
 * Thrown when the presented credentials cannot be turned into an identity.
 */
public class UnauthenticatedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final AuthErrorCode errorCode;

  public UnauthenticatedException(String message) {
    this(AuthErrorCode.UNAUTHORIZED, message);
  }

  public UnauthenticatedException(AuthErrorCode errorCode, String message) {
    super(message);
    this.errorCode = Preconditions.checkNotNull(errorCode);
  }

  public UnauthenticatedException(AuthErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = Preconditions.checkNotNull(errorCode);
  }

  public AuthErrorCode getErrorCode() {
    return errorCode;
  }
}
