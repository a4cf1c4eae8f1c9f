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
 * Thrown when a downstream dependency (the user store or the remote key provider) fails, so
 * callers can tell an outage apart from bad credentials.
 */
public class DependencyUnavailableException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final AuthErrorCode errorCode;

  public DependencyUnavailableException(AuthErrorCode errorCode, String message) {
    this(errorCode, message, null);
  }

  public DependencyUnavailableException(AuthErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    Preconditions.checkArgument(errorCode.isInfrastructure(),
        "%s is not an infrastructure error", errorCode);
    this.errorCode = errorCode;
  }

  public AuthErrorCode getErrorCode() {
    return errorCode;
  }
}
