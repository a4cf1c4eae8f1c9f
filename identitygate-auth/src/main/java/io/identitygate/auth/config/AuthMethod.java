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


package io.identitygate.auth.config;

import com.google.common.base.Optional;
import com.google.common.base.Strings;

import java.util.Locale;

/**
 * The token verification methods that {@code IdentityResolver} tries.
 */
public enum AuthMethod {
  LOCAL(true, false),
  REMOTE(false, true),
  BOTH(true, true);

  private final boolean localEnabled;
  private final boolean remoteEnabled;

  AuthMethod(boolean localEnabled, boolean remoteEnabled) {
    this.localEnabled = localEnabled;
    this.remoteEnabled = remoteEnabled;
  }

  public boolean isLocalEnabled() {
    return localEnabled;
  }

  public boolean isRemoteEnabled() {
    return remoteEnabled;
  }

  /**
   * Parses {@code local}, {@code remote} or {@code both}, ignoring case and surrounding blanks.
   */
  public static Optional<AuthMethod> parse(String value) {
    if (Strings.isNullOrEmpty(value)) {
      return Optional.absent();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (AuthMethod method : values()) {
      if (method.name().equals(normalized)) {
        return Optional.of(method);
      }
    }
    return Optional.absent();
  }
}
