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


package io.identitygate.auth.user;

import com.google.common.base.Ascii;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A normalized (lookup type, value) pair used to key {@link UserRecordCache}.
 */
public final class LookupKey {
  private final LookupType type;
  private final String value;

  private LookupKey(LookupType type, String value) {
    this.type = type;
    this.value = value;
  }

  /**
   * Creates a key, trimming the value and lower-casing it for {@link LookupType#EMAIL}.
   *
   * @throws IllegalArgumentException if the value is blank
   */
  public static LookupKey of(LookupType type, String value) {
    Preconditions.checkNotNull(type);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(value) && !value.trim().isEmpty(),
        "lookup value must not be blank");
    String normalized = type == LookupType.EMAIL ? Identity.normalizeEmail(value) : value.trim();
    return new LookupKey(type, normalized);
  }

  public static LookupKey byId(String id) {
    return of(LookupType.ID, id);
  }

  public static LookupKey byEmail(String email) {
    return of(LookupType.EMAIL, email);
  }

  public static LookupKey bySubject(String subject) {
    return of(LookupType.SUBJECT, subject);
  }

  /**
   * @return every key the identity can be found under
   */
  public static ImmutableList<LookupKey> allKeysOf(Identity identity) {
    ImmutableList.Builder<LookupKey> keys = ImmutableList.builder();
    keys.add(byId(identity.getId()));
    if (identity.getEmail() != null) {
      keys.add(byEmail(identity.getEmail()));
    }
    if (identity.getSubject() != null) {
      keys.add(bySubject(identity.getSubject()));
    }
    return keys.build();
  }

  public LookupType getType() {
    return type;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LookupKey)) {
      return false;
    }
    LookupKey other = (LookupKey) obj;
    return type == other.type && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, value);
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(type.name()) + ":" + value;
  }
}
