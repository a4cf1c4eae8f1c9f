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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.Collection;

import javax.annotation.Nullable;

/**
 * The fields of a user record to be created by {@link UserStore#create(NewUser)}.
 */
public final class NewUser {
  @Nullable private final String email;
  @Nullable private final String subject;
  private final ImmutableList<String> roles;
  private final AuthKind authKind;
  @Nullable private final String displayName;

  /**
   * Constructor.
   *
   * @throws IllegalArgumentException if neither an email nor a subject is given
   */
  public NewUser(@Nullable String email, @Nullable String subject, Collection<String> roles,
      AuthKind authKind, @Nullable String displayName) {
    this.email = Identity.normalizeEmail(email);
    this.subject = Strings.emptyToNull(subject);
    Preconditions.checkArgument(this.email != null || this.subject != null,
        "a new user needs an email or a subject");
    this.roles = roles.isEmpty() ? Identity.DEFAULT_ROLES : ImmutableList.copyOf(roles);
    this.authKind = Preconditions.checkNotNull(authKind);
    this.displayName = displayName;
  }

  @Nullable
  public String getEmail() {
    return email;
  }

  @Nullable
  public String getSubject() {
    return subject;
  }

  public ImmutableList<String> getRoles() {
    return roles;
  }

  public AuthKind getAuthKind() {
    return authKind;
  }

  @Nullable
  public String getDisplayName() {
    return displayName != null ? displayName : email;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("email", email)
        .add("subject", subject)
        .add("roles", roles)
        .add("authKind", authKind)
        .toString();
  }
}
