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
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.Collection;

/**
 * A partial update of a user record. Absent fields are left untouched by
 * {@link UserStore#update(String, UserUpdate)}.
 */
public final class UserUpdate {
  private final Optional<String> subject;
  private final Optional<String> email;
  private final Optional<ImmutableList<String>> roles;
  private final Optional<AuthKind> authKind;
  private final Optional<Instant> lastAuthenticatedAt;

  private UserUpdate(Builder builder) {
    this.subject = builder.subject;
    this.email = builder.email;
    this.roles = builder.roles;
    this.authKind = builder.authKind;
    this.lastAuthenticatedAt = builder.lastAuthenticatedAt;
  }

  public Optional<String> getSubject() {
    return subject;
  }

  public Optional<String> getEmail() {
    return email;
  }

  public Optional<ImmutableList<String>> getRoles() {
    return roles;
  }

  public Optional<AuthKind> getAuthKind() {
    return authKind;
  }

  public Optional<Instant> getLastAuthenticatedAt() {
    return lastAuthenticatedAt;
  }

  public boolean isEmpty() {
    return !subject.isPresent() && !email.isPresent() && !roles.isPresent()
        && !authKind.isPresent() && !lastAuthenticatedAt.isPresent();
  }

  /**
   * Applies this update to a copy of {@code identity}.
   */
  public Identity applyTo(Identity identity, Instant now) {
    Identity.Builder builder = identity.toBuilder().setUpdatedAt(now);
    if (subject.isPresent()) {
      builder.setSubject(subject.get());
    }
    if (email.isPresent()) {
      builder.setEmail(email.get());
    }
    if (roles.isPresent()) {
      builder.setRoles(roles.get());
    }
    if (authKind.isPresent()) {
      builder.setAuthKind(authKind.get());
    }
    if (lastAuthenticatedAt.isPresent()) {
      builder.setLastAuthenticatedAt(lastAuthenticatedAt.get());
    }
    return builder.build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("subject", subject.orNull())
        .add("email", email.orNull())
        .add("roles", roles.orNull())
        .add("authKind", authKind.orNull())
        .add("lastAuthenticatedAt", lastAuthenticatedAt.orNull())
        .omitNullValues()
        .toString();
  }

  /**
   * Builder for {@link UserUpdate}.
   */
  public static final class Builder {
    private Optional<String> subject = Optional.absent();
    private Optional<String> email = Optional.absent();
    private Optional<ImmutableList<String>> roles = Optional.absent();
    private Optional<AuthKind> authKind = Optional.absent();
    private Optional<Instant> lastAuthenticatedAt = Optional.absent();

    private Builder() {}

    public Builder setSubject(String subject) {
      this.subject = Optional.of(subject);
      return this;
    }

    public Builder setEmail(String email) {
      this.email = Optional.of(Identity.normalizeEmail(email));
      return this;
    }

    public Builder setRoles(Collection<String> roles) {
      this.roles = Optional.of(ImmutableList.copyOf(roles));
      return this;
    }

    public Builder setAuthKind(AuthKind authKind) {
      this.authKind = Optional.of(authKind);
      return this;
    }

    public Builder setLastAuthenticatedAt(Instant lastAuthenticatedAt) {
      this.lastAuthenticatedAt = Optional.of(lastAuthenticatedAt);
      return this;
    }

    public UserUpdate build() {
      return new UserUpdate(this);
    }
  }
}
