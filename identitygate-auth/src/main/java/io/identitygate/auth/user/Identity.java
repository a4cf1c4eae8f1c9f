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
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.Collection;

import javax.annotation.Nullable;

/**
 * The canonical user a bearer token resolves to.
 *
 * <p>Instances are immutable. Emails are trimmed and lower-cased, and an identity always carries
 * at least one role: a record with none is given {@link #DEFAULT_ROLES}.
 */
public final class Identity {
  public static final String DEFAULT_ROLE = "standard";
  public static final ImmutableList<String> DEFAULT_ROLES = ImmutableList.of(DEFAULT_ROLE);

  private final String id;
  @Nullable private final String email;
  @Nullable private final String subject;
  @Nullable private final String displayName;
  private final ImmutableList<String> roles;
  private final AuthKind authKind;
  private final boolean active;
  @Nullable private final Instant createdAt;
  @Nullable private final Instant updatedAt;
  @Nullable private final Instant lastAuthenticatedAt;

  private Identity(Builder builder) {
    this.id = builder.id;
    this.email = builder.email;
    this.subject = builder.subject;
    this.displayName = builder.displayName;
    this.roles = builder.roles.isEmpty() ? DEFAULT_ROLES : builder.roles;
    this.authKind = builder.authKind;
    this.active = builder.active;
    this.createdAt = builder.createdAt;
    this.updatedAt = builder.updatedAt;
    this.lastAuthenticatedAt = builder.lastAuthenticatedAt;
  }

  public String getId() {
    return id;
  }

  @Nullable
  public String getEmail() {
    return email;
  }

  /**
   * @return the identity provider's stable id for this user, or {@code null} for a record that
   *         has only ever signed in locally
   */
  @Nullable
  public String getSubject() {
    return subject;
  }

  /**
   * @return the display name, falling back to the email and then the id
   */
  public String getDisplayName() {
    if (!Strings.isNullOrEmpty(displayName)) {
      return displayName;
    }
    return email != null ? email : id;
  }

  public ImmutableList<String> getRoles() {
    return roles;
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  public AuthKind getAuthKind() {
    return authKind;
  }

  public boolean isActive() {
    return active;
  }

  @Nullable
  public Instant getCreatedAt() {
    return createdAt;
  }

  @Nullable
  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Nullable
  public Instant getLastAuthenticatedAt() {
    return lastAuthenticatedAt;
  }

  public Builder toBuilder() {
    return new Builder()
        .setId(id)
        .setEmail(email)
        .setSubject(subject)
        .setDisplayName(displayName)
        .setRoles(roles)
        .setAuthKind(authKind)
        .setActive(active)
        .setCreatedAt(createdAt)
        .setUpdatedAt(updatedAt)
        .setLastAuthenticatedAt(lastAuthenticatedAt);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Trims and lower-cases an email address; returns {@code null} for a blank one.
   */
  @Nullable
  public static String normalizeEmail(@Nullable String email) {
    if (email == null) {
      return null;
    }
    String trimmed = email.trim();
    return trimmed.isEmpty() ? null : Ascii.toLowerCase(trimmed);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Identity)) {
      return false;
    }
    Identity other = (Identity) obj;
    return id.equals(other.id)
        && Objects.equal(email, other.email)
        && Objects.equal(subject, other.subject)
        && Objects.equal(displayName, other.displayName)
        && roles.equals(other.roles)
        && authKind == other.authKind
        && active == other.active
        && Objects.equal(createdAt, other.createdAt)
        && Objects.equal(updatedAt, other.updatedAt)
        && Objects.equal(lastAuthenticatedAt, other.lastAuthenticatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, email, subject, displayName, roles, authKind, active, createdAt,
        updatedAt, lastAuthenticatedAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("id", id)
        .add("email", email)
        .add("subject", subject)
        .add("roles", roles)
        .add("authKind", authKind)
        .add("active", active)
        .toString();
  }

  /**
   * Builder for {@link Identity}.
   */
  public static final class Builder {
    private String id;
    private String email;
    private String subject;
    private String displayName;
    private ImmutableList<String> roles = ImmutableList.of();
    private AuthKind authKind = AuthKind.LOCAL;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastAuthenticatedAt;

    private Builder() {}

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setEmail(@Nullable String email) {
      this.email = normalizeEmail(email);
      return this;
    }

    public Builder setSubject(@Nullable String subject) {
      this.subject = Strings.emptyToNull(subject);
      return this;
    }

    public Builder setDisplayName(@Nullable String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder setRoles(Collection<String> roles) {
      this.roles = ImmutableList.copyOf(roles);
      return this;
    }

    public Builder setAuthKind(AuthKind authKind) {
      this.authKind = Preconditions.checkNotNull(authKind);
      return this;
    }

    public Builder setActive(boolean active) {
      this.active = active;
      return this;
    }

    public Builder setCreatedAt(@Nullable Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder setUpdatedAt(@Nullable Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder setLastAuthenticatedAt(@Nullable Instant lastAuthenticatedAt) {
      this.lastAuthenticatedAt = lastAuthenticatedAt;
      return this;
    }

    /**
     * @throws IllegalStateException if the id is missing
     */
    public Identity build() {
      Preconditions.checkState(!Strings.isNullOrEmpty(id), "identity id must be set");
      return new Identity(this);
    }
  }
}
