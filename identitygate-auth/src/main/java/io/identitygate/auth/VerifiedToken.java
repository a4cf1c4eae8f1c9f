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
import com.google.common.collect.ImmutableList;

import io.identitygate.auth.user.AuthKind;

import java.time.Instant;
import java.util.Collection;

import javax.annotation.Nullable;

/**
 * The claims a {@link TokenVerifier} extracted from a token whose signature and validity it has
 * checked.
 */
public final class VerifiedToken {
  private final AuthKind kind;
  @Nullable private final String subject;
  @Nullable private final String email;
  @Nullable private final String applicationId;
  private final ImmutableList<String> roles;
  private final boolean rolesClaimPresent;
  @Nullable private final Instant expiration;

  private VerifiedToken(AuthKind kind, @Nullable String subject, @Nullable String email,
      @Nullable String applicationId, Collection<String> roles, boolean rolesClaimPresent,
      @Nullable Instant expiration) {
    this.kind = Preconditions.checkNotNull(kind);
    this.subject = subject;
    this.email = email;
    this.applicationId = applicationId;
    this.roles = ImmutableList.copyOf(roles);
    this.rolesClaimPresent = rolesClaimPresent;
    this.expiration = expiration;
  }

  /**
   * A token signed with the local secret; {@code email} comes from its subject claim.
   */
  public static VerifiedToken local(String email, @Nullable Instant expiration) {
    Preconditions.checkNotNull(email);
    return new VerifiedToken(AuthKind.LOCAL, null, email, null, ImmutableList.<String>of(), false,
        expiration);
  }

  /**
   * A token the remote provider issued to a person.
   */
  public static VerifiedToken remoteUser(String subject, String email, Collection<String> roles,
      boolean rolesClaimPresent, @Nullable Instant expiration) {
    Preconditions.checkNotNull(subject);
    Preconditions.checkNotNull(email);
    return new VerifiedToken(AuthKind.REMOTE_USER, subject, email, null, roles, rolesClaimPresent,
        expiration);
  }

  /**
   * An application-only token the remote provider issued to a service.
   */
  public static VerifiedToken remoteService(String applicationId, Collection<String> roles,
      boolean rolesClaimPresent, @Nullable Instant expiration) {
    Preconditions.checkNotNull(applicationId);
    return new VerifiedToken(AuthKind.REMOTE_SERVICE, null, null, applicationId, roles,
        rolesClaimPresent, expiration);
  }

  public AuthKind getKind() {
    return kind;
  }

  @Nullable
  public String getSubject() {
    return subject;
  }

  @Nullable
  public String getEmail() {
    return email;
  }

  @Nullable
  public String getApplicationId() {
    return applicationId;
  }

  public ImmutableList<String> getRoles() {
    return roles;
  }

  /**
   * @return whether the token carried a roles claim at all, even an empty one
   */
  public boolean isRolesClaimPresent() {
    return rolesClaimPresent;
  }

  @Nullable
  public Instant getExpiration() {
    return expiration;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("kind", kind)
        .add("subject", subject)
        .add("email", email)
        .add("applicationId", applicationId)
        .add("roles", roles)
        .add("expiration", expiration)
        .toString();
  }
}
