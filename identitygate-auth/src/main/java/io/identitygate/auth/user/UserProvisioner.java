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

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;

import io.identitygate.auth.AuthErrorCode;
import io.identitygate.auth.DependencyUnavailableException;
import io.identitygate.auth.UnauthenticatedException;

import java.util.List;

import javax.annotation.Nullable;

/**
 * Creates the user record of a remote identity seen for the first time.
 *
 * <p>Concurrent first logins of the same identity are serialized through a
 * {@link ProvisioningLock}, so at most one record is created per subject. A legacy record known
 * only by email is claimed by attaching the subject to it.
 */
public final class UserProvisioner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final UserStore store;
  private final UserRecordCache userCache;
  private final ProvisioningLock provisioningLock;

  public UserProvisioner(UserStore store, UserRecordCache userCache,
      ProvisioningLock provisioningLock) {
    this.store = Preconditions.checkNotNull(store);
    this.userCache = Preconditions.checkNotNull(userCache);
    this.provisioningLock = Preconditions.checkNotNull(provisioningLock);
  }

  /**
   * Returns the record for the remote identity, creating it when neither the subject nor the
   * email is known.
   *
   * @param subject the identity provider's id for the user
   * @param email the user's email
   * @param roles the roles carried by the token; {@link Identity#DEFAULT_ROLES} when empty
   * @throws UnauthenticatedException with {@link AuthErrorCode#PROVISIONING_CONFLICT} if the
   *         record could be neither created nor found
   * @throws DependencyUnavailableException if the store fails
   */
  public Identity provision(@Nullable final String subject, @Nullable String email,
      final List<String> roles) {
    final String normalizedEmail = Identity.normalizeEmail(email);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(subject) || normalizedEmail != null,
        "a subject or an email is required");
    Preconditions.checkNotNull(roles);

    String identifier = !Strings.isNullOrEmpty(subject)
        ? "subject:" + subject
        : "email:" + normalizedEmail;
    Identity identity;
    try {
      identity = provisioningLock.withLock(identifier, new ProvisioningLock.Task<Identity>() {
        @Override
        public Identity run() throws UserStoreException {
          return findOrCreate(Strings.emptyToNull(subject), normalizedEmail, roles);
        }
      });
    } catch (UserStoreException exception) {
      throw new DependencyUnavailableException(AuthErrorCode.STORE_UNAVAILABLE,
          "Cannot provision the user record", exception);
    }
    userCache.put(identity);
    return identity;
  }

  private Identity findOrCreate(@Nullable String subject, @Nullable String email,
      List<String> roles) throws UserStoreException {
    Optional<Identity> existing = findExisting(subject, email);
    if (existing.isPresent()) {
      return existing.get();
    }

    try {
      Identity created = store.create(new NewUser(email, subject, roles, AuthKind.REMOTE_USER,
          null));
      logger.atInfo().log("Provisioned user %s", created.getId());
      return created;
    } catch (UserConflictException exception) {
      logger.atInfo().withCause(exception).log("User creation raced, re-reading the record");
      Optional<Identity> winner = findExisting(subject, email);
      if (winner.isPresent()) {
        return winner.get();
      }
      throw new UnauthenticatedException(AuthErrorCode.PROVISIONING_CONFLICT,
          "The user record was created concurrently but cannot be read", exception);
    }
  }

  private Optional<Identity> findExisting(@Nullable String subject, @Nullable String email)
      throws UserStoreException {
    if (subject != null) {
      Optional<Identity> bySubject = store.getBySubject(subject);
      if (bySubject.isPresent()) {
        return bySubject;
      }
    }
    if (email == null) {
      return Optional.absent();
    }
    Optional<Identity> byEmail = store.getByEmail(email);
    if (!byEmail.isPresent() || subject == null) {
      return byEmail;
    }
    Identity legacy = byEmail.get();
    if (legacy.getSubject() == null) {
      logger.atInfo().log("Attaching a subject to user %s", legacy.getId());
      return Optional.of(store.update(legacy.getId(), UserUpdate.newBuilder()
          .setSubject(subject)
          .setAuthKind(AuthKind.REMOTE_USER)
          .build()));
    }
    throw new UnauthenticatedException(AuthErrorCode.PROVISIONING_CONFLICT,
        String.format("User %s is already bound to another subject", legacy.getId()));
  }
}
