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

/**
 * The persistent store of user records.
 *
 * <p>Implementations must be thread-safe, must keep emails and subjects unique, and must report
 * a violated uniqueness constraint on {@link #create(NewUser)} with {@link UserConflictException}.
 */
public interface UserStore {

  Optional<Identity> getById(String id) throws UserStoreException;

  /**
   * @param email a normalized (trimmed, lower-case) email
   */
  Optional<Identity> getByEmail(String email) throws UserStoreException;

  Optional<Identity> getBySubject(String subject) throws UserStoreException;

  /**
   * Creates a record and assigns it a new id.
   *
   * @throws UserConflictException if a record with the same email or subject already exists
   */
  Identity create(NewUser user) throws UserStoreException;

  /**
   * Applies a partial update to the record with the given id.
   *
   * @return the updated record
   * @throws UserConflictException if the new email or subject belongs to another record
   */
  Identity update(String id, UserUpdate update) throws UserStoreException;
}
