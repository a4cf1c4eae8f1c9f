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
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A thread-safe {@link UserStore} kept in memory, counting the calls made to it.
 */
public final class InMemoryUserStore implements UserStore {
  private static final Instant CREATED_AT = Instant.parse("2025-01-01T00:00:00Z");

  private final Map<String, Identity> records = new LinkedHashMap<>();
  private final AtomicInteger nextId = new AtomicInteger(1);
  private final AtomicInteger reads = new AtomicInteger();
  private final AtomicInteger creates = new AtomicInteger();
  private final AtomicInteger updates = new AtomicInteger();
  private volatile boolean unavailable;
  private volatile NewUser racingUser;

  public synchronized Identity add(Identity identity) {
    records.put(identity.getId(), identity);
    return identity;
  }

  /**
   * Makes every following call fail with a {@link UserStoreException}.
   */
  public void setUnavailable(boolean unavailable) {
    this.unavailable = unavailable;
  }

  /**
   * Makes the next {@link #create} lose a race: {@code winner} is stored by a "concurrent writer"
   * and the create fails with a {@link UserConflictException}.
   */
  public void loseNextCreateTo(NewUser winner) {
    this.racingUser = winner;
  }

  public int getReadCount() {
    return reads.get();
  }

  public int getCreateCount() {
    return creates.get();
  }

  public int getUpdateCount() {
    return updates.get();
  }

  public int getCallCount() {
    return reads.get() + creates.get() + updates.get();
  }

  public synchronized int size() {
    return records.size();
  }

  public synchronized ImmutableList<Identity> all() {
    return ImmutableList.copyOf(records.values());
  }

  @Override
  public synchronized Optional<Identity> getById(String id) throws UserStoreException {
    reads.incrementAndGet();
    checkAvailable();
    return Optional.fromNullable(records.get(id));
  }

  @Override
  public synchronized Optional<Identity> getByEmail(String email) throws UserStoreException {
    reads.incrementAndGet();
    checkAvailable();
    for (Identity identity : records.values()) {
      if (email.equals(identity.getEmail())) {
        return Optional.of(identity);
      }
    }
    return Optional.absent();
  }

  @Override
  public synchronized Optional<Identity> getBySubject(String subject) throws UserStoreException {
    reads.incrementAndGet();
    checkAvailable();
    for (Identity identity : records.values()) {
      if (subject.equals(identity.getSubject())) {
        return Optional.of(identity);
      }
    }
    return Optional.absent();
  }

  @Override
  public synchronized Identity create(NewUser user) throws UserStoreException {
    creates.incrementAndGet();
    checkAvailable();
    NewUser racing = racingUser;
    if (racing != null) {
      racingUser = null;
      insert(racing);
      throw new UserConflictException("user was created concurrently");
    }
    for (Identity identity : records.values()) {
      if ((user.getEmail() != null && user.getEmail().equals(identity.getEmail()))
          || (user.getSubject() != null && user.getSubject().equals(identity.getSubject()))) {
        throw new UserConflictException("user already exists: " + identity.getId());
      }
    }
    return insert(user);
  }

  @Override
  public synchronized Identity update(String id, UserUpdate update) throws UserStoreException {
    updates.incrementAndGet();
    checkAvailable();
    Identity identity = records.get(id);
    if (identity == null) {
      throw new UserStoreException("no such user: " + id);
    }
    for (Identity other : records.values()) {
      if (!other.getId().equals(id)
          && ((update.getEmail().isPresent() && update.getEmail().get().equals(other.getEmail()))
          || (update.getSubject().isPresent()
              && update.getSubject().get().equals(other.getSubject())))) {
        throw new UserConflictException("already used by " + other.getId());
      }
    }
    Identity updated = update.applyTo(identity, CREATED_AT.plusSeconds(updates.get()));
    records.put(id, updated);
    return updated;
  }

  private Identity insert(NewUser user) {
    Identity identity = Identity.newBuilder()
        .setId("user-" + nextId.getAndIncrement())
        .setEmail(user.getEmail())
        .setSubject(user.getSubject())
        .setDisplayName(user.getDisplayName())
        .setRoles(user.getRoles())
        .setAuthKind(user.getAuthKind())
        .setCreatedAt(CREATED_AT)
        .setUpdatedAt(CREATED_AT)
        .build();
    records.put(identity.getId(), identity);
    return identity;
  }

  private void checkAvailable() throws UserStoreException {
    if (unavailable) {
      throw new UserStoreException("store is unavailable");
    }
  }
}
