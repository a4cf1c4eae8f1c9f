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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes work per identifier.
 *
 * <p>Each identifier gets its own lock from a shared registry. Handles are reference counted: once
 * the last holder releases an identifier its handle is removed after a grace period, unless the
 * identifier is locked again in the meantime. The registry's own monitor is held only while a
 * handle is looked up, created or released, never while the guarded work runs.
 */
public final class ProvisioningLock {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Work run while an identifier is locked.
   */
  public interface Task<T> {
    T run() throws UserStoreException;
  }

  private final Map<String, Handle> registry = new HashMap<>();
  private final ScheduledExecutorService scheduler;
  private final long graceMillis;

  /**
   * Constructor.
   *
   * @param scheduler runs the delayed removal of released handles. Once it rejects work,
   *        released handles are removed immediately.
   * @param graceMillis how long a released handle is kept before removal; {@code 0} removes it
   *        as soon as it is released
   */
  public ProvisioningLock(ScheduledExecutorService scheduler, long graceMillis) {
    Preconditions.checkArgument(graceMillis >= 0, "graceMillis must not be negative");
    this.scheduler = Preconditions.checkNotNull(scheduler);
    this.graceMillis = graceMillis;
  }

  /**
   * Runs {@code task} while holding the lock for {@code identifier}.
   */
  public <T> T withLock(String identifier, Task<T> task) throws UserStoreException {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(identifier),
        "identifier cannot be empty");
    Preconditions.checkNotNull(task);

    Handle handle = acquire(identifier);
    handle.lock.lock();
    try {
      return task.run();
    } finally {
      handle.lock.unlock();
      release(identifier, handle);
    }
  }

  /**
   * @return the number of identifiers with a live handle
   */
  @VisibleForTesting
  int size() {
    synchronized (registry) {
      return registry.size();
    }
  }

  private Handle acquire(String identifier) {
    synchronized (registry) {
      Handle handle = registry.get(identifier);
      if (handle == null) {
        handle = new Handle();
        registry.put(identifier, handle);
      } else if (handle.pendingRemoval != null) {
        handle.pendingRemoval.cancel(false);
        handle.pendingRemoval = null;
      }
      handle.holders++;
      return handle;
    }
  }

  private void release(final String identifier, final Handle handle) {
    synchronized (registry) {
      handle.holders--;
      if (handle.holders > 0) {
        return;
      }
      if (graceMillis == 0) {
        registry.remove(identifier);
        return;
      }
      try {
        handle.pendingRemoval = scheduler.schedule(new Runnable() {
          @Override
          public void run() {
            removeIfUnused(identifier, handle);
          }
        }, graceMillis, TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException exception) {
        // The scheduler is shut down; nothing would ever remove the handle later.
        logger.atFine().log("Removing the handle of %s without a grace period", identifier);
        registry.remove(identifier);
      }
    }
  }

  private void removeIfUnused(String identifier, Handle handle) {
    synchronized (registry) {
      // A cancelled removal may still run if it was already started; the holder count decides.
      if (handle.holders == 0 && registry.get(identifier) == handle) {
        registry.remove(identifier);
      }
    }
  }

  private static final class Handle {
    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by the registry monitor.
    private int holders;
    private ScheduledFuture<?> pendingRemoval;
  }
}
