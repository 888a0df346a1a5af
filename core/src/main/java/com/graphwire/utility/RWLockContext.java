/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.graphwire.utility;

import com.graphwire.exception.ErrorCode;
import com.graphwire.exception.GraphWireException;

import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Base class for objects guarded by a fair read/write lock. Read-only accessors run under the shared lock, operations that change
 * the state run under the exclusive lock.
 */
public class RWLockContext {
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

  /**
   * Executes a callback in a shared lock.
   */
  public <RET> RET executeInReadLock(final Callable<RET> callable) {
    final ReentrantReadWriteLock.ReadLock rl = lock.readLock();
    rl.lock();
    try {

      return callable.call();

    } catch (final RuntimeException e) {
      throw e;

    } catch (final Exception e) {
      throw new GraphWireException(ErrorCode.INTERNAL_ERROR, "Error in execution in lock", e);

    } finally {
      rl.unlock();
    }
  }

  /**
   * Executes a callback in an exclusive lock.
   */
  public <RET> RET executeInWriteLock(final Callable<RET> callable) {
    final ReentrantReadWriteLock.WriteLock wl = lock.writeLock();
    wl.lock();
    try {

      return callable.call();

    } catch (final RuntimeException e) {
      throw e;

    } catch (final Exception e) {
      throw new GraphWireException(ErrorCode.INTERNAL_ERROR, "Error in execution in lock", e);

    } finally {
      wl.unlock();
    }
  }

  public boolean isWriteLockedByCurrentThread() {
    return lock.isWriteLockedByCurrentThread();
  }
}
