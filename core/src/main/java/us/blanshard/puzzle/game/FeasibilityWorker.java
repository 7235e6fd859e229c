/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.puzzle.game;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.puzzle.core.Domains;
import us.blanshard.puzzle.engine.FeasibilityChecker;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFutureTask;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs feasibility searches on a background thread on behalf of one session,
 * one search at a time.  A request made while a search is running waits for
 * it to finish, replacing any older waiting request.  Running searches are
 * never interrupted; the session discards results that have gone stale.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public final class FeasibilityWorker implements Closeable {
  private static final Logger logger = Logger.getLogger(FeasibilityWorker.class.getName());

  /**
   * Receives the outcome of a search, on the worker's callback executor.
   */
  public interface Callback {
    /** Called with the result of the search for the given generation. */
    void onResult(long generation, FeasibilityChecker.Result result);

    /** Called when the search for the given generation blew up. */
    void onFailure(long generation, Throwable t);
  }

  private final FeasibilityChecker checker;
  private final ExecutorService executor;
  private final Executor callbackExecutor;

  @GuardedBy("this") @Nullable private Request pending;
  @GuardedBy("this") private boolean busy;
  @GuardedBy("this") private boolean closed;

  public FeasibilityWorker(FeasibilityChecker checker, Executor callbackExecutor) {
    this.checker = checkNotNull(checker);
    this.callbackExecutor = checkNotNull(callbackExecutor);
    this.executor = Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("feasibility-%d")
            .build());
  }

  /**
   * Asks for a search of the given snapshot, to be reported to the given
   * callback tagged with the given generation.
   */
  public synchronized void submit(Domains snapshot, long generation, Callback callback) {
    checkState(!closed, "Worker is closed");
    if (pending != null)
      logger.fine("Superseding pending search for generation " + pending.generation);
    pending = new Request(checkNotNull(snapshot), generation, checkNotNull(callback));
    if (!busy) startNext();
  }

  /** Tells whether a search is running or waiting to run. */
  public synchronized boolean isBusy() {
    return busy;
  }

  @Override public synchronized void close() {
    closed = true;
    pending = null;
    executor.shutdown();
  }

  @GuardedBy("this")
  private void startNext() {
    final Request request = pending;
    pending = null;
    busy = request != null && !closed;
    if (!busy) return;

    // Listeners are attached before the task is queued, so none runs here
    // under our lock.
    ListenableFutureTask<FeasibilityChecker.Result> future = ListenableFutureTask.create(
        new Callable<FeasibilityChecker.Result>() {
          @Override public FeasibilityChecker.Result call() {
            return checker.check(request.snapshot);
          }
        });

    Futures.addCallback(future, new FutureCallback<FeasibilityChecker.Result>() {
      @Override public void onSuccess(FeasibilityChecker.Result result) {
        request.callback.onResult(request.generation, result);
      }
      @Override public void onFailure(Throwable t) {
        request.callback.onFailure(request.generation, t);
      }
    }, callbackExecutor);

    future.addListener(new Runnable() {
      @Override public void run() {
        synchronized (FeasibilityWorker.this) {
          startNext();
        }
      }
    }, MoreExecutors.directExecutor());

    executor.execute(future);
  }

  private static final class Request {
    final Domains snapshot;
    final long generation;
    final Callback callback;

    Request(Domains snapshot, long generation, Callback callback) {
      this.snapshot = snapshot;
      this.generation = generation;
      this.callback = callback;
    }
  }
}
