/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.keyglide.suggest;

import java.io.Closeable;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

import org.apache.lucene.util.NamedThreadFactory;
import org.apache.lucene.util.ThreadInterruptedException;
import org.keyglide.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores gestures of a {@link KeyboardSuggester} on a single background thread.
 * <p>
 * Only the newest gesture matters: {@link #submit} cancels the gesture still queued or
 * being scored before it schedules the new one, and a cancelled scoring run stops at its
 * next cancellation poll. The {@link Future} of a superseded gesture reports
 * {@link Future#isCancelled() cancelled} and never delivers a result.
 * <p>
 * Commits go through the same thread so that the session statistics never change under a
 * running scoring pass. While a scorer is open, the wrapped suggester must not be used
 * from any other thread.
 */
public class AsyncGestureScorer implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  /** How long {@link #close} waits for the worker to finish. */
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final KeyboardSuggester suggester;
  private final ExecutorService executor;
  private final int maxResults;
  private ScoringTask inFlight;

  /** Creates a scorer returning the suggester's configured number of suggestions. */
  public AsyncGestureScorer(KeyboardSuggester suggester) {
    this(suggester, suggester.getConfig().getMaxSuggestions());
  }

  /**
   * @param maxResults how many candidates each gesture returns, or 0 for all
   */
  public AsyncGestureScorer(KeyboardSuggester suggester, int maxResults) {
    if (maxResults < 0) {
      throw new IllegalArgumentException("maxResults must be >= 0, got " + maxResults);
    }
    this.suggester = suggester;
    this.maxResults = maxResults;
    this.executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("keyglide-gesture"));
  }

  /**
   * Schedules scoring of <code>gesture</code>, cancelling the previous gesture if it has
   * not completed yet.
   *
   * @return the ranked candidates, once computed
   */
  public synchronized Future<List<Candidate>> submit(List<Point> gesture, String previousWord) {
    if (inFlight != null) {
      inFlight.cancel(false);
    }
    final ScoringTask task = new ScoringTask(new Scoring(suggester, new ArrayList<>(gesture), previousWord, maxResults));
    inFlight = task;
    executor.execute(task);
    return task;
  }

  /** Schedules {@link KeyboardSuggester#commit} behind any pending gesture. */
  public Future<?> commit(String word, String previousWord) {
    return runOnWorker(() -> suggester.commit(word, previousWord));
  }

  Future<?> runOnWorker(Runnable runnable) {
    return executor.submit(runnable);
  }

  /**
   * Cancels the pending gesture and stops the worker thread, waiting for queued commits to
   * be applied.
   *
   * @throws ThreadInterruptedException if interrupted while waiting
   */
  @Override
  public void close() {
    synchronized (this) {
      if (inFlight != null) {
        inFlight.cancel(false);
        inFlight = null;
      }
    }
    executor.shutdown();
    try {
      if (executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS) == false) {
        log.warn("gesture worker did not stop within {} seconds, interrupting it", SHUTDOWN_TIMEOUT_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      throw new ThreadInterruptedException(ie);
    }
  }

  /** A scoring run that polls its own future for cancellation. */
  private static final class ScoringTask extends FutureTask<List<Candidate>> implements CancellationCheck {
    ScoringTask(Scoring scoring) {
      super(scoring);
      scoring.cancellation = this;
    }
  }

  private static final class Scoring implements Callable<List<Candidate>> {
    private final KeyboardSuggester suggester;
    private final List<Point> gesture;
    private final String previousWord;
    private final int maxResults;
    CancellationCheck cancellation = CancellationCheck.NEVER;

    Scoring(KeyboardSuggester suggester, List<Point> gesture, String previousWord, int maxResults) {
      this.suggester = suggester;
      this.gesture = gesture;
      this.previousWord = previousWord;
      this.maxResults = maxResults;
    }

    @Override
    public List<Candidate> call() {
      try {
        return suggester.scoreGesture(gesture, previousWord, maxResults, cancellation);
      } catch (ScoringCancelledException e) {
        log.debug("superseded gesture of {} points: {}", gesture.size(), e.getMessage());
        throw e;
      }
    }
  }
}
