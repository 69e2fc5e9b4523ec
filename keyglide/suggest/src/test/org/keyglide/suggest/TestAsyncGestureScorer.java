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

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.ThreadInterruptedException;
import org.keyglide.geometry.KeyLayout;

import static org.keyglide.suggest.KeyboardTestUtil.qwerty;
import static org.keyglide.suggest.KeyboardTestUtil.trace;
import static org.keyglide.suggest.KeyboardTestUtil.words;

public class TestAsyncGestureScorer extends LuceneTestCase {

  private KeyboardSuggester suggester;
  private KeyLayout layout;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    suggester = new KeyboardSuggester();
    suggester.loadVocabulary(words("cat", 0.5, "car", 0.3, "can", 0.2, "fox", 0.1, "dog", 0.1));
    layout = qwerty();
    suggester.setLayout(layout);
  }

  public void testScoresOnWorker() throws Exception {
    try (AsyncGestureScorer scorer = new AsyncGestureScorer(suggester)) {
      List<Candidate> candidates = scorer.submit(trace(layout, "fox"), null).get();
      assertEquals("fox", candidates.get(0).getWord());
    }
  }

  public void testNewGestureCancelsPending() throws Exception {
    try (AsyncGestureScorer scorer = new AsyncGestureScorer(suggester)) {
      CountDownLatch started = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      // keep the worker busy so that the first gesture is still queued
      scorer.runOnWorker(() -> {
        started.countDown();
        try {
          release.await();
        } catch (InterruptedException e) {
          throw new ThreadInterruptedException(e);
        }
      });
      started.await();

      Future<List<Candidate>> stale = scorer.submit(trace(layout, "cat"), null);
      Future<List<Candidate>> fresh = scorer.submit(trace(layout, "dog"), null);
      assertTrue(stale.isCancelled());
      assertFalse(fresh.isCancelled());
      release.countDown();

      assertEquals("dog", fresh.get().get(0).getWord());
      expectThrows(CancellationException.class, () -> stale.get());
    }
  }

  public void testCommitIsSerializedWithScoring() throws Exception {
    try (AsyncGestureScorer scorer = new AsyncGestureScorer(suggester, 0)) {
      scorer.submit(trace(layout, "cat"), null);
      scorer.commit("zebra", "cat").get();
      assertNotNull(suggester.lookup("zebra"));
      assertEquals(1, suggester.getSessionState().getBigramCount("cat", "zebra"));
    }
  }

  public void testClosedScorerRejectsWork() {
    AsyncGestureScorer scorer = new AsyncGestureScorer(suggester);
    scorer.close();
    expectThrows(RejectedExecutionException.class, () -> scorer.submit(trace(layout, "cat"), null));
    expectThrows(RejectedExecutionException.class, () -> scorer.commit("cat", null));
    scorer.close();
  }

  public void testIllegalMaxResults() {
    expectThrows(IllegalArgumentException.class, () -> new AsyncGestureScorer(suggester, -1));
  }
}
