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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.keyglide.geometry.KeyLayout;
import org.keyglide.geometry.KeyboardPath;
import org.keyglide.geometry.PathUtil;
import org.keyglide.geometry.Point;
import org.keyglide.suggest.lm.LanguageModel;
import org.keyglide.util.trie.FuzzyMatch;

/**
 * Ranks vocabulary words for a swipe gesture or a typed word.
 * <p>
 * Every input mode multiplies an input likelihood by the language model probability of the
 * word after the previous word:
 * <ul>
 *   <li>gestures: <code>exp(-d / decay)</code>, where <code>d</code> is the mean distance
 *   between the gesture and the word's keyboard path, both resampled by arc length to the
 *   gesture's sample count. Words whose endpoints or path length are far from the
 *   gesture's are rejected before they are scored.</li>
 *   <li>typed corrections and completions: <code>base^cost</code>, where
 *   <code>cost</code> is the edit cost reported by the vocabulary search, so exact matches
 *   dominate but one or two typos still get through.</li>
 *   <li>next-word guesses: the language model probability alone.</li>
 * </ul>
 * Results are sorted best first. With <code>maxResults &gt; 0</code> only the best
 * <code>maxResults</code> candidates are kept; otherwise all of them are returned.
 */
public class CandidateRanker {

  /** Cancellation is polled once per this many vocabulary words. */
  private static final int CANCELLATION_CHECK_INTERVAL = 64;

  private final Vocabulary vocabulary;
  private final LanguageModel languageModel;
  private final SuggesterConfig config;

  public CandidateRanker(Vocabulary vocabulary, LanguageModel languageModel, SuggesterConfig config) {
    this.vocabulary = vocabulary;
    this.languageModel = languageModel;
    this.config = config;
  }

  /** Ranks all gesture matches; never cancelled. */
  public List<Candidate> candidatesFromGesture(List<Point> gesture, String previousWord) {
    return candidatesFromGesture(gesture, previousWord, 0, CancellationCheck.NEVER);
  }

  /**
   * Ranks the words whose keyboard path resembles <code>gesture</code>.
   *
   * @param gesture the touch samples of one continuous contact, in order
   * @param previousWord the word before the cursor, or <code>null</code>
   * @param maxResults how many candidates to keep, or 0 for all
   * @param cancellation polled while scoring
   * @throws ScoringCancelledException if <code>cancellation</code> fires before scoring completes
   */
  public List<Candidate> candidatesFromGesture(List<Point> gesture, String previousWord, int maxResults,
                                               CancellationCheck cancellation) {
    final KeyLayout layout = vocabulary.getLayout();
    if (gesture.isEmpty() || layout == null) {
      return Collections.emptyList();
    }
    final int n = gesture.size();
    final Point first = gesture.get(0);
    final Point last = gesture.get(n - 1);
    final double gestureLength = PathUtil.length(gesture);
    final double minLength = config.getMinLengthRatio() * gestureLength;
    final double maxLength = config.getMaxLengthRatio() * gestureLength;
    final double toleranceX = config.getKeyTolerance() * layout.getKeyWidth();
    final double toleranceY = config.getKeyTolerance() * layout.getKeyHeight();
    List<Point> sampledGesture = null;

    final List<String> words = vocabulary.words();
    final Collector collector = new Collector(maxResults, words.size());
    for (int i = 0; i < words.size(); i++) {
      if (i % CANCELLATION_CHECK_INTERVAL == 0 && cancellation.isCancelled()) {
        throw new ScoringCancelledException("gesture scoring cancelled after " + i + " of " + words.size() + " words");
      }
      final String word = words.get(i);
      final WordEntry entry = vocabulary.get(word);
      if (entry.isGestureEligible() == false) {
        continue;
      }
      final KeyboardPath path = entry.getPath();
      if (far(path.first(), first, toleranceX, toleranceY) || far(path.last(), last, toleranceX, toleranceY)) {
        continue;
      }
      if (path.getLength() < minLength || path.getLength() > maxLength) {
        continue;
      }
      if (sampledGesture == null) {
        sampledGesture = PathUtil.resample(gesture, n);
      }
      final double distance = PathUtil.meanDistance(sampledGesture, PathUtil.resample(path.getPoints(), n));
      final double score = Math.exp(-distance / config.getGestureDecay()) * languageModel.probability(word, previousWord);
      collector.collect(word, score);
    }
    return collector.results();
  }

  private static boolean far(Point key, Point touch, double toleranceX, double toleranceY) {
    return Math.abs(key.getX() - touch.getX()) > toleranceX || Math.abs(key.getY() - touch.getY()) > toleranceY;
  }

  /** Ranks every correction of <code>typed</code> within the configured edit cost. */
  public List<Candidate> candidatesFromCorrection(String typed, String previousWord) {
    return candidatesFromCorrection(typed, previousWord, config.getMaxEditCost(), 0);
  }

  /**
   * Ranks the words within <code>maxEditCost</code> edits of <code>typed</code>.
   *
   * @param maxResults how many candidates to keep, or 0 for all
   */
  public List<Candidate> candidatesFromCorrection(String typed, String previousWord, int maxEditCost, int maxResults) {
    if (typed == null || typed.isEmpty()) {
      return Collections.emptyList();
    }
    return rankTyped(vocabulary.searchCorrection(typed, maxEditCost), previousWord, maxResults);
  }

  /** Ranks every completion of <code>typed</code> within the configured edit cost. */
  public List<Candidate> candidatesFromPrediction(String typed, String previousWord) {
    return candidatesFromPrediction(typed, previousWord, config.getMaxEditCost(), 0);
  }

  /**
   * Ranks the words that complete a prefix within <code>maxEditCost</code> edits of
   * <code>typed</code>.
   *
   * @param maxResults how many candidates to keep, or 0 for all
   */
  public List<Candidate> candidatesFromPrediction(String typed, String previousWord, int maxEditCost, int maxResults) {
    if (typed == null || typed.isEmpty()) {
      return Collections.emptyList();
    }
    return rankTyped(vocabulary.searchPrediction(typed, maxEditCost), previousWord, maxResults);
  }

  private List<Candidate> rankTyped(List<FuzzyMatch> matches, String previousWord, int maxResults) {
    final Collector collector = new Collector(maxResults, matches.size());
    for (FuzzyMatch match : matches) {
      final double penalty = Math.pow(config.getEditCostBase(), match.getCost());
      collector.collect(match.getWord(), penalty * languageModel.probability(match.getWord(), previousWord));
    }
    return collector.results();
  }

  /** Ranks the whole vocabulary after <code>previousWord</code>. */
  public List<Candidate> candidatesFromHistory(String previousWord) {
    return candidatesFromHistory(previousWord, 0);
  }

  /**
   * Ranks the whole vocabulary by the language model alone, to guess the word that
   * follows <code>previousWord</code> before anything has been typed.
   *
   * @param maxResults how many candidates to keep, or 0 for all
   */
  public List<Candidate> candidatesFromHistory(String previousWord, int maxResults) {
    final List<String> words = vocabulary.words();
    final Collector collector = new Collector(maxResults, words.size());
    for (String word : words) {
      collector.collect(word, languageModel.probability(word, previousWord));
    }
    return collector.results();
  }

  /** Collects candidates into a bounded queue or, without a bound, a list sorted at the end. */
  private static final class Collector {
    private final CandidateQueue queue;
    private final List<Candidate> all;

    /** @param expected upper bound on the number of candidates that will be collected */
    Collector(int maxResults, int expected) {
      if (maxResults < 0) {
        throw new IllegalArgumentException("maxResults must be >= 0, got " + maxResults);
      }
      // the queue allocates its whole heap up front
      this.queue = maxResults > 0 ? new CandidateQueue(Math.max(1, Math.min(maxResults, expected))) : null;
      this.all = maxResults > 0 ? null : new ArrayList<>();
    }

    void collect(String word, double score) {
      final Candidate candidate = new Candidate(word, score);
      if (queue != null) {
        queue.insertWithOverflow(candidate);
      } else {
        all.add(candidate);
      }
    }

    List<Candidate> results() {
      if (queue != null) {
        return queue.drainSorted();
      }
      Collections.sort(all);
      return all;
    }
  }
}
