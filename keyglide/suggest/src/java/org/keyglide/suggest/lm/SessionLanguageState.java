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
package org.keyglide.suggest.lm;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Word statistics of one keyboard session: how many words were committed, how often each
 * word was committed and how often each word followed another.
 * <p>
 * The counters live in memory only. They start from a small seed (one commit of a common
 * word) so that the first probabilities are well defined, grow by one commit at a time and
 * are never evicted. Words and contexts are counted in lower case.
 * <p>
 * <b>NOTE</b>: this class is not thread safe; give every session its own instance.
 */
public final class SessionLanguageState {

  /** Default word whose single commit seeds a fresh session. */
  public static final String DEFAULT_SEED_WORD = "the";

  private final String seedWord;
  private long totalCount;
  private final Map<String,Integer> unigrams = new HashMap<>();
  private final Map<String,Map<String,Integer>> bigrams = new HashMap<>();

  /** Creates a state seeded with {@link #DEFAULT_SEED_WORD}. */
  public SessionLanguageState() {
    this(DEFAULT_SEED_WORD);
  }

  /** Creates a state seeded with one commit of <code>seedWord</code>. */
  public SessionLanguageState(String seedWord) {
    if (seedWord == null || seedWord.isEmpty()) {
      throw new IllegalArgumentException("seed word must not be empty");
    }
    this.seedWord = normalize(seedWord);
    reset();
  }

  /** Drops everything learned in this session and restores the seed. */
  public void reset() {
    unigrams.clear();
    bigrams.clear();
    totalCount = 1;
    unigrams.put(seedWord, 1);
  }

  /**
   * Records a commit of <code>word</code>, which followed <code>previousWord</code>
   * (<code>null</code> or empty if there was none).
   *
   * @throws IllegalArgumentException if <code>word</code> is empty
   */
  public void record(String word, String previousWord) {
    if (word == null || word.isEmpty()) {
      throw new IllegalArgumentException("cannot record an empty word");
    }
    final String current = normalize(word);
    totalCount++;
    unigrams.merge(current, 1, Integer::sum);
    if (previousWord != null && previousWord.isEmpty() == false) {
      bigrams.computeIfAbsent(normalize(previousWord), k -> new HashMap<>()).merge(current, 1, Integer::sum);
    }
  }

  /** Number of committed words, including the seed. */
  public long getTotalCount() {
    return totalCount;
  }

  /** Number of commits of <code>word</code>. */
  public int getUnigramCount(String word) {
    if (word == null || word.isEmpty()) {
      return 0;
    }
    return unigrams.getOrDefault(normalize(word), 0);
  }

  /** Number of times <code>word</code> was committed right after <code>previousWord</code>. */
  public int getBigramCount(String previousWord, String word) {
    if (previousWord == null || previousWord.isEmpty() || word == null || word.isEmpty()) {
      return 0;
    }
    final Map<String,Integer> followers = bigrams.get(normalize(previousWord));
    return followers == null ? 0 : followers.getOrDefault(normalize(word), 0);
  }

  /** Number of distinct words committed in this session, including the seed. */
  public int getDistinctWordCount() {
    return unigrams.size();
  }

  /** Read-only view of the unigram counters. */
  public Map<String,Integer> getUnigrams() {
    return Collections.unmodifiableMap(unigrams);
  }

  public String getSeedWord() {
    return seedWord;
  }

  private static String normalize(String word) {
    return word.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    int numBigrams = 0;
    for (Map<String,Integer> followers : bigrams.values()) {
      numBigrams += followers.size();
    }
    return "SessionLanguageState(total=" + totalCount + ",unigrams=" + unigrams.size() + ",bigrams=" + numBigrams + ")";
  }
}
