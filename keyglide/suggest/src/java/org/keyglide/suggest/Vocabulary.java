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

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Locale;

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;
import org.keyglide.geometry.KeyLayout;
import org.keyglide.geometry.KeyboardPath;
import org.keyglide.util.trie.CharTrie;
import org.keyglide.util.trie.FuzzyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The words a keyboard can suggest, each with its {@link WordEntry}, kept in a
 * {@link CharTrie} so that typed input can be corrected and completed approximately.
 * <p>
 * Words are stored in lower case. Keyboard paths are derived from the active
 * {@link KeyLayout}; until a layout is set, or for words the layout cannot trace, entries
 * have no path. Words are only ever added: the vocabulary grows with the session.
 * <p>
 * <b>NOTE</b>: this class is not thread safe.
 */
public class Vocabulary implements Accountable {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Vocabulary.class);

  private final CharTrie<WordEntry> trie = new CharTrie<>();
  private KeyLayout layout;

  /** Returns the normalized form under which <code>word</code> is stored. */
  public static String normalize(String word) {
    return word.toLowerCase(Locale.ROOT);
  }

  /**
   * Adds or replaces <code>word</code> with the given static frequency. Its path is
   * computed from the current layout.
   *
   * @return the stored entry
   * @throws IllegalArgumentException if the word is empty or the frequency is outside [0, 1]
   */
  public WordEntry add(String word, double frequency) {
    if (word == null || word.isEmpty()) {
      throw new IllegalArgumentException("cannot add an empty word");
    }
    final String key = normalize(word);
    final WordEntry entry = new WordEntry(pathOf(key), frequency);
    trie.put(key, entry);
    return entry;
  }

  /**
   * Adds every word of <code>words</code>.
   *
   * @return the number of words read
   */
  public int load(Iterable<WeightedWord> words) {
    int count = 0;
    for (WeightedWord w : words) {
      add(w.getWord(), w.getFrequency());
      count++;
    }
    if (log.isInfoEnabled()) {
      log.info("loaded {} words, vocabulary now holds {} words ({} nodes)", count, trie.size(), trie.nodeCount());
    }
    return count;
  }

  /**
   * Makes <code>newLayout</code> the active layout and recomputes the path of every word.
   * Words the layout cannot trace lose their path.
   */
  public void setLayout(KeyLayout newLayout) {
    this.layout = newLayout;
    int ineligible = 0;
    for (String word : trie.words()) {
      final WordEntry rebuilt = trie.get(word).withPath(pathOf(word));
      if (rebuilt.isGestureEligible() == false) {
        ineligible++;
      }
      trie.put(word, rebuilt);
    }
    log.info("rebuilt keyboard paths of {} words for {}; {} words are not gesture eligible",
        trie.size(), newLayout, ineligible);
  }

  private KeyboardPath pathOf(String word) {
    if (layout == null || layout.canAddress(word) == false) {
      return null;
    }
    return layout.pathOf(word);
  }

  /** Returns the entry of <code>word</code>, or <code>null</code> if it is not in the vocabulary. */
  public WordEntry get(String word) {
    if (word == null || word.isEmpty()) {
      return null;
    }
    return trie.get(normalize(word));
  }

  public boolean contains(String word) {
    return get(word) != null;
  }

  /** Static frequency of <code>word</code>, 0 if the word is unknown. */
  public double staticFrequency(String word) {
    final WordEntry entry = get(word);
    return entry == null ? 0.0 : entry.getFrequency();
  }

  /** All words, in the order they were first added. */
  public List<String> words() {
    return trie.words();
  }

  public int size() {
    return trie.size();
  }

  /** The active layout, or <code>null</code> if none was set. */
  public KeyLayout getLayout() {
    return layout;
  }

  /** Words within <code>maxCost</code> edits of <code>query</code>. */
  public List<FuzzyMatch> searchCorrection(String query, int maxCost) {
    return trie.searchCorrection(normalize(query), maxCost);
  }

  /** Words extending a prefix within <code>maxCost</code> edits of <code>query</code>. */
  public List<FuzzyMatch> searchPrediction(String query, int maxCost) {
    return trie.searchPrediction(normalize(query), maxCost);
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + trie.ramBytesUsed();
  }

  @Override
  public String toString() {
    return "Vocabulary(words=" + trie.size() + ",layout=" + layout + ")";
  }
}
