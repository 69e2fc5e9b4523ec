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
import java.util.Collections;
import java.util.List;

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;
import org.keyglide.geometry.KeyLayout;
import org.keyglide.geometry.Point;
import org.keyglide.suggest.lm.InterpolatedLanguageModel;
import org.keyglide.suggest.lm.SessionLanguageState;
import org.keyglide.suggest.text.TextContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Suggestion engine of one keyboard session.
 * <p>
 * A suggester owns a {@link Vocabulary}, the {@link SessionLanguageState} learned from the
 * words committed so far and a private copy of its {@link SuggesterConfig}. It answers
 * three kinds of questions:
 * <ul>
 *   <li>which words did a swipe gesture trace ({@link #scoreGesture}),</li>
 *   <li>which words did the user mean or start to type ({@link #correct}, {@link #predict},
 *   {@link #suggestWhileTyping}) and</li>
 *   <li>which word comes next ({@link #guessNext}).</li>
 * </ul>
 * Committing a word ({@link #commit}) feeds it back into the session statistics and adds it
 * to the vocabulary if it was unknown.
 * <p>
 * Typical use:
 * <pre class="prettyprint">
 *   KeyboardSuggester suggester = new KeyboardSuggester(new SuggesterConfig().setMaxSuggestions(4));
 *   suggester.loadVocabulary(FrequencyDictionaryLoader.loadCounts(totalPath, countsPath));
 *   suggester.setLayout(layout);
 *   List&lt;Candidate&gt; words = suggester.scoreGesture(points, "the");
 * </pre>
 * <p>
 * <b>NOTE</b>: this class is not thread safe. Use {@link AsyncGestureScorer} to score
 * gestures off the input thread.
 */
public class KeyboardSuggester implements Accountable {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(KeyboardSuggester.class);

  private final SuggesterConfig config;
  private final Vocabulary vocabulary = new Vocabulary();
  private final SessionLanguageState session;
  private final CandidateRanker ranker;

  /** Creates a suggester with the default configuration. */
  public KeyboardSuggester() {
    this(new SuggesterConfig());
  }

  /**
   * Creates a suggester configured by a private clone of <code>config</code>; later
   * changes to <code>config</code> have no effect on this instance.
   */
  public KeyboardSuggester(SuggesterConfig config) {
    this.config = config.clone();
    this.session = new SessionLanguageState(this.config.getSeedWord());
    final InterpolatedLanguageModel languageModel = new InterpolatedLanguageModel(session, vocabulary::staticFrequency,
        this.config.getBigramWeight(), this.config.getUnigramWeight(), this.config.getStaticWeight());
    this.ranker = new CandidateRanker(vocabulary, languageModel, this.config);
  }

  /**
   * Adds every word of <code>words</code> to the vocabulary.
   *
   * @return the number of words read
   * @throws IllegalArgumentException if a word is empty or its frequency is outside [0, 1]
   */
  public int loadVocabulary(Iterable<WeightedWord> words) {
    return vocabulary.load(words);
  }

  /** Switches to <code>layout</code> and recomputes every keyboard path. */
  public void setLayout(KeyLayout layout) {
    vocabulary.setLayout(layout);
  }

  /** Returns the entry of <code>word</code>, or <code>null</code> if it is unknown. */
  public WordEntry lookup(String word) {
    return vocabulary.get(word);
  }

  // -- typed input

  public List<Candidate> correct(String prefix, int maxEditCost) {
    return correct(prefix, null, maxEditCost, 0);
  }

  public List<Candidate> correct(String prefix, String previousWord, int maxEditCost) {
    return correct(prefix, previousWord, maxEditCost, 0);
  }

  /**
   * Ranks the words within <code>maxEditCost</code> edits of <code>prefix</code>.
   *
   * @param maxResults how many candidates to return, or 0 for all
   */
  public List<Candidate> correct(String prefix, String previousWord, int maxEditCost, int maxResults) {
    return ranker.candidatesFromCorrection(prefix, previousWord, maxEditCost, maxResults);
  }

  public List<Candidate> predict(String prefix, int maxEditCost) {
    return predict(prefix, null, maxEditCost, 0);
  }

  public List<Candidate> predict(String prefix, String previousWord, int maxEditCost) {
    return predict(prefix, previousWord, maxEditCost, 0);
  }

  /**
   * Ranks the words that complete a prefix within <code>maxEditCost</code> edits of
   * <code>prefix</code>.
   *
   * @param maxResults how many candidates to return, or 0 for all
   */
  public List<Candidate> predict(String prefix, String previousWord, int maxEditCost, int maxResults) {
    return ranker.candidatesFromPrediction(prefix, previousWord, maxEditCost, maxResults);
  }

  // -- gestures

  public List<Candidate> scoreGesture(List<Point> points) {
    return scoreGesture(points, null, 0, CancellationCheck.NEVER);
  }

  public List<Candidate> scoreGesture(List<Point> points, String previousWord) {
    return scoreGesture(points, previousWord, 0, CancellationCheck.NEVER);
  }

  /**
   * Ranks the words whose keyboard path resembles the gesture <code>points</code>.
   * Returns an empty list for an empty gesture or while no layout is set.
   *
   * @param maxResults how many candidates to return, or 0 for all
   * @throws ScoringCancelledException if <code>cancellation</code> fires while scoring
   */
  public List<Candidate> scoreGesture(List<Point> points, String previousWord, int maxResults,
                                      CancellationCheck cancellation) {
    return ranker.candidatesFromGesture(points, previousWord, maxResults, cancellation);
  }

  // -- session

  /**
   * Records that the user committed <code>word</code> after <code>previousWord</code>. An
   * unknown word joins the vocabulary with frequency 0. Committing the empty word does
   * nothing.
   */
  public void commit(String word, String previousWord) {
    if (word == null || word.isEmpty()) {
      return;
    }
    if (vocabulary.contains(word) == false) {
      final WordEntry entry = vocabulary.add(word, 0.0);
      if (log.isDebugEnabled()) {
        log.debug("added committed word '{}' to the vocabulary (gesture eligible: {})",
            Vocabulary.normalize(word), entry.isGestureEligible());
      }
    }
    session.record(word, previousWord);
  }

  /**
   * Guesses the word after <code>previousWord</code> from the language model alone.
   *
   * @param maxResults how many candidates to return, or 0 for all
   */
  public List<Candidate> guessNext(String previousWord, int maxResults) {
    return ranker.candidatesFromHistory(previousWord, maxResults);
  }

  /** Returns the configured number of next-word guesses. */
  public List<Candidate> guessNext(String previousWord) {
    return guessNext(previousWord, config.getMaxSuggestions());
  }

  /**
   * Completions for the word being typed, limited to the configured number of suggestions.
   * Short words get no completions: with fewer than the configured minimum of characters
   * typed the result is empty.
   */
  public List<Candidate> suggestWhileTyping(String currentWord, String previousWord) {
    if (currentWord == null || currentWord.length() < config.getMinPredictionLength()) {
      return Collections.emptyList();
    }
    return predict(currentWord, previousWord, config.getMaxEditCost(), config.getMaxSuggestions());
  }

  /**
   * Suggestions for the text around <code>cursor</code>: completions of the word before the
   * cursor or, between words, next-word guesses.
   */
  public List<Candidate> suggestForText(CharSequence text, int cursor) {
    final String current = TextContext.currentWord(text, cursor);
    final String previous = TextContext.previousWord(text, cursor);
    if (current.isEmpty()) {
      return guessNext(previous);
    }
    return suggestWhileTyping(current, previous);
  }

  public SessionLanguageState getSessionState() {
    return session;
  }

  /** Returns this suggester's configuration; changing it has no effect. */
  public SuggesterConfig getConfig() {
    return config.clone();
  }

  public Vocabulary getVocabulary() {
    return vocabulary;
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + vocabulary.ramBytesUsed();
  }

  @Override
  public String toString() {
    return "KeyboardSuggester(" + vocabulary + ",session=" + session + ")";
  }
}
