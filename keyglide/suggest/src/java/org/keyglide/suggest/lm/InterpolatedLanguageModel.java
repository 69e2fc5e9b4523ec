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

import java.util.function.ToDoubleFunction;

/**
 * Linear interpolation of a session bigram estimate, a session unigram estimate and a
 * static corpus prior:
 * <pre>
 *   p(w | prev) = bigramWeight  * (bigram(prev, w) + 1) / (count(prev) + V)
 *               + unigramWeight * (unigram(w) + 1) / (total + V)
 *               + staticWeight  * staticFrequency(w)
 * </pre>
 * where <code>V</code> is the number of distinct words of the session. Adding one to
 * every session count keeps unseen words above zero; the static prior gives sensible
 * rankings before the session has learned anything.
 * <p>
 * Without a previous word every committed word is a possible context, so
 * <code>count(prev)</code> is the total commit count and the bigram count is zero.
 */
public class InterpolatedLanguageModel implements LanguageModel {

  private final SessionLanguageState state;
  private final ToDoubleFunction<String> staticFrequency;
  private final double bigramWeight;
  private final double unigramWeight;
  private final double staticWeight;

  /**
   * @param state the session counters, read on every call
   * @param staticFrequency corpus prior of a word, 0 for unknown words
   */
  public InterpolatedLanguageModel(SessionLanguageState state, ToDoubleFunction<String> staticFrequency,
                                   double bigramWeight, double unigramWeight, double staticWeight) {
    if (bigramWeight < 0 || unigramWeight < 0 || staticWeight < 0) {
      throw new IllegalArgumentException("weights must be >= 0, got " + bigramWeight + "/" + unigramWeight + "/" + staticWeight);
    }
    this.state = state;
    this.staticFrequency = staticFrequency;
    this.bigramWeight = bigramWeight;
    this.unigramWeight = unigramWeight;
    this.staticWeight = staticWeight;
  }

  @Override
  public double probability(String word, String previousWord) {
    final long distinct = state.getDistinctWordCount();
    final boolean hasContext = previousWord != null && previousWord.isEmpty() == false;

    final long contextCount = hasContext ? state.getUnigramCount(previousWord) : state.getTotalCount();
    final double bigramTerm = (state.getBigramCount(previousWord, word) + 1.0) / Math.max(1, contextCount + distinct);
    final double unigramTerm = (state.getUnigramCount(word) + 1.0) / Math.max(1, state.getTotalCount() + distinct);

    return bigramWeight * bigramTerm + unigramWeight * unigramTerm + staticWeight * staticFrequency.applyAsDouble(word);
  }

  public double getBigramWeight() {
    return bigramWeight;
  }

  public double getUnigramWeight() {
    return unigramWeight;
  }

  public double getStaticWeight() {
    return staticWeight;
  }
}
