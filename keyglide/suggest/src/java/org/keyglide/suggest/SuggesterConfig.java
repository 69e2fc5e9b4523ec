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

import org.keyglide.suggest.lm.SessionLanguageState;

/**
 * Holds all the configuration of a {@link KeyboardSuggester}. You should instantiate this
 * class, call the setters to set your configuration, then pass it to
 * {@link KeyboardSuggester}. Note that the suggester makes a private clone; later changes
 * to this instance do not affect it.
 * <p>
 * All setter methods return {@link SuggesterConfig} to allow chaining:
 * <pre>
 * SuggesterConfig conf = new SuggesterConfig();
 * conf.setMaxEditCost(1).setMaxSuggestions(4);
 * </pre>
 * The numeric defaults are empirical; none of them is derived from first principles.
 */
public final class SuggesterConfig implements Cloneable {

  /** Default weight of the session bigram estimate. */
  public static final double DEFAULT_BIGRAM_WEIGHT = 0.4;

  /** Default weight of the session unigram estimate. */
  public static final double DEFAULT_UNIGRAM_WEIGHT = 0.1;

  /** Default weight of the static corpus frequency. */
  public static final double DEFAULT_STATIC_WEIGHT = 0.5;

  /** Default divisor of the gesture distance in <code>exp(-distance / decay)</code>. */
  public static final double DEFAULT_GESTURE_DECAY = 2.0;

  /** Default base of the edit penalty <code>base^cost</code> for typed input. */
  public static final double DEFAULT_EDIT_COST_BASE = 0.001;

  /** Default number of edits allowed when correcting or completing typed input. */
  public static final int DEFAULT_MAX_EDIT_COST = 2;

  /** Default lower bound of word path length relative to the gesture length. */
  public static final double DEFAULT_MIN_LENGTH_RATIO = 0.8;

  /** Default upper bound of word path length relative to the gesture length. */
  public static final double DEFAULT_MAX_LENGTH_RATIO = 1.4;

  /** Default endpoint tolerance, in keys. */
  public static final double DEFAULT_KEY_TOLERANCE = 1.0;

  /** Default number of suggestions shown. */
  public static final int DEFAULT_MAX_SUGGESTIONS = 6;

  /** Default shortest typed word for which completions are offered. */
  public static final int DEFAULT_MIN_PREDICTION_LENGTH = 4;

  private double bigramWeight = DEFAULT_BIGRAM_WEIGHT;
  private double unigramWeight = DEFAULT_UNIGRAM_WEIGHT;
  private double staticWeight = DEFAULT_STATIC_WEIGHT;
  private double gestureDecay = DEFAULT_GESTURE_DECAY;
  private double editCostBase = DEFAULT_EDIT_COST_BASE;
  private int maxEditCost = DEFAULT_MAX_EDIT_COST;
  private double minLengthRatio = DEFAULT_MIN_LENGTH_RATIO;
  private double maxLengthRatio = DEFAULT_MAX_LENGTH_RATIO;
  private double keyTolerance = DEFAULT_KEY_TOLERANCE;
  private int maxSuggestions = DEFAULT_MAX_SUGGESTIONS;
  private int minPredictionLength = DEFAULT_MIN_PREDICTION_LENGTH;
  private String seedWord = SessionLanguageState.DEFAULT_SEED_WORD;

  /** Creates a config with all defaults. */
  public SuggesterConfig() {
  }

  @Override
  public SuggesterConfig clone() {
    try {
      return (SuggesterConfig) super.clone();
    } catch (CloneNotSupportedException e) {
      // should not happen
      throw new RuntimeException(e);
    }
  }

  /**
   * Sets the interpolation weights of the language model: session bigram, session
   * unigram and static frequency.
   */
  public SuggesterConfig setLanguageModelWeights(double bigramWeight, double unigramWeight, double staticWeight) {
    if (bigramWeight < 0 || unigramWeight < 0 || staticWeight < 0) {
      throw new IllegalArgumentException("weights must be >= 0");
    }
    if (bigramWeight + unigramWeight + staticWeight <= 0) {
      throw new IllegalArgumentException("at least one weight must be positive");
    }
    this.bigramWeight = bigramWeight;
    this.unigramWeight = unigramWeight;
    this.staticWeight = staticWeight;
    return this;
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

  /** Sets the divisor of the gesture distance; larger values flatten the geometric score. */
  public SuggesterConfig setGestureDecay(double gestureDecay) {
    if (!(gestureDecay > 0)) {
      throw new IllegalArgumentException("gestureDecay must be > 0, got " + gestureDecay);
    }
    this.gestureDecay = gestureDecay;
    return this;
  }

  public double getGestureDecay() {
    return gestureDecay;
  }

  /** Sets the base of the per-edit penalty for typed input; must be in (0, 1]. */
  public SuggesterConfig setEditCostBase(double editCostBase) {
    if (!(editCostBase > 0 && editCostBase <= 1)) {
      throw new IllegalArgumentException("editCostBase must be in (0, 1], got " + editCostBase);
    }
    this.editCostBase = editCostBase;
    return this;
  }

  public double getEditCostBase() {
    return editCostBase;
  }

  /** Sets the number of edits allowed for typed correction and completion. */
  public SuggesterConfig setMaxEditCost(int maxEditCost) {
    if (maxEditCost < 0) {
      throw new IllegalArgumentException("maxEditCost must be >= 0, got " + maxEditCost);
    }
    this.maxEditCost = maxEditCost;
    return this;
  }

  public int getMaxEditCost() {
    return maxEditCost;
  }

  /**
   * Sets the accepted range of a word's path length, as a multiple of the gesture's
   * length. Words outside the range are rejected before they are scored.
   */
  public SuggesterConfig setLengthRatioRange(double minLengthRatio, double maxLengthRatio) {
    if (!(minLengthRatio >= 0) || !(maxLengthRatio >= minLengthRatio)) {
      throw new IllegalArgumentException("invalid length ratio range [" + minLengthRatio + ", " + maxLengthRatio + "]");
    }
    this.minLengthRatio = minLengthRatio;
    this.maxLengthRatio = maxLengthRatio;
    return this;
  }

  public double getMinLengthRatio() {
    return minLengthRatio;
  }

  public double getMaxLengthRatio() {
    return maxLengthRatio;
  }

  /**
   * Sets how far, in keys, a gesture's first and last points may be from a word's first
   * and last key centers.
   */
  public SuggesterConfig setKeyTolerance(double keyTolerance) {
    if (!(keyTolerance > 0)) {
      throw new IllegalArgumentException("keyTolerance must be > 0, got " + keyTolerance);
    }
    this.keyTolerance = keyTolerance;
    return this;
  }

  public double getKeyTolerance() {
    return keyTolerance;
  }

  /** Sets how many suggestions are shown at once. */
  public SuggesterConfig setMaxSuggestions(int maxSuggestions) {
    if (maxSuggestions < 1) {
      throw new IllegalArgumentException("maxSuggestions must be >= 1, got " + maxSuggestions);
    }
    this.maxSuggestions = maxSuggestions;
    return this;
  }

  public int getMaxSuggestions() {
    return maxSuggestions;
  }

  /** Sets the shortest typed word for which completions are offered while typing. */
  public SuggesterConfig setMinPredictionLength(int minPredictionLength) {
    if (minPredictionLength < 1) {
      throw new IllegalArgumentException("minPredictionLength must be >= 1, got " + minPredictionLength);
    }
    this.minPredictionLength = minPredictionLength;
    return this;
  }

  public int getMinPredictionLength() {
    return minPredictionLength;
  }

  /** Sets the word whose single commit seeds a fresh session. */
  public SuggesterConfig setSeedWord(String seedWord) {
    if (seedWord == null || seedWord.isEmpty()) {
      throw new IllegalArgumentException("seedWord must not be empty");
    }
    this.seedWord = seedWord;
    return this;
  }

  public String getSeedWord() {
    return seedWord;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("bigramWeight=").append(bigramWeight).append("\n");
    sb.append("unigramWeight=").append(unigramWeight).append("\n");
    sb.append("staticWeight=").append(staticWeight).append("\n");
    sb.append("gestureDecay=").append(gestureDecay).append("\n");
    sb.append("editCostBase=").append(editCostBase).append("\n");
    sb.append("maxEditCost=").append(maxEditCost).append("\n");
    sb.append("lengthRatio=[").append(minLengthRatio).append(", ").append(maxLengthRatio).append("]\n");
    sb.append("keyTolerance=").append(keyTolerance).append("\n");
    sb.append("maxSuggestions=").append(maxSuggestions).append("\n");
    sb.append("minPredictionLength=").append(minPredictionLength).append("\n");
    sb.append("seedWord=").append(seedWord).append("\n");
    return sb.toString();
  }
}
