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

import org.apache.lucene.util.LuceneTestCase;

public class TestSuggesterConfig extends LuceneTestCase {

  public void testDefaults() {
    SuggesterConfig config = new SuggesterConfig();
    assertEquals(SuggesterConfig.DEFAULT_BIGRAM_WEIGHT, config.getBigramWeight(), 0.0);
    assertEquals(SuggesterConfig.DEFAULT_UNIGRAM_WEIGHT, config.getUnigramWeight(), 0.0);
    assertEquals(SuggesterConfig.DEFAULT_STATIC_WEIGHT, config.getStaticWeight(), 0.0);
    assertEquals(2.0, config.getGestureDecay(), 0.0);
    assertEquals(0.001, config.getEditCostBase(), 0.0);
    assertEquals(2, config.getMaxEditCost());
    assertEquals(0.8, config.getMinLengthRatio(), 0.0);
    assertEquals(1.4, config.getMaxLengthRatio(), 0.0);
    assertEquals(1.0, config.getKeyTolerance(), 0.0);
    assertEquals(6, config.getMaxSuggestions());
    assertEquals(4, config.getMinPredictionLength());
    assertEquals("the", config.getSeedWord());
  }

  public void testSettersChain() {
    SuggesterConfig config = new SuggesterConfig()
        .setLanguageModelWeights(0.2, 0.3, 0.5)
        .setGestureDecay(3)
        .setMaxEditCost(1)
        .setMaxSuggestions(4);
    assertEquals(0.3, config.getUnigramWeight(), 0.0);
    assertEquals(3.0, config.getGestureDecay(), 0.0);
    assertEquals(1, config.getMaxEditCost());
    assertEquals(4, config.getMaxSuggestions());
    assertTrue(config.toString().contains("maxSuggestions=4"));
  }

  public void testClone() {
    SuggesterConfig config = new SuggesterConfig().setMaxSuggestions(3);
    SuggesterConfig clone = config.clone();
    clone.setMaxSuggestions(5);
    assertEquals(3, config.getMaxSuggestions());
    assertEquals(5, clone.getMaxSuggestions());
  }

  public void testValidation() {
    SuggesterConfig config = new SuggesterConfig();
    expectThrows(IllegalArgumentException.class, () -> config.setLanguageModelWeights(-1, 0.5, 0.5));
    expectThrows(IllegalArgumentException.class, () -> config.setLanguageModelWeights(0, 0, 0));
    expectThrows(IllegalArgumentException.class, () -> config.setGestureDecay(0));
    expectThrows(IllegalArgumentException.class, () -> config.setGestureDecay(Double.NaN));
    expectThrows(IllegalArgumentException.class, () -> config.setEditCostBase(0));
    expectThrows(IllegalArgumentException.class, () -> config.setEditCostBase(1.5));
    expectThrows(IllegalArgumentException.class, () -> config.setMaxEditCost(-1));
    expectThrows(IllegalArgumentException.class, () -> config.setLengthRatioRange(1.2, 0.8));
    expectThrows(IllegalArgumentException.class, () -> config.setKeyTolerance(0));
    expectThrows(IllegalArgumentException.class, () -> config.setMaxSuggestions(0));
    expectThrows(IllegalArgumentException.class, () -> config.setMinPredictionLength(0));
    expectThrows(IllegalArgumentException.class, () -> config.setSeedWord(""));
    // failed setters leave the config untouched
    assertEquals(SuggesterConfig.DEFAULT_MAX_SUGGESTIONS, config.getMaxSuggestions());
    assertEquals(SuggesterConfig.DEFAULT_BIGRAM_WEIGHT, config.getBigramWeight(), 0.0);
  }
}
