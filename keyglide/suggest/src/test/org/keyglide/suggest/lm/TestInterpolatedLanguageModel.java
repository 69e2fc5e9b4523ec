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

import java.util.HashMap;
import java.util.Map;

import org.apache.lucene.util.LuceneTestCase;

public class TestInterpolatedLanguageModel extends LuceneTestCase {

  private static final double DELTA = 1e-12;

  private SessionLanguageState state;
  private Map<String,Double> frequencies;
  private InterpolatedLanguageModel model;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    state = new SessionLanguageState();
    frequencies = new HashMap<>();
    frequencies.put("cat", 0.5);
    frequencies.put("car", 0.3);
    frequencies.put("can", 0.2);
    model = new InterpolatedLanguageModel(state, w -> frequencies.getOrDefault(w, 0.0), 0.4, 0.1, 0.5);
  }

  public void testFreshSession() {
    // total = 1, V = 1: both session terms are 1/2
    assertEquals(0.4 * 0.5 + 0.1 * 0.5 + 0.5 * 0.5, model.probability("cat", "the"), DELTA);
    assertEquals(0.4 * 0.5 + 0.1 * 0.5 + 0.5 * 0.3, model.probability("car", null), DELTA);
  }

  public void testUnknownWordKeepsSessionMass() {
    double p = model.probability("zebra", "the");
    assertEquals(0.4 * 0.5 + 0.1 * 0.5, p, DELTA);
    assertTrue(p > 0);
  }

  public void testSessionCounts() {
    state.record("cat", "the");
    state.record("cat", "the");
    // total = 3, V = 2, count(the) = 1, bigram(the, cat) = 2, unigram(cat) = 2
    double expected = 0.4 * (2 + 1) / (1.0 + 2) + 0.1 * (2 + 1) / (3.0 + 2) + 0.5 * 0.5;
    assertEquals(expected, model.probability("cat", "the"), DELTA);
  }

  public void testBigramBoost() {
    double before = model.probability("car", "the");
    state.record("car", "the");
    assertTrue(model.probability("car", "the") > before);
    assertTrue(model.probability("car", "the") > model.probability("car", null));
    assertTrue(model.probability("car", "the") > model.probability("car", "dog"));
    // the boost can overturn the static prior
    for (int i = 0; i < 5; i++) {
      state.record("can", "the");
    }
    assertTrue(model.probability("can", "the") > model.probability("cat", "the"));
  }

  public void testCommittedPairBeatsNoContext() {
    state.record("the", "");
    state.record("cat", "the");
    // total = 3, V = 2, count(the) = 2
    assertEquals(0.4 * 2 / 4.0 + 0.1 * 2 / 5.0 + 0.5 * 0.5, model.probability("cat", "the"), DELTA);
    assertEquals(0.4 * 1 / 5.0 + 0.1 * 2 / 5.0 + 0.5 * 0.5, model.probability("cat", ""), DELTA);
    assertTrue(model.probability("cat", "the") > model.probability("cat", ""));
  }

  public void testNoContextKeepsStaticOrder() {
    state.record("car", "the");
    state.record("can", null);
    double cat = model.probability("cat", null);
    double car = model.probability("car", null);
    // same bigram term for every word, so the difference is unigram plus static
    double unigramDelta = 0.1 * ((0 + 1) - (1 + 1)) / (3.0 + 3);
    assertEquals(unigramDelta + 0.5 * (0.5 - 0.3), cat - car, DELTA);
    assertEquals(model.probability("cat", null), model.probability("cat", ""), DELTA);
  }

  public void testCaseInsensitive() {
    state.record("cat", "the");
    assertEquals(model.probability("cat", "the"), model.probability("CAT", "The"), DELTA);
  }

  public void testNegativeWeight() {
    expectThrows(IllegalArgumentException.class, () -> new InterpolatedLanguageModel(state, w -> 0, -0.1, 0.5, 0.5));
  }
}
