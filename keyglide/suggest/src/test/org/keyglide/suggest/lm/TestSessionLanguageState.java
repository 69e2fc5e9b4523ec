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

import org.apache.lucene.util.LuceneTestCase;

public class TestSessionLanguageState extends LuceneTestCase {

  public void testSeed() {
    SessionLanguageState state = new SessionLanguageState();
    assertEquals(1, state.getTotalCount());
    assertEquals(1, state.getUnigramCount("the"));
    assertEquals(1, state.getDistinctWordCount());
    assertEquals(0, state.getBigramCount("the", "the"));
    assertEquals("the", state.getSeedWord());

    SessionLanguageState custom = new SessionLanguageState("And");
    assertEquals(1, custom.getUnigramCount("and"));
    assertEquals(0, custom.getUnigramCount("the"));
  }

  public void testRecord() {
    SessionLanguageState state = new SessionLanguageState();
    state.record("cat", "the");
    state.record("Cat", "THE");
    state.record("sat", "cat");
    state.record("dog", null);
    state.record("dog", "");

    assertEquals(6, state.getTotalCount());
    assertEquals(2, state.getUnigramCount("cat"));
    assertEquals(2, state.getUnigramCount("DOG"));
    assertEquals(2, state.getBigramCount("the", "cat"));
    assertEquals(1, state.getBigramCount("cat", "sat"));
    assertEquals(0, state.getBigramCount("sat", "cat"));
    assertEquals(0, state.getBigramCount("", "dog"));
    assertEquals(4, state.getDistinctWordCount());
    assertEquals(Integer.valueOf(2), state.getUnigrams().get("cat"));
  }

  public void testTotalCountsEveryCommit() {
    SessionLanguageState state = new SessionLanguageState();
    int commits = atLeast(20);
    for (int i = 0; i < commits; i++) {
      state.record(random().nextBoolean() ? "yes" : "no", random().nextBoolean() ? "maybe" : null);
    }
    assertEquals(commits + 1, state.getTotalCount());
    assertEquals(commits, state.getUnigramCount("yes") + state.getUnigramCount("no"));
  }

  public void testReset() {
    SessionLanguageState state = new SessionLanguageState();
    state.record("cat", "the");
    state.reset();
    assertEquals(1, state.getTotalCount());
    assertEquals(0, state.getUnigramCount("cat"));
    assertEquals(0, state.getBigramCount("the", "cat"));
    assertEquals(1, state.getUnigramCount("the"));
  }

  public void testIllegalArguments() {
    SessionLanguageState state = new SessionLanguageState();
    expectThrows(IllegalArgumentException.class, () -> state.record("", "the"));
    expectThrows(IllegalArgumentException.class, () -> state.record(null, "the"));
    expectThrows(IllegalArgumentException.class, () -> new SessionLanguageState(""));
    expectThrows(UnsupportedOperationException.class, () -> state.getUnigrams().put("x", 1));
    assertEquals(1, state.getTotalCount());
  }
}
