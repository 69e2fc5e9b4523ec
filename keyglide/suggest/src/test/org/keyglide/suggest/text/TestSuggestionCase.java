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
package org.keyglide.suggest.text;

import org.apache.lucene.util.LuceneTestCase;

public class TestSuggestionCase extends LuceneTestCase {

  public void testFromModifiers() {
    assertEquals(SuggestionCase.LOWER, SuggestionCase.fromModifiers(false, false));
    assertEquals(SuggestionCase.CAPITALIZED, SuggestionCase.fromModifiers(true, false));
    assertEquals(SuggestionCase.UPPER, SuggestionCase.fromModifiers(false, true));
    assertEquals(SuggestionCase.LOWER, SuggestionCase.fromModifiers(true, true));
  }

  public void testApply() {
    assertEquals("hello", SuggestionCase.LOWER.apply("hello"));
    assertEquals("Hello", SuggestionCase.CAPITALIZED.apply("hello"));
    assertEquals("HELLO", SuggestionCase.UPPER.apply("hello"));
    assertEquals("I", SuggestionCase.CAPITALIZED.apply("i"));
    for (SuggestionCase c : SuggestionCase.values()) {
      assertEquals("", c.apply(""));
    }
  }
}
