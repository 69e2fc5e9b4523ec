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
package org.keyglide.util.trie;

import java.util.Objects;

/**
 * A stored word found by an approximate {@link CharTrie} search, with the edit cost at
 * which it matched.
 */
public final class FuzzyMatch {

  private final String word;
  private final int cost;

  public FuzzyMatch(String word, int cost) {
    this.word = Objects.requireNonNull(word, "word");
    this.cost = cost;
  }

  /** The stored word. */
  public String getWord() {
    return word;
  }

  /** Number of edits between the query and the word (or its matching prefix). */
  public int getCost() {
    return cost;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final FuzzyMatch that = (FuzzyMatch) other;
    return cost == that.cost && word.equals(that.word);
  }

  @Override
  public int hashCode() {
    return 31 * word.hashCode() + cost;
  }

  @Override
  public String toString() {
    return word + "/" + cost;
  }
}
