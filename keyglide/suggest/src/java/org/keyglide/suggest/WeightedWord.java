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

import java.util.Objects;

/**
 * A word of the static vocabulary together with its corpus frequency, typically
 * <code>count / total</code> over a reference corpus.
 */
public final class WeightedWord {

  private final String word;
  private final double frequency;

  public WeightedWord(String word, double frequency) {
    this.word = Objects.requireNonNull(word, "word");
    this.frequency = frequency;
  }

  public String getWord() {
    return word;
  }

  public double getFrequency() {
    return frequency;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final WeightedWord that = (WeightedWord) other;
    return Double.compare(frequency, that.frequency) == 0 && word.equals(that.word);
  }

  @Override
  public int hashCode() {
    return 31 * word.hashCode() + Double.hashCode(frequency);
  }

  @Override
  public String toString() {
    return word + "/" + frequency;
  }
}
