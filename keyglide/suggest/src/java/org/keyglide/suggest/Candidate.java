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
 * A suggested word and its score. Candidates sort best first: by descending score, then
 * alphabetically so that ties are stable.
 */
public final class Candidate implements Comparable<Candidate> {

  private final String word;
  private final double score;

  public Candidate(String word, double score) {
    this.word = Objects.requireNonNull(word, "word");
    this.score = score;
  }

  public String getWord() {
    return word;
  }

  public double getScore() {
    return score;
  }

  @Override
  public int compareTo(Candidate other) {
    final int cmp = Double.compare(other.score, score);
    return cmp != 0 ? cmp : word.compareTo(other.word);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final Candidate that = (Candidate) other;
    return Double.compare(score, that.score) == 0 && word.equals(that.word);
  }

  @Override
  public int hashCode() {
    return 31 * word.hashCode() + Double.hashCode(score);
  }

  @Override
  public String toString() {
    return word + "/" + score;
  }
}
