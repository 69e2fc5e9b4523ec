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

/**
 * Levenshtein distance between two strings: the minimum number of single character
 * insertions, deletions and substitutions needed to turn one into the other.
 * <p>
 * {@link CharTrie} computes the same quantity incrementally while it walks the tree;
 * this class computes it for one pair of strings. It is part of the public API, for
 * callers that rerank or filter the trie's matches against their own strings, and it
 * is the reference the trie searches are checked against.
 */
public final class LevenshteinDistance {

  /** no instance */
  private LevenshteinDistance() {}

  /** Returns the edit distance between <code>source</code> and <code>target</code>. */
  public static int distance(CharSequence source, CharSequence target) {
    final int n = source.length();
    final int m = target.length();
    if (n == 0) {
      return m;
    }
    if (m == 0) {
      return n;
    }

    int[] previous = new int[m + 1];
    int[] current = new int[m + 1];
    for (int j = 0; j <= m; j++) {
      previous[j] = j;
    }

    for (int i = 1; i <= n; i++) {
      final char s_i = source.charAt(i - 1);
      current[0] = i;
      for (int j = 1; j <= m; j++) {
        if (s_i != target.charAt(j - 1)) {
          current[j] = min(previous[j], current[j - 1], previous[j - 1]) + 1;
        } else {
          current[j] = min(previous[j] + 1, current[j - 1] + 1, previous[j - 1]);
        }
      }
      final int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[m];
  }

  private static int min(int a, int b, int c) {
    final int t = (a < b) ? a : b;
    return (t < c) ? t : c;
  }
}
