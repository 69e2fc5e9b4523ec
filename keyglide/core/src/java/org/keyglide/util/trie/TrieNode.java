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

import java.util.Arrays;

import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.RamUsageEstimator;

/** A node of a {@link CharTrie}: outgoing edges sorted by label, plus the terminal word and value. */
final class TrieNode<T> {

  static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(TrieNode.class);

  private static final char[] NO_LABELS = new char[0];
  private static final int[] NO_TARGETS = new int[0];

  /** edge labels, sorted, valid up to {@link #numChildren} */
  char[] labels = NO_LABELS;
  /** arena index of the child reached through the label at the same position */
  int[] targets = NO_TARGETS;
  int numChildren;

  /** the word ending at this node, or null if this node is not terminal */
  String word;
  /** payload of the terminal word, null iff {@link #word} is null */
  T value;

  /** Returns the arena index of the child reached through <code>label</code>, or -1. */
  int child(char label) {
    final int slot = Arrays.binarySearch(labels, 0, numChildren, label);
    return slot < 0 ? -1 : targets[slot];
  }

  /** Adds an edge; the label must not already be present. */
  void addChild(char label, int target) {
    int slot = Arrays.binarySearch(labels, 0, numChildren, label);
    assert slot < 0 : "duplicate edge " + label;
    slot = -slot - 1;
    if (numChildren == labels.length) {
      labels = ArrayUtil.grow(labels, numChildren + 1);
      // oversize rounds per element width, so the int array follows the char array exactly
      targets = ArrayUtil.growExact(targets, labels.length);
    }
    System.arraycopy(labels, slot, labels, slot + 1, numChildren - slot);
    System.arraycopy(targets, slot, targets, slot + 1, numChildren - slot);
    labels[slot] = label;
    targets[slot] = target;
    numChildren++;
  }

  boolean isTerminal() {
    return word != null;
  }

  long ramBytesUsed() {
    return BASE_RAM_BYTES_USED
        + RamUsageEstimator.sizeOf(labels)
        + RamUsageEstimator.sizeOf(targets);
  }

  @Override
  public String toString() {
    return "node(" + (word == null ? "-" : word) + ")children(" + numChildren + ")";
  }
}
