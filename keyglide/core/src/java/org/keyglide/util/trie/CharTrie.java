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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.RamUsageEstimator;

/**
 * A prefix tree keyed by the characters of a word, mapping each stored word to a value.
 * <p>
 * Nodes are kept in an arena and addressed by index; the root is always node 0. Besides
 * the tree itself the trie keeps the stored words in insertion order and an index from
 * each word to its terminal node, so that full-vocabulary iteration and exact lookup do
 * not need to walk the tree.
 * <p>
 * Two approximate searches share one traversal: a Levenshtein dynamic-programming row is
 * extended by one character per edge, starting from the row of the empty prefix, and any
 * subtree whose row minimum exceeds the allowed cost is pruned (edit distance never
 * decreases as the prefix grows).
 * <ul>
 *   <li>{@link #searchCorrection} reports the terminal nodes whose full edit distance to the
 *   query is within the bound ("fix what I typed").</li>
 *   <li>{@link #searchPrediction} treats every node within the bound as a matched prefix and
 *   reports all of its terminal descendants with the prefix cost ("complete what I am
 *   typing"). The prefix cost is not the edit distance of the completed word.</li>
 * </ul>
 * <p>
 * <b>NOTE</b>: this class is not thread safe.
 *
 * @param <T> the value stored for each word
 */
public class CharTrie<T> implements Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(CharTrie.class);

  static final int ROOT = 0;

  private final List<TrieNode<T>> nodes = new ArrayList<>();
  private final Map<String,Integer> terminals = new HashMap<>();
  private final List<String> words = new ArrayList<>();

  /** Creates an empty trie. */
  public CharTrie() {
    nodes.add(new TrieNode<T>());
  }

  /**
   * Returns the value stored for <code>word</code>, or <code>null</code> if the word was
   * never stored.
   */
  public T get(CharSequence word) {
    final Integer node = terminals.get(word.toString());
    return node == null ? null : nodes.get(node).value;
  }

  /** Returns true if <code>word</code> is stored in this trie. */
  public boolean containsWord(CharSequence word) {
    return terminals.containsKey(word.toString());
  }

  /** Returns true if at least one stored word starts with <code>prefix</code>. */
  public boolean containsPrefix(CharSequence prefix) {
    return walk(prefix) >= 0;
  }

  /**
   * Stores <code>value</code> for <code>word</code>, creating the nodes along its path.
   * Storing a word again replaces its value and does not list it twice.
   *
   * @return the previous value of the word, or <code>null</code> if it was not stored
   * @throws IllegalArgumentException if the word is empty
   */
  public T put(CharSequence word, T value) {
    Objects.requireNonNull(value, "value");
    if (word.length() == 0) {
      throw new IllegalArgumentException("cannot store the empty word");
    }
    int node = ROOT;
    for (int i = 0; i < word.length(); i++) {
      final char c = word.charAt(i);
      int next = nodes.get(node).child(c);
      if (next < 0) {
        next = nodes.size();
        nodes.get(node).addChild(c, next);
        nodes.add(new TrieNode<T>());
      }
      node = next;
    }
    final TrieNode<T> terminal = nodes.get(node);
    final T previous = terminal.value;
    if (terminal.isTerminal() == false) {
      terminal.word = word.toString();
      words.add(terminal.word);
      terminals.put(terminal.word, node);
    }
    terminal.value = value;
    return previous;
  }

  /** Returns the stored words in insertion order; each word is listed exactly once. */
  public List<String> words() {
    return Collections.unmodifiableList(words);
  }

  /** Returns the number of stored words. */
  public int size() {
    return words.size();
  }

  /** Returns the number of nodes in the arena, including the root. */
  public int nodeCount() {
    return nodes.size();
  }

  /**
   * Returns every stored word whose edit distance to <code>query</code> is at most
   * <code>maxCost</code>, each paired with that distance. Results come in lexicographic
   * order of the stored words.
   *
   * @throws IllegalArgumentException if <code>maxCost</code> is negative
   */
  public List<FuzzyMatch> searchCorrection(CharSequence query, int maxCost) {
    final List<FuzzyMatch> results = new ArrayList<>();
    search(query, maxCost, (node, cost) -> {
      final TrieNode<T> n = nodes.get(node);
      if (n.isTerminal()) {
        results.add(new FuzzyMatch(n.word, cost));
      }
    });
    return results;
  }

  /**
   * Returns every stored word that extends a prefix whose edit distance to
   * <code>query</code> is at most <code>maxCost</code>. Each word carries the cost of its
   * cheapest matching prefix. With an empty query every node of depth up to
   * <code>maxCost</code> matches, so callers should keep the bound small.
   *
   * @throws IllegalArgumentException if <code>maxCost</code> is negative
   */
  public List<FuzzyMatch> searchPrediction(CharSequence query, int maxCost) {
    final List<int[]> matched = new ArrayList<>();
    search(query, maxCost, (node, cost) -> matched.add(new int[] {node, cost}));

    final Map<String,Integer> best = new LinkedHashMap<>();
    final Deque<Integer> stack = new ArrayDeque<>();
    for (int[] match : matched) {
      final int cost = match[1];
      stack.push(match[0]);
      while (stack.isEmpty() == false) {
        final TrieNode<T> n = nodes.get(stack.pop());
        if (n.isTerminal()) {
          best.merge(n.word, cost, Math::min);
        }
        // push in reverse so that children pop in label order
        for (int i = n.numChildren - 1; i >= 0; i--) {
          stack.push(n.targets[i]);
        }
      }
    }

    final List<FuzzyMatch> results = new ArrayList<>(best.size());
    for (Map.Entry<String,Integer> e : best.entrySet()) {
      results.add(new FuzzyMatch(e.getKey(), e.getValue()));
    }
    return results;
  }

  /** Receives the nodes whose full-query cost is within the bound. */
  private interface MatchVisitor {
    void visit(int node, int cost);
  }

  private void search(CharSequence query, int maxCost, MatchVisitor visitor) {
    if (maxCost < 0) {
      throw new IllegalArgumentException("maxCost must be >= 0, got " + maxCost);
    }
    final char[] text = query.toString().toCharArray();
    final RowStack rows = new RowStack(text.length + 1);
    final int[] first = rows.row(0);
    for (int i = 0; i <= text.length; i++) {
      first[i] = i;
    }
    final TrieNode<T> root = nodes.get(ROOT);
    for (int i = 0; i < root.numChildren; i++) {
      searchRecursive(root.targets[i], root.labels[i], 1, text, rows, maxCost, visitor);
    }
  }

  private void searchRecursive(int node, char letter, int depth, char[] text, RowStack rows,
                               int maxCost, MatchVisitor visitor) {
    final int[] previous = rows.row(depth - 1);
    final int[] current = rows.row(depth);
    current[0] = previous[0] + 1;
    int rowMin = current[0];
    for (int column = 1; column <= text.length; column++) {
      final int insertCost = current[column - 1] + 1;
      final int deleteCost = previous[column] + 1;
      final int replaceCost = previous[column - 1] + (text[column - 1] == letter ? 0 : 1);
      current[column] = min(insertCost, deleteCost, replaceCost);
      rowMin = Math.min(rowMin, current[column]);
    }

    if (current[text.length] <= maxCost) {
      visitor.visit(node, current[text.length]);
    }

    if (rowMin <= maxCost) {
      final TrieNode<T> n = nodes.get(node);
      for (int i = 0; i < n.numChildren; i++) {
        searchRecursive(n.targets[i], n.labels[i], depth + 1, text, rows, maxCost, visitor);
      }
    }
  }

  private static int min(int a, int b, int c) {
    final int t = (a < b) ? a : b;
    return (t < c) ? t : c;
  }

  /** Returns the node reached by following <code>prefix</code> from the root, or -1. */
  private int walk(CharSequence prefix) {
    int node = ROOT;
    for (int i = 0; i < prefix.length() && node >= 0; i++) {
      node = nodes.get(node).child(prefix.charAt(i));
    }
    return node;
  }

  /**
   * One DP row per trie depth, reused across sibling subtrees so the traversal allocates
   * only when it reaches a depth it has not seen before.
   */
  private static final class RowStack {
    private final int width;
    private int[][] rows = new int[8][];

    RowStack(int width) {
      this.width = width;
    }

    int[] row(int depth) {
      if (depth >= rows.length) {
        rows = ArrayUtil.grow(rows, depth + 1);
      }
      if (rows[depth] == null) {
        rows[depth] = new int[width];
      }
      return rows[depth];
    }
  }

  @Override
  public long ramBytesUsed() {
    long bytes = BASE_RAM_BYTES_USED;
    for (TrieNode<T> node : nodes) {
      bytes += node.ramBytesUsed() + RamUsageEstimator.NUM_BYTES_OBJECT_REF;
      if (node.value instanceof Accountable) {
        bytes += ((Accountable) node.value).ramBytesUsed();
      }
    }
    for (String word : words) {
      // the string is shared by the word list, the index and the node
      bytes += RamUsageEstimator.shallowSizeOfInstance(String.class)
          + RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + (long) word.length() * Character.BYTES)
          + 3L * RamUsageEstimator.NUM_BYTES_OBJECT_REF;
    }
    return bytes;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(words=" + words.size() + ",nodes=" + nodes.size() + ")";
  }
}
