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

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;
import org.keyglide.geometry.KeyboardPath;

/**
 * What the vocabulary stores for each word: the word's keyboard path on the active
 * layout and its static corpus frequency.
 * <p>
 * The path depends on the layout and is recomputed when the layout changes; the
 * frequency does not. A word that contains a character without a key has no path: it
 * is not {@link #isGestureEligible() gesture eligible} but still takes part in lookup
 * and typed correction.
 */
public final class WordEntry implements Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(WordEntry.class);
  private static final long PATH_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(KeyboardPath.class);

  private final KeyboardPath path;
  private final double frequency;

  /**
   * @param path the keyboard path, or <code>null</code> if the word cannot be traced
   * @param frequency the static corpus frequency, in <code>[0, 1]</code>
   */
  public WordEntry(KeyboardPath path, double frequency) {
    if (!(frequency >= 0.0 && frequency <= 1.0)) {
      throw new IllegalArgumentException("frequency must be in [0, 1], got " + frequency);
    }
    this.path = path;
    this.frequency = frequency;
  }

  /** Returns a copy of this entry with another keyboard path and the same frequency. */
  public WordEntry withPath(KeyboardPath newPath) {
    return new WordEntry(newPath, frequency);
  }

  /** The keyboard path, or <code>null</code> if the word is not gesture eligible. */
  public KeyboardPath getPath() {
    return path;
  }

  /** Length of the keyboard path; 0 when there is no path. */
  public double getPathLength() {
    return path == null ? 0.0 : path.getLength();
  }

  public double getFrequency() {
    return frequency;
  }

  /** Returns true if the word has a keyboard path and can therefore match a gesture. */
  public boolean isGestureEligible() {
    return path != null;
  }

  @Override
  public long ramBytesUsed() {
    long bytes = BASE_RAM_BYTES_USED;
    if (path != null) {
      // points are shared with the layout, only the array is ours
      bytes += PATH_RAM_BYTES_USED + RamUsageEstimator.alignObjectSize(
          RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + (long) path.size() * RamUsageEstimator.NUM_BYTES_OBJECT_REF);
    }
    return bytes;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final WordEntry that = (WordEntry) other;
    return Double.compare(frequency, that.frequency) == 0 && Objects.equals(path, that.path);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hashCode(path) + Double.hashCode(frequency);
  }

  @Override
  public String toString() {
    return "WordEntry(frequency=" + frequency + (path == null ? ",no path" : ",pathLength=" + path.getLength()) + ")";
  }
}
