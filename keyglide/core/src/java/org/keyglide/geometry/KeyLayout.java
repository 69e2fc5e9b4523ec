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
package org.keyglide.geometry;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The geometry of the active keyboard as far as word matching cares: the center of the
 * key of every letter and the size of one key.
 * <p>
 * Layouts are computed elsewhere (from the rows and columns of the keyboard on screen);
 * use a {@link Builder} to describe one. Only letters are addressable; letters are
 * stored in lower case and looked up case-insensitively.
 * <p>
 * Instances are immutable. Two layouts with the same centers and key size are equal, so
 * callers can cheaply tell whether the keyboard geometry really changed.
 */
public final class KeyLayout {

  private final SortedMap<Character,Point> centers;
  private final double keyWidth;
  private final double keyHeight;

  private KeyLayout(SortedMap<Character,Point> centers, double keyWidth, double keyHeight) {
    this.centers = Collections.unmodifiableSortedMap(new TreeMap<>(centers));
    this.keyWidth = keyWidth;
    this.keyHeight = keyHeight;
  }

  /** Returns the center of the key of <code>c</code>, or <code>null</code> if there is none. */
  public Point centerOf(char c) {
    return centers.get(Character.toLowerCase(c));
  }

  /** Letter to key center, in letter order. */
  public Map<Character,Point> getCenters() {
    return centers;
  }

  public double getKeyWidth() {
    return keyWidth;
  }

  public double getKeyHeight() {
    return keyHeight;
  }

  /** Returns true if every character of <code>word</code> has a key on this layout. */
  public boolean canAddress(CharSequence word) {
    if (word.length() == 0) {
      return false;
    }
    for (int i = 0; i < word.length(); i++) {
      if (centerOf(word.charAt(i)) == null) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the key centers of the letters of <code>word</code>, in order.
   *
   * @throws UnaddressableWordException if a character of the word has no key
   * @throws IllegalArgumentException if the word is empty
   */
  public KeyboardPath pathOf(CharSequence word) {
    if (word.length() == 0) {
      throw new IllegalArgumentException("cannot trace the empty word");
    }
    final Point[] points = new Point[word.length()];
    for (int i = 0; i < word.length(); i++) {
      final char c = word.charAt(i);
      final Point center = centerOf(c);
      if (center == null) {
        throw new UnaddressableWordException(word.toString(), c);
      }
      points[i] = center;
    }
    return new KeyboardPath(points);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final KeyLayout that = (KeyLayout) other;
    return Double.compare(keyWidth, that.keyWidth) == 0
        && Double.compare(keyHeight, that.keyHeight) == 0
        && centers.equals(that.centers);
  }

  @Override
  public int hashCode() {
    int h = centers.hashCode();
    h = 31 * h + Double.hashCode(keyWidth);
    h = 31 * h + Double.hashCode(keyHeight);
    return h;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "KeyLayout(keys=%d,keyWidth=%.2f,keyHeight=%.2f)",
        centers.size(), keyWidth, keyHeight);
  }

  /**
   * Collects key centers for a {@link KeyLayout}.
   * <p>
   * Keys can be given by their center or by their bounds; for bounds the center is
   * <code>(x + w/2, y + h/2)</code>. Keys that are not letters (space, shift, digits, ...)
   * are ignored. Unless set explicitly the key size is the size of the first key given by
   * its bounds. Adding a letter twice keeps the last position.
   */
  public static final class Builder {

    private final SortedMap<Character,Point> centers = new TreeMap<>();
    private double keyWidth = Double.NaN;
    private double keyHeight = Double.NaN;

    /** Sets the size of one key, used as the tolerance when matching gesture endpoints. */
    public Builder setKeySize(double width, double height) {
      if (!(width > 0) || !(height > 0)) {
        throw new IllegalArgumentException("key size must be positive, got " + width + "x" + height);
      }
      this.keyWidth = width;
      this.keyHeight = height;
      return this;
    }

    /** Adds the key of <code>label</code> at the given center. */
    public Builder addKeyCenter(char label, double x, double y) {
      if (Character.isLetter(label)) {
        centers.put(Character.toLowerCase(label), new Point(x, y));
      }
      return this;
    }

    /** Adds the key of <code>label</code> with its top-left corner and size. */
    public Builder addKey(char label, double x, double y, double width, double height) {
      if (Double.isNaN(keyWidth)) {
        setKeySize(width, height);
      }
      return addKeyCenter(label, x + width * 0.5, y + height * 0.5);
    }

    /** Adds a row of equally sized keys, left to right, starting at <code>(x, y)</code>. */
    public Builder addRow(CharSequence labels, double x, double y, double width, double height) {
      for (int i = 0; i < labels.length(); i++) {
        addKey(labels.charAt(i), x + i * width, y, width, height);
      }
      return this;
    }

    /**
     * Builds the layout.
     *
     * @throws IllegalStateException if no letter key was added or the key size is unknown
     */
    public KeyLayout build() {
      if (centers.isEmpty()) {
        throw new IllegalStateException("a layout needs at least one letter key");
      }
      if (Double.isNaN(keyWidth)) {
        throw new IllegalStateException("key size was never set");
      }
      return new KeyLayout(centers, keyWidth, keyHeight);
    }
  }
}
