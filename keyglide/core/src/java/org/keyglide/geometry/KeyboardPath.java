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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The path a finger would trace to type a word: the key center of each letter, in order,
 * together with the total length of the polyline through them.
 *
 * @see KeyLayout#pathOf(CharSequence)
 */
public final class KeyboardPath {

  private final Point[] points;
  private final double length;

  KeyboardPath(Point[] points) {
    if (points.length == 0) {
      throw new IllegalArgumentException("a keyboard path needs at least one point");
    }
    this.points = points;
    this.length = PathUtil.length(Arrays.asList(points));
  }

  /** The key centers, one per letter of the word. */
  public List<Point> getPoints() {
    return Collections.unmodifiableList(Arrays.asList(points));
  }

  /** Sum of the Euclidean lengths of the segments between consecutive key centers. */
  public double getLength() {
    return length;
  }

  public Point first() {
    return points[0];
  }

  public Point last() {
    return points[points.length - 1];
  }

  public int size() {
    return points.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    return Arrays.equals(points, ((KeyboardPath) other).points);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(points);
  }

  @Override
  public String toString() {
    return "KeyboardPath(" + Arrays.toString(points) + ",length=" + length + ")";
  }
}
