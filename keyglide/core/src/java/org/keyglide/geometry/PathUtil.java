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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static helpers for polylines given as point lists: length, arc-length resampling and
 * the mean point-to-point distance used to compare a gesture with a word's path.
 */
public final class PathUtil {

  /** no instance */
  private PathUtil() {}

  /** Returns the sum of the Euclidean lengths of the consecutive segments of <code>path</code>. */
  public static double length(List<Point> path) {
    double total = 0.0;
    for (int i = 1; i < path.size(); i++) {
      total += path.get(i - 1).distance(path.get(i));
    }
    return total;
  }

  /**
   * Returns exactly <code>n</code> points spaced evenly by arc length along
   * <code>path</code>, from its first point to its last. Each point is linearly
   * interpolated between the two original points that bracket its arc-length position.
   * A path of length zero resamples to its first point repeated <code>n</code> times.
   *
   * @throws IllegalArgumentException if the path is empty or <code>n</code> is less than 1
   */
  public static List<Point> resample(List<Point> path, int n) {
    if (path.isEmpty()) {
      throw new IllegalArgumentException("cannot resample an empty path");
    }
    if (n < 1) {
      throw new IllegalArgumentException("n must be >= 1, got " + n);
    }
    final int size = path.size();
    if (size == 1) {
      return Collections.nCopies(n, path.get(0));
    }

    final double[] cumulative = new double[size];
    for (int i = 1; i < size; i++) {
      cumulative[i] = cumulative[i - 1] + path.get(i - 1).distance(path.get(i));
    }
    final double total = cumulative[size - 1];

    final List<Point> points = new ArrayList<>(n);
    int segment = 0;
    for (int k = 0; k < n; k++) {
      final double target = n == 1 ? 0.0 : Math.min(k * total / (n - 1), total);
      // first segment whose end reaches the target; targets only grow
      while (segment < size - 2 && cumulative[segment + 1] < target) {
        segment++;
      }
      final double start = cumulative[segment];
      final double end = cumulative[segment + 1];
      final double t = end == start ? 0.0 : (target - start) / (end - start);
      final Point a = path.get(segment);
      final Point b = path.get(segment + 1);
      points.add(new Point(a.getX() + t * (b.getX() - a.getX()), a.getY() + t * (b.getY() - a.getY())));
    }
    return points;
  }

  /**
   * Returns the mean Euclidean distance between the points at the same positions of two
   * equally long point lists.
   *
   * @throws IllegalArgumentException if the lists differ in size or are empty
   */
  public static double meanDistance(List<Point> a, List<Point> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException("point counts differ: " + a.size() + " != " + b.size());
    }
    if (a.isEmpty()) {
      throw new IllegalArgumentException("cannot compare empty point lists");
    }
    double sum = 0.0;
    for (int i = 0; i < a.size(); i++) {
      sum += a.get(i).distance(b.get(i));
    }
    return sum / a.size();
  }
}
