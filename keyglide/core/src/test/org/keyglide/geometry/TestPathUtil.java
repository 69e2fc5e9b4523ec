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
import java.util.Arrays;
import java.util.List;

import org.apache.lucene.util.LuceneTestCase;

public class TestPathUtil extends LuceneTestCase {

  private static final double DELTA = 1e-9;

  private static List<Point> points(double... coords) {
    List<Point> points = new ArrayList<>();
    for (int i = 0; i < coords.length; i += 2) {
      points.add(new Point(coords[i], coords[i + 1]));
    }
    return points;
  }

  private static void assertPoint(Point expected, Point actual, double delta) {
    assertEquals("x of " + actual, expected.getX(), actual.getX(), delta);
    assertEquals("y of " + actual, expected.getY(), actual.getY(), delta);
  }

  public void testLength() {
    assertEquals(0.0, PathUtil.length(points(1, 1)), DELTA);
    assertEquals(5.0, PathUtil.length(points(0, 0, 3, 4)), DELTA);
    assertEquals(12.0, PathUtil.length(points(0, 0, 3, 4, 3, 11)), DELTA);
  }

  public void testResampleReturnsRequestedCount() {
    List<Point> path = points(0, 0, 10, 0, 10, 5, 30, 5);
    int iters = atLeast(20);
    for (int i = 0; i < iters; i++) {
      int n = 1 + random().nextInt(100);
      List<Point> resampled = PathUtil.resample(path, n);
      assertEquals(n, resampled.size());
      assertPoint(path.get(0), resampled.get(0), DELTA);
      if (n > 1) {
        assertPoint(path.get(path.size() - 1), resampled.get(n - 1), DELTA);
      }
    }
  }

  public void testResampleUniformPathIsIdentity() {
    List<Point> path = new ArrayList<>();
    int size = 2 + random().nextInt(20);
    double step = 1 + random().nextDouble() * 10;
    for (int i = 0; i < size; i++) {
      path.add(new Point(i * step, 2 * i * step));
    }
    List<Point> resampled = PathUtil.resample(path, size);
    for (int i = 0; i < size; i++) {
      assertPoint(path.get(i), resampled.get(i), 1e-6);
    }
  }

  public void testResampleIsEvenlySpaced() {
    List<Point> path = points(0, 0, 1, 0, 1, 9);
    List<Point> resampled = PathUtil.resample(path, 11);
    for (int i = 1; i < resampled.size(); i++) {
      assertEquals(1.0, resampled.get(i - 1).distance(resampled.get(i)), 1e-9);
    }
    assertPoint(new Point(1, 0), resampled.get(1), DELTA);
    assertPoint(new Point(1, 4), resampled.get(5), DELTA);
  }

  public void testResampleZeroLengthPath() {
    Point a = new Point(3, 4);
    assertEquals(Arrays.asList(a, a, a), PathUtil.resample(Arrays.asList(a), 3));
    List<Point> resampled = PathUtil.resample(Arrays.asList(a, a, a, a), 5);
    assertEquals(5, resampled.size());
    for (Point p : resampled) {
      assertPoint(a, p, DELTA);
    }
  }

  public void testResampleSinglePoint() {
    assertEquals(Arrays.asList(new Point(0, 0)), PathUtil.resample(points(0, 0, 5, 5), 1));
  }

  public void testResampleIllegalArguments() {
    expectThrows(IllegalArgumentException.class, () -> PathUtil.resample(new ArrayList<>(), 3));
    expectThrows(IllegalArgumentException.class, () -> PathUtil.resample(points(0, 0, 1, 1), 0));
  }

  public void testMeanDistance() {
    List<Point> a = points(0, 0, 0, 0);
    List<Point> b = points(3, 4, 0, 1);
    assertEquals(3.0, PathUtil.meanDistance(a, b), DELTA);
    assertEquals(0.0, PathUtil.meanDistance(b, b), DELTA);
    expectThrows(IllegalArgumentException.class, () -> PathUtil.meanDistance(a, points(1, 1)));
    expectThrows(IllegalArgumentException.class, () -> PathUtil.meanDistance(new ArrayList<>(), new ArrayList<>()));
  }
}
