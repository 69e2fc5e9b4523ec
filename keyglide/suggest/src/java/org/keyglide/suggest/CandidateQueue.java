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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.lucene.util.PriorityQueue;

/** Keeps the best <code>maxSize</code> candidates offered to it. */
final class CandidateQueue extends PriorityQueue<Candidate> {

  CandidateQueue(int maxSize) {
    super(maxSize);
  }

  @Override
  protected boolean lessThan(Candidate a, Candidate b) {
    // the "least" candidate is the worst one and is evicted first
    return a.compareTo(b) > 0;
  }

  /** Empties the queue and returns its candidates, best first. */
  List<Candidate> drainSorted() {
    final List<Candidate> results = new ArrayList<>(size());
    while (size() > 0) {
      results.add(pop());
    }
    Collections.reverse(results);
    return results;
  }
}
