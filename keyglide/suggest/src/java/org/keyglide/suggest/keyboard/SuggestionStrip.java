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
package org.keyglide.suggest.keyboard;

import java.util.ArrayList;
import java.util.List;

import org.keyglide.suggest.Candidate;
import org.keyglide.suggest.text.SuggestionCase;

/**
 * The row of suggestion keys above the keyboard. Every slot is always present; slots
 * without a suggestion hold a blank key.
 */
public class SuggestionStrip {

  public static final int DEFAULT_SLOT_COUNT = 6;

  /** Width of a suggestion key, in key columns. */
  public static final double COLUMN_WIDTH = 2.5;

  private final int slotCount;

  public SuggestionStrip() {
    this(DEFAULT_SLOT_COUNT);
  }

  public SuggestionStrip(int slotCount) {
    if (slotCount < 1) {
      throw new IllegalArgumentException("slotCount must be >= 1, got " + slotCount);
    }
    this.slotCount = slotCount;
  }

  public int getSlotCount() {
    return slotCount;
  }

  /**
   * Lays out <code>candidates</code>, best first, one per slot, cased by
   * <code>suggestionCase</code>. Candidates beyond the last slot are dropped.
   *
   * @return exactly {@link #getSlotCount()} keys
   */
  public List<KeySpec> fill(List<Candidate> candidates, SuggestionCase suggestionCase) {
    final List<KeySpec> keys = new ArrayList<>(slotCount);
    for (int slot = 0; slot < slotCount; slot++) {
      final KeyCode code = KeyCode.suggestion(slot);
      if (slot < candidates.size()) {
        final String text = suggestionCase.apply(candidates.get(slot).getWord());
        keys.add(new KeySpec(text, text, code, COLUMN_WIDTH));
      } else {
        keys.add(new KeySpec("", "", code, COLUMN_WIDTH));
      }
    }
    return keys;
  }
}
