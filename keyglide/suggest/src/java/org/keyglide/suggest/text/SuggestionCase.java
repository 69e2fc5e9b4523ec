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
package org.keyglide.suggest.text;

import java.util.Locale;

/** How suggested words are cased before they are shown, following the modifier keys. */
public enum SuggestionCase {

  /** Words as stored. */
  LOWER {
    @Override
    public String apply(String word) {
      return word;
    }
  },

  /** First letter upper case, as with shift held. */
  CAPITALIZED {
    @Override
    public String apply(String word) {
      if (word.isEmpty()) {
        return word;
      }
      final int first = Character.charCount(word.codePointAt(0));
      return word.substring(0, first).toUpperCase(Locale.ROOT) + word.substring(first);
    }
  },

  /** All letters upper case, as with caps lock on. */
  UPPER {
    @Override
    public String apply(String word) {
      return word.toUpperCase(Locale.ROOT);
    }
  };

  /** Returns <code>word</code> in this case. */
  public abstract String apply(String word);

  /**
   * Shift alone capitalizes and caps lock alone upper-cases; shift on top of caps lock
   * cancels it out.
   */
  public static SuggestionCase fromModifiers(boolean shift, boolean capsLock) {
    if (shift == capsLock) {
      return LOWER;
    }
    return shift ? CAPITALIZED : UPPER;
  }
}
