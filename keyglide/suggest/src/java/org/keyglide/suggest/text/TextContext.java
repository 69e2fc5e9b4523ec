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

/**
 * Reads the words around a cursor in the text being edited. A word is a maximal run of
 * letters; everything else separates words.
 */
public final class TextContext {

  private TextContext() {}

  /**
   * Returns the letters immediately before <code>cursor</code>, or the empty string if the
   * cursor does not follow a letter.
   *
   * @throws IllegalArgumentException if <code>cursor</code> is outside [0, text.length()]
   */
  public static String currentWord(CharSequence text, int cursor) {
    checkCursor(text, cursor);
    return text.subSequence(wordStart(text, cursor), cursor).toString();
  }

  /**
   * Returns the word before the current word, skipping the separators between them, or the
   * empty string if there is none.
   *
   * @throws IllegalArgumentException if <code>cursor</code> is outside [0, text.length()]
   */
  public static String previousWord(CharSequence text, int cursor) {
    checkCursor(text, cursor);
    int end = wordStart(text, cursor);
    while (end > 0 && Character.isLetter(text.charAt(end - 1)) == false) {
      end--;
    }
    return text.subSequence(wordStart(text, end), end).toString();
  }

  private static int wordStart(CharSequence text, int end) {
    int start = end;
    while (start > 0 && Character.isLetter(text.charAt(start - 1))) {
      start--;
    }
    return start;
  }

  private static void checkCursor(CharSequence text, int cursor) {
    if (cursor < 0 || cursor > text.length()) {
      throw new IllegalArgumentException("cursor " + cursor + " is outside of text of length " + text.length());
    }
  }
}
