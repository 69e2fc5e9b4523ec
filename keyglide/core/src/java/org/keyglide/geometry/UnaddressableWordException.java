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

/**
 * Thrown when a word contains a character that has no key on the active layout, so the
 * word cannot be traced as a keyboard path. Such words stay available for lookup and
 * typed correction but can never match a gesture.
 */
public class UnaddressableWordException extends IllegalArgumentException {

  private final String word;
  private final char character;

  public UnaddressableWordException(String word, char character) {
    super("word '" + word + "' contains character '" + character + "' which has no key on the layout");
    this.word = word;
    this.character = character;
  }

  /** The word that could not be given a path. */
  public String getWord() {
    return word;
  }

  /** The first character of the word that has no key center. */
  public char getCharacter() {
    return character;
  }
}
