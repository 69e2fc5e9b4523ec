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

import java.util.Locale;
import java.util.Objects;

/**
 * What pressing a key does: type a character, act as a modifier or editing key, or accept
 * the suggestion in a given slot of the suggestion strip.
 */
public final class KeyCode {

  /** The kinds of keys. */
  public enum Kind {
    CHARACTER, BACKSPACE, SHIFT, CAPSLOCK, CTRL, SUGGESTION
  }

  private static final String SUGGESTION_PREFIX = "sug";

  public static final KeyCode BACKSPACE = new KeyCode(Kind.BACKSPACE, '\0', -1);
  public static final KeyCode SHIFT = new KeyCode(Kind.SHIFT, '\0', -1);
  public static final KeyCode CAPSLOCK = new KeyCode(Kind.CAPSLOCK, '\0', -1);
  public static final KeyCode CTRL = new KeyCode(Kind.CTRL, '\0', -1);

  private final Kind kind;
  private final char character;
  private final int slot;

  private KeyCode(Kind kind, char character, int slot) {
    this.kind = kind;
    this.character = character;
    this.slot = slot;
  }

  /** A key typing <code>c</code>. */
  public static KeyCode character(char c) {
    return new KeyCode(Kind.CHARACTER, c, -1);
  }

  /** A key accepting the suggestion in <code>slot</code>. */
  public static KeyCode suggestion(int slot) {
    if (slot < 0) {
      throw new IllegalArgumentException("suggestion slot must be >= 0, got " + slot);
    }
    return new KeyCode(Kind.SUGGESTION, '\0', slot);
  }

  /**
   * Parses a key name of a layout file: a single character, one of <code>backspace</code>,
   * <code>shift</code>, <code>capslock</code> and <code>ctrl</code>, or
   * <code>sug</code> followed by a slot number.
   *
   * @throws IllegalArgumentException if the name is not a known key
   */
  public static KeyCode parse(String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("empty key name");
    }
    if (name.length() == 1) {
      return character(name.charAt(0));
    }
    final String lower = name.toLowerCase(Locale.ROOT);
    switch (lower) {
      case "backspace":
        return BACKSPACE;
      case "shift":
        return SHIFT;
      case "capslock":
        return CAPSLOCK;
      case "ctrl":
        return CTRL;
      default:
        break;
    }
    if (lower.startsWith(SUGGESTION_PREFIX) && lower.length() > SUGGESTION_PREFIX.length()) {
      final String digits = lower.substring(SUGGESTION_PREFIX.length());
      for (int i = 0; i < digits.length(); i++) {
        if (digits.charAt(i) < '0' || digits.charAt(i) > '9') {
          throw new IllegalArgumentException("unknown key name: " + name);
        }
      }
      try {
        return suggestion(Integer.parseInt(digits));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("suggestion slot out of range: " + name, e);
      }
    }
    throw new IllegalArgumentException("unknown key name: " + name);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The character typed by this key.
   *
   * @throws IllegalStateException if this is not a {@link Kind#CHARACTER} key
   */
  public char getCharacter() {
    if (kind != Kind.CHARACTER) {
      throw new IllegalStateException(kind + " key types no character");
    }
    return character;
  }

  /**
   * The suggestion slot accepted by this key.
   *
   * @throws IllegalStateException if this is not a {@link Kind#SUGGESTION} key
   */
  public int getSlot() {
    if (kind != Kind.SUGGESTION) {
      throw new IllegalStateException(kind + " key has no suggestion slot");
    }
    return slot;
  }

  /** Inverse of {@link #parse}. */
  public String getName() {
    switch (kind) {
      case CHARACTER:
        return String.valueOf(character);
      case SUGGESTION:
        return SUGGESTION_PREFIX + slot;
      default:
        return kind.name().toLowerCase(Locale.ROOT);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final KeyCode that = (KeyCode) other;
    return kind == that.kind && character == that.character && slot == that.slot;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, character, slot);
  }

  @Override
  public String toString() {
    return getName();
  }
}
