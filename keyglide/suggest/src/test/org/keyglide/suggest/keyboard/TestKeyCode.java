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

import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.TestUtil;

public class TestKeyCode extends LuceneTestCase {

  public void testParseNames() {
    assertEquals(KeyCode.character('a'), KeyCode.parse("a"));
    assertEquals(KeyCode.Kind.CHARACTER, KeyCode.parse(" ").getKind());
    assertEquals(KeyCode.BACKSPACE, KeyCode.parse("backspace"));
    assertEquals(KeyCode.SHIFT, KeyCode.parse("shift"));
    assertEquals(KeyCode.CAPSLOCK, KeyCode.parse("capslock"));
    assertEquals(KeyCode.CTRL, KeyCode.parse("ctrl"));
    KeyCode suggestion = KeyCode.parse("sug3");
    assertEquals(KeyCode.Kind.SUGGESTION, suggestion.getKind());
    assertEquals(3, suggestion.getSlot());
  }

  public void testNamesIgnoreCase() {
    assertEquals(KeyCode.SHIFT, KeyCode.parse("SHIFT"));
    assertEquals(KeyCode.BACKSPACE, KeyCode.parse("BackSpace"));
    assertEquals(KeyCode.suggestion(3), KeyCode.parse("SUG3"));
    assertEquals(KeyCode.suggestion(0), KeyCode.parse("Sug0"));
    // single characters keep their case
    assertEquals(KeyCode.character('A'), KeyCode.parse("A"));
  }

  public void testNameRoundTrip() {
    int slot = TestUtil.nextInt(random(), 0, 100);
    for (KeyCode code : new KeyCode[] {KeyCode.character('x'), KeyCode.BACKSPACE, KeyCode.SHIFT,
        KeyCode.CAPSLOCK, KeyCode.CTRL, KeyCode.suggestion(slot)}) {
      assertEquals(code, KeyCode.parse(code.getName()));
    }
  }

  public void testUnknownNames() {
    expectThrows(IllegalArgumentException.class, () -> KeyCode.parse(""));
    expectThrows(IllegalArgumentException.class, () -> KeyCode.parse("enterprise"));
    expectThrows(IllegalArgumentException.class, () -> KeyCode.parse("sug"));
    expectThrows(IllegalArgumentException.class, () -> KeyCode.parse("sug-1"));
    expectThrows(IllegalArgumentException.class, () -> KeyCode.parse("sug99999999999"));
    expectThrows(IllegalArgumentException.class, () -> KeyCode.suggestion(-1));
  }

  public void testPayloadOfWrongKind() {
    expectThrows(IllegalStateException.class, () -> KeyCode.SHIFT.getSlot());
    expectThrows(IllegalStateException.class, () -> KeyCode.suggestion(0).getCharacter());
    assertEquals('q', KeyCode.character('q').getCharacter());
  }
}
