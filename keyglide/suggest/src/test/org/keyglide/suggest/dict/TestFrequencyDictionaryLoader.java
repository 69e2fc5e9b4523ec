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
package org.keyglide.suggest.dict;

import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.LuceneTestCase;
import org.keyglide.suggest.KeyboardSuggester;
import org.keyglide.suggest.WeightedWord;

public class TestFrequencyDictionaryLoader extends LuceneTestCase {

  private Reader resource(String name) {
    return IOUtils.getDecodingReader(getClass().getResourceAsStream(name), StandardCharsets.UTF_8);
  }

  public void testLoadCounts() throws Exception {
    List<WeightedWord> words = FrequencyDictionaryLoader.loadCounts(resource("0grams"), resource("1grams"));
    // "The" replaces "the", non-alphabetic words are skipped
    assertEquals(Arrays.asList(
        new WeightedWord("the", 0.04),
        new WeightedWord("cat", 0.02),
        new WeightedWord("naïve", 0.002),
        new WeightedWord("car", 0.01)), words);
  }

  public void testLoadFrequencies() throws Exception {
    List<WeightedWord> words = FrequencyDictionaryLoader.loadFrequencies(resource("frequencies.txt"));
    assertEquals(3, words.size());
    assertEquals(new WeightedWord("cat", 0.5), words.get(0));

    KeyboardSuggester suggester = new KeyboardSuggester();
    assertEquals(3, suggester.loadVocabulary(words));
    assertEquals("cat", suggester.correct("cac", 1).get(0).getWord());
  }

  public void testLoadFromFiles() throws Exception {
    Path dir = createTempDir("dict");
    Path total = dir.resolve("0grams");
    Path counts = dir.resolve("1grams");
    Files.write(total, "\uFEFF200\n".getBytes(StandardCharsets.UTF_8));
    Files.write(counts, "Hello\t50\nworld\t20\n".getBytes(StandardCharsets.UTF_8));
    List<WeightedWord> words = FrequencyDictionaryLoader.loadCounts(total, counts);
    assertEquals(Arrays.asList(new WeightedWord("hello", 0.25), new WeightedWord("world", 0.1)), words);

    Path frequencies = dir.resolve("frequencies.txt");
    Files.write(frequencies, "hello\t0.75\n".getBytes(StandardCharsets.UTF_8));
    assertEquals(Arrays.asList(new WeightedWord("hello", 0.75)), FrequencyDictionaryLoader.loadFrequencies(frequencies));
  }

  public void testMalformedLines() throws Exception {
    DictionaryFormatException e = expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadFrequencies(new StringReader("cat\t0.5\ncar 0.3\n")));
    assertEquals(2, e.getLineNumber());

    e = expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadFrequencies(new StringReader("# header\n\ncat\tmany\n")));
    assertEquals(3, e.getLineNumber());

    e = expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadFrequencies(new StringReader("cat\t1.5\n")));
    assertEquals(1, e.getLineNumber());

    e = expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadCounts(new StringReader("10\n"), new StringReader("cat\t20\n")));
    assertEquals(1, e.getLineNumber());
  }

  public void testBadTotal() {
    expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadCounts(new StringReader(""), new StringReader("cat\t1\n")));
    expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadCounts(new StringReader("0\n"), new StringReader("cat\t1\n")));
    expectThrows(DictionaryFormatException.class,
        () -> FrequencyDictionaryLoader.loadCounts(new StringReader("lots\n"), new StringReader("cat\t1\n")));
  }
}
