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

import java.io.IOException;
import java.io.InputStream;
import java.io.LineNumberReader;
import java.io.Reader;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.lucene.util.IOUtils;
import org.keyglide.suggest.WeightedWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads word frequency lists for a {@link org.keyglide.suggest.Vocabulary}.
 * <p>
 * Two formats are read, both UTF-8 text where blank lines and lines starting with
 * <code>#</code> are ignored:
 * <ul>
 *   <li>corpus counts: a file holding the corpus size (a single number) plus a file with one
 *   <pre>word<b>\t</b>count</pre> per line. The frequency of a word is its count divided by
 *   the corpus size. Words with anything but letters are skipped.</li>
 *   <li>frequencies: one <pre>word<b>\t</b>frequency</pre> per line, the frequency in
 *   [0, 1].</li>
 * </ul>
 * Words are lower-cased; when a word occurs twice the later line wins. Readers passed in
 * are closed.
 */
public final class FrequencyDictionaryLoader {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private FrequencyDictionaryLoader() {}

  /**
   * Reads the corpus size from <code>totalReader</code> and the word counts from
   * <code>countsReader</code>.
   *
   * @return the alphabetic words with their relative frequency, in file order
   * @throws DictionaryFormatException if a line cannot be parsed or a count exceeds the total
   * @throws IOException If there is a low-level I/O error.
   */
  public static List<WeightedWord> loadCounts(Reader totalReader, Reader countsReader) throws IOException {
    final double total;
    boolean totalRead = false;
    try {
      total = readTotal(totalReader);
      totalRead = true;
    } finally {
      if (totalRead == false) {
        IOUtils.closeWhileHandlingException(countsReader);
      }
    }
    final Map<String,Double> frequencies = new LinkedHashMap<>();
    int skipped = 0;
    LineNumberReader input = null;
    boolean success = false;
    try {
      input = new LineNumberReader(countsReader);
      String line;
      while ((line = input.readLine()) != null) {
        if (isIgnorable(line)) {
          continue;
        }
        final String[] fields = split(line, input.getLineNumber());
        if (isAlphabetic(fields[0]) == false) {
          skipped++;
          continue;
        }
        final double count = parseNumber(fields[1], line, input.getLineNumber());
        if (count < 0 || count > total) {
          throw malformed("count must be in [0, " + total + "]", line, input.getLineNumber());
        }
        final String word = fields[0].toLowerCase(Locale.ROOT);
        frequencies.remove(word);
        frequencies.put(word, count / total);
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(input);
      } else {
        IOUtils.closeWhileHandlingException(input, countsReader);
      }
    }
    log.info("read {} words from a corpus of {} words, skipped {} non-alphabetic entries",
        frequencies.size(), (long) total, skipped);
    return toList(frequencies);
  }

  /** Reads corpus counts from UTF-8 files. */
  public static List<WeightedWord> loadCounts(Path totalFile, Path countsFile) throws IOException {
    final Reader total = newReader(totalFile);
    final Reader counts;
    try {
      counts = newReader(countsFile);
    } catch (IOException | RuntimeException e) {
      IOUtils.closeWhileHandlingException(total);
      throw e;
    }
    return loadCounts(total, counts);
  }

  /**
   * Reads <code>word\tfrequency</code> lines.
   *
   * @throws DictionaryFormatException if a line cannot be parsed or a frequency is outside [0, 1]
   * @throws IOException If there is a low-level I/O error.
   */
  public static List<WeightedWord> loadFrequencies(Reader reader) throws IOException {
    final Map<String,Double> frequencies = new LinkedHashMap<>();
    LineNumberReader input = null;
    boolean success = false;
    try {
      input = new LineNumberReader(reader);
      String line;
      while ((line = input.readLine()) != null) {
        if (isIgnorable(line)) {
          continue;
        }
        final String[] fields = split(line, input.getLineNumber());
        if (fields[0].isEmpty()) {
          throw malformed("empty word", line, input.getLineNumber());
        }
        final double frequency = parseNumber(fields[1], line, input.getLineNumber());
        if (frequency < 0 || frequency > 1) {
          throw malformed("frequency must be in [0, 1]", line, input.getLineNumber());
        }
        final String word = fields[0].toLowerCase(Locale.ROOT);
        frequencies.remove(word);
        frequencies.put(word, frequency);
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(input);
      } else {
        IOUtils.closeWhileHandlingException(input, reader);
      }
    }
    log.info("read {} word frequencies", frequencies.size());
    return toList(frequencies);
  }

  /** Reads <code>word\tfrequency</code> lines from a UTF-8 file. */
  public static List<WeightedWord> loadFrequencies(Path file) throws IOException {
    return loadFrequencies(newReader(file));
  }

  private static double readTotal(Reader reader) throws IOException {
    LineNumberReader input = null;
    boolean success = false;
    try {
      input = new LineNumberReader(reader);
      String line;
      while ((line = input.readLine()) != null) {
        if (isIgnorable(line)) {
          continue;
        }
        final double total = parseNumber(stripByteOrderMark(line, input.getLineNumber()).trim(), line, input.getLineNumber());
        if (total <= 0) {
          throw malformed("corpus size must be positive", line, input.getLineNumber());
        }
        success = true;
        return total;
      }
      throw new DictionaryFormatException("missing corpus size", input.getLineNumber());
    } finally {
      if (success) {
        IOUtils.close(input);
      } else {
        IOUtils.closeWhileHandlingException(input, reader);
      }
    }
  }

  private static Reader newReader(Path file) throws IOException {
    final InputStream stream = Files.newInputStream(file);
    return IOUtils.getDecodingReader(stream, StandardCharsets.UTF_8);
  }

  private static boolean isIgnorable(String line) {
    return line.startsWith("#") || line.trim().isEmpty();
  }

  private static String[] split(String line, int lineNumber) throws DictionaryFormatException {
    final String[] fields = stripByteOrderMark(line, lineNumber).split("\t", 2);
    if (fields.length != 2) {
      throw malformed("expected word<TAB>number", line, lineNumber);
    }
    fields[0] = fields[0].trim();
    fields[1] = fields[1].trim();
    return fields;
  }

  private static String stripByteOrderMark(String line, int lineNumber) {
    if (lineNumber == 1 && line.length() > 0 && line.charAt(0) == '\uFEFF') {
      return line.substring(1);
    }
    return line;
  }

  private static double parseNumber(String value, String line, int lineNumber) throws DictionaryFormatException {
    final double number;
    try {
      number = Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("line {}: '{}' is not a number", lineNumber, value);
      throw new DictionaryFormatException("'" + value + "' is not a number", lineNumber, e);
    }
    if (Double.isNaN(number) || Double.isInfinite(number)) {
      throw malformed("'" + value + "' is not a finite number", line, lineNumber);
    }
    return number;
  }

  private static DictionaryFormatException malformed(String problem, String line, int lineNumber) {
    log.warn("line {}: {}: '{}'", lineNumber, problem, line);
    return new DictionaryFormatException(problem, lineNumber);
  }

  private static boolean isAlphabetic(String word) {
    if (word.isEmpty()) {
      return false;
    }
    for (int i = 0; i < word.length(); ) {
      final int cp = word.codePointAt(i);
      if (Character.isLetter(cp) == false) {
        return false;
      }
      i += Character.charCount(cp);
    }
    return true;
  }

  private static List<WeightedWord> toList(Map<String,Double> frequencies) {
    final List<WeightedWord> words = new ArrayList<>(frequencies.size());
    for (Map.Entry<String,Double> e : frequencies.entrySet()) {
      words.add(new WeightedWord(e.getKey(), e.getValue()));
    }
    return words;
  }
}
