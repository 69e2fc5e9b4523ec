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

import java.util.Objects;

/** One key of a layout row: its label, the text it inserts, its code and its width in columns. */
public final class KeySpec {

  private final String displayText;
  private final String insertionText;
  private final KeyCode code;
  private final double columnWidth;

  public KeySpec(String displayText, String insertionText, KeyCode code, double columnWidth) {
    if (columnWidth <= 0 || Double.isNaN(columnWidth)) {
      throw new IllegalArgumentException("column width must be positive, got " + columnWidth);
    }
    this.displayText = Objects.requireNonNull(displayText, "displayText");
    this.insertionText = Objects.requireNonNull(insertionText, "insertionText");
    this.code = Objects.requireNonNull(code, "code");
    this.columnWidth = columnWidth;
  }

  public String getDisplayText() {
    return displayText;
  }

  public String getInsertionText() {
    return insertionText;
  }

  public KeyCode getCode() {
    return code;
  }

  public double getColumnWidth() {
    return columnWidth;
  }

  /** True for a key that shows and inserts nothing. */
  public boolean isBlank() {
    return displayText.isEmpty() && insertionText.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    final KeySpec that = (KeySpec) other;
    return displayText.equals(that.displayText) && insertionText.equals(that.insertionText)
        && code.equals(that.code) && Double.compare(columnWidth, that.columnWidth) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(displayText, insertionText, code, columnWidth);
  }

  @Override
  public String toString() {
    return "[" + displayText + "|" + insertionText + "|" + code + "|" + columnWidth + "]";
  }
}
