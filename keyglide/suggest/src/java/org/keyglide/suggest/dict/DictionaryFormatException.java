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

/** Thrown when a dictionary file has a line that cannot be parsed. */
public class DictionaryFormatException extends IOException {

  private final int lineNumber;

  public DictionaryFormatException(String message, int lineNumber) {
    super(message + " (line " + lineNumber + ")");
    this.lineNumber = lineNumber;
  }

  public DictionaryFormatException(String message, int lineNumber, Throwable cause) {
    super(message + " (line " + lineNumber + ")", cause);
    this.lineNumber = lineNumber;
  }

  /** The 1-based number of the offending line. */
  public int getLineNumber() {
    return lineNumber;
  }
}
