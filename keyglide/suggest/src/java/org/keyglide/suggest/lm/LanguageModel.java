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
package org.keyglide.suggest.lm;

/**
 * Estimates how likely a word is to be typed next.
 */
public interface LanguageModel {

  /**
   * Returns the probability of <code>word</code> given the word committed just before it.
   *
   * @param word the candidate word
   * @param previousWord the previous word, or <code>null</code>/empty when there is none
   * @return a positive number; larger means more likely
   */
  double probability(String word, String previousWord);
}
