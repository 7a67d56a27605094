/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.unicefdata.sdmx.fetch;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SDMX-ML error message embedded in a response body.
 *
 * <p>Some endpoints answer a query that matches nothing with an XML error
 * document instead of an HTTP error status. Code 100 ("No results found")
 * means the dataflow exists but holds no data for the query; other codes
 * mean the query does not apply to the dataflow.
 */
final class SdmxErrorMessage {
  static final int NO_RESULTS = 100;

  private static final Pattern CODE =
      Pattern.compile("ErrorMessage[^>]*\\bcode=\"(\\d+)\"");
  private static final Pattern TEXT =
      Pattern.compile("<(?:\\w+:)?Text[^>]*>([^<]*)</(?:\\w+:)?Text>");

  private final int code;
  private final String text;

  private SdmxErrorMessage(int code, String text) {
    this.code = code;
    this.text = text;
  }

  /** Extracts the error message, or returns null if the body is not one. */
  static @Nullable SdmxErrorMessage parse(@Nullable String body) {
    if (body == null) {
      return null;
    }
    String head = body.trim();
    if (!head.startsWith("<")) {
      return null;
    }
    Matcher codeMatcher = CODE.matcher(head);
    if (!codeMatcher.find()) {
      return null;
    }
    Matcher textMatcher = TEXT.matcher(head);
    String text = textMatcher.find() ? textMatcher.group(1).trim() : "";
    return new SdmxErrorMessage(Integer.parseInt(codeMatcher.group(1)), text);
  }

  int getCode() {
    return code;
  }

  String getText() {
    return text;
  }

  boolean isNoResults() {
    return code == NO_RESULTS;
  }

  @Override public String toString() {
    return "SDMX error " + code + (text.isEmpty() ? "" : ": " + text);
  }
}
