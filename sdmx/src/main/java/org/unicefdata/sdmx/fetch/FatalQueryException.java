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

import org.unicefdata.sdmx.UnicefDataException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A request the server rejected in a way that retrying or trying another
 * dataflow cannot fix: a malformed query (400), missing credentials
 * (401/403) or another non-retryable 4xx.
 */
public class FatalQueryException extends UnicefDataException {
  private static final int MAX_BODY_EXCERPT = 500;

  private final String url;
  private final int statusCode;
  private final @Nullable String bodyExcerpt;

  public FatalQueryException(String url, int statusCode, @Nullable String body) {
    super(buildMessage(url, statusCode, excerpt(body)));
    this.url = url;
    this.statusCode = statusCode;
    this.bodyExcerpt = excerpt(body);
  }

  protected FatalQueryException(String message, String url, int statusCode) {
    super(message);
    this.url = url;
    this.statusCode = statusCode;
    this.bodyExcerpt = null;
  }

  private static String buildMessage(String url, int statusCode, @Nullable String excerpt) {
    StringBuilder sb = new StringBuilder();
    sb.append(describe(statusCode)).append(" (HTTP ").append(statusCode).append(") for ")
        .append(url);
    if (excerpt != null && !excerpt.isEmpty()) {
      sb.append(": ").append(excerpt);
    }
    return sb.toString();
  }

  private static String describe(int statusCode) {
    switch (statusCode) {
      case 400:
        return "Bad request, check the indicator code and filters";
      case 401:
        return "Authentication required";
      case 403:
        return "Access forbidden";
      default:
        return "Request rejected";
    }
  }

  static @Nullable String excerpt(@Nullable String body) {
    if (body == null) {
      return null;
    }
    String trimmed = body.trim();
    return trimmed.length() <= MAX_BODY_EXCERPT
        ? trimmed : trimmed.substring(0, MAX_BODY_EXCERPT) + "...";
  }

  public String getUrl() {
    return url;
  }

  /** HTTP status, or 0 when the failure was not an HTTP status. */
  public int getStatusCode() {
    return statusCode;
  }

  public @Nullable String getBodyExcerpt() {
    return bodyExcerpt;
  }
}
