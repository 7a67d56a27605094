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

/**
 * A transient failure (timeout, connection error, 429 or 5xx) that was still
 * failing after every retry.
 */
public class TransientExhaustedException extends UnicefDataException {
  private final String url;
  private final int attempts;
  private final int lastStatusCode;

  public TransientExhaustedException(String url, int attempts, int lastStatusCode,
      Throwable cause) {
    super("Request to " + url + " failed after " + attempts + " attempt(s)"
        + (lastStatusCode > 0 ? " (last status " + lastStatusCode + ")" : "")
        + ": " + cause.getMessage(), cause);
    this.url = url;
    this.attempts = attempts;
    this.lastStatusCode = lastStatusCode;
  }

  public String getUrl() {
    return url;
  }

  /** Total number of attempts made, including the first. */
  public int getAttempts() {
    return attempts;
  }

  /** Status of the last response, or 0 if no response was received. */
  public int getLastStatusCode() {
    return lastStatusCode;
  }
}
