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
package org.unicefdata.sdmx.fallback;

import org.unicefdata.sdmx.UnicefDataException;
import org.unicefdata.sdmx.fetch.FetchOutcome;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * No candidate dataflow produced data for an indicator.
 *
 * <p>The exception lists every dataflow tried, in order, and the outcome of
 * each. When some candidates failed transiently, the message says so and the
 * underlying failures are attached as suppressed exceptions: "not found" and
 * "the service was unavailable" call for different reactions.
 */
public class NotFoundAllCandidatesException extends UnicefDataException {
  static final String BROWSE_URL = "https://data.unicef.org/";

  private final String indicatorCode;
  private final ImmutableList<FallbackAttempt> attempts;

  public NotFoundAllCandidatesException(String indicatorCode, List<FallbackAttempt> attempts,
      List<? extends Throwable> transientCauses) {
    super(buildMessage(indicatorCode, attempts));
    this.indicatorCode = indicatorCode;
    this.attempts = ImmutableList.copyOf(attempts);
    for (Throwable cause : transientCauses) {
      addSuppressed(cause);
    }
  }

  private static String buildMessage(String indicatorCode, List<FallbackAttempt> attempts) {
    int transientCount = 0;
    for (FallbackAttempt attempt : attempts) {
      if (attempt.getOutcome() == FetchOutcome.Kind.TRANSIENT_ERROR) {
        transientCount++;
      }
    }
    StringBuilder sb = new StringBuilder();
    if (transientCount == 0) {
      sb.append("Not Found (404): Indicator '").append(indicatorCode)
          .append("' not found in any dataflow.\n")
          .append("  Tried dataflows: ").append(Joiner.on(", ").join(dataflowIds(attempts)));
    } else {
      sb.append("Indicator '").append(indicatorCode).append("' could not be fetched: ")
          .append(transientCount).append(" of ").append(attempts.size())
          .append(" candidate dataflow(s) failed with transient errors"
              + " (timeouts, rate limiting or server errors); retry later.\n")
          .append("  Tried dataflows: ").append(Joiner.on(", ").join(attempts));
    }
    sb.append("\n  Browse available indicators at: ").append(BROWSE_URL);
    return sb.toString();
  }

  private static List<String> dataflowIds(List<FallbackAttempt> attempts) {
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (FallbackAttempt attempt : attempts) {
      ids.add(attempt.getDataflowId());
    }
    return ids.build();
  }

  public String getIndicatorCode() {
    return indicatorCode;
  }

  /** Every dataflow tried, in the order tried. */
  public List<String> getTriedDataflows() {
    return dataflowIds(attempts);
  }

  public ImmutableList<FallbackAttempt> getAttempts() {
    return attempts;
  }

  /** Whether at least one candidate failed transiently rather than lacking data. */
  public boolean hasTransientFailures() {
    for (FallbackAttempt attempt : attempts) {
      if (attempt.getOutcome() == FetchOutcome.Kind.TRANSIENT_ERROR) {
        return true;
      }
    }
    return false;
  }
}
