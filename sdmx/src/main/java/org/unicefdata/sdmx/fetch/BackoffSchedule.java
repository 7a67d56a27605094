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

import java.time.Duration;

/**
 * Exponential backoff: the delay before retry {@code n} (1-based) is
 * {@code base * 2^(n-1)}, capped at {@code max}. With a one second base the
 * delays are 1s, 2s, 4s, ...
 */
public final class BackoffSchedule {
  private final Duration base;
  private final Duration max;

  public BackoffSchedule(Duration base, Duration max) {
    if (base.isNegative()) {
      throw new IllegalArgumentException("Backoff base must not be negative: " + base);
    }
    this.base = base;
    this.max = max.compareTo(base) < 0 ? base : max;
  }

  /**
   * Returns the delay before the given retry.
   *
   * @param retry retry number, starting at 1 for the first retry
   */
  public Duration delayBefore(int retry) {
    if (retry < 1) {
      throw new IllegalArgumentException("Retry number starts at 1, got " + retry);
    }
    // 2^62 already exceeds any sensible cap
    int shift = Math.min(retry - 1, 62);
    long factor = 1L << shift;
    long baseMillis = base.toMillis();
    if (baseMillis != 0 && factor > max.toMillis() / baseMillis) {
      return max;
    }
    Duration delay = Duration.ofMillis(baseMillis * factor);
    return delay.compareTo(max) > 0 ? max : delay;
  }

  public Duration getBase() {
    return base;
  }

  public Duration getMax() {
    return max;
  }
}
