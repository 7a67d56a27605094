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

import org.unicefdata.sdmx.fetch.FetchOutcome;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Record of one candidate dataflow tried during a fallback walk.
 */
public final class FallbackAttempt {
  private final String dataflowId;
  private final FetchOutcome.Kind outcome;
  private final @Nullable String detail;

  public FallbackAttempt(String dataflowId, FetchOutcome.Kind outcome, @Nullable String detail) {
    this.dataflowId = dataflowId;
    this.outcome = outcome;
    this.detail = detail;
  }

  public String getDataflowId() {
    return dataflowId;
  }

  public FetchOutcome.Kind getOutcome() {
    return outcome;
  }

  public @Nullable String getDetail() {
    return detail;
  }

  @Override public String toString() {
    return dataflowId + "=" + outcome;
  }
}
