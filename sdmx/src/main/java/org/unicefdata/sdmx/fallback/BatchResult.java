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
import org.unicefdata.sdmx.normalize.CanonicalTable;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Outcome of fetching several indicators: a table for each indicator that
 * succeeded and an exception for each that failed, both in request order.
 */
public final class BatchResult {
  private final ImmutableMap<String, CanonicalTable> tables;
  private final ImmutableMap<String, UnicefDataException> failures;

  public BatchResult(Map<String, CanonicalTable> tables,
      Map<String, UnicefDataException> failures) {
    this.tables = ImmutableMap.copyOf(tables);
    this.failures = ImmutableMap.copyOf(failures);
  }

  public ImmutableMap<String, CanonicalTable> getTables() {
    return tables;
  }

  public ImmutableMap<String, UnicefDataException> getFailures() {
    return failures;
  }

  public @Nullable CanonicalTable getTable(String indicatorCode) {
    return tables.get(indicatorCode);
  }

  public boolean isComplete() {
    return failures.isEmpty();
  }

  @Override public String toString() {
    return "BatchResult{succeeded=" + tables.keySet() + ", failed=" + failures.keySet() + "}";
  }
}
