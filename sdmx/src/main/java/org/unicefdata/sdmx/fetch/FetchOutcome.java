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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Classified result of fetching one indicator from one dataflow.
 *
 * <p>Exactly one {@link Kind} applies. Only {@link Kind#SUCCESS} carries rows;
 * only the two error kinds carry a cause.
 */
public final class FetchOutcome {

  /** Classification of a fetch result. */
  public enum Kind {
    /** The dataflow returned at least one row. */
    SUCCESS,
    /** The dataflow answered but holds no rows for the query. */
    EMPTY,
    /** The dataflow does not know the indicator. */
    NOT_FOUND,
    /** Retries were exhausted on timeouts, connection errors, 429 or 5xx. */
    TRANSIENT_ERROR,
    /** The query was rejected; no other dataflow will accept it either. */
    FATAL_ERROR
  }

  private final Kind kind;
  private final String dataflowId;
  private final ImmutableList<Map<String, String>> rows;
  private final @Nullable UnicefDataException cause;
  private final @Nullable String detail;

  private FetchOutcome(Kind kind, String dataflowId, ImmutableList<Map<String, String>> rows,
      @Nullable UnicefDataException cause, @Nullable String detail) {
    this.kind = kind;
    this.dataflowId = dataflowId;
    this.rows = rows;
    this.cause = cause;
    this.detail = detail;
  }

  public static FetchOutcome success(String dataflowId, List<Map<String, String>> rows) {
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("A successful outcome needs at least one row");
    }
    return new FetchOutcome(Kind.SUCCESS, dataflowId, ImmutableList.copyOf(rows), null, null);
  }

  public static FetchOutcome empty(String dataflowId, @Nullable String detail) {
    return new FetchOutcome(Kind.EMPTY, dataflowId, ImmutableList.<Map<String, String>>of(),
        null, detail);
  }

  public static FetchOutcome notFound(String dataflowId, @Nullable String detail) {
    return new FetchOutcome(Kind.NOT_FOUND, dataflowId,
        ImmutableList.<Map<String, String>>of(), null, detail);
  }

  public static FetchOutcome transientError(String dataflowId, UnicefDataException cause) {
    return new FetchOutcome(Kind.TRANSIENT_ERROR, dataflowId,
        ImmutableList.<Map<String, String>>of(), cause, cause.getMessage());
  }

  public static FetchOutcome fatalError(String dataflowId, UnicefDataException cause) {
    return new FetchOutcome(Kind.FATAL_ERROR, dataflowId,
        ImmutableList.<Map<String, String>>of(), cause, cause.getMessage());
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }

  public String getDataflowId() {
    return dataflowId;
  }

  /** Raw rows keyed by CSV header, in response order. Empty unless successful. */
  public ImmutableList<Map<String, String>> getRows() {
    return rows;
  }

  public @Nullable UnicefDataException getCause() {
    return cause;
  }

  /** Short human-readable explanation, or null. */
  public @Nullable String getDetail() {
    return detail;
  }

  @Override public String toString() {
    return kind + "[" + dataflowId
        + (kind == Kind.SUCCESS ? ", rows=" + rows.size() : "")
        + (detail == null ? "" : ", " + detail)
        + "]";
  }
}
