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

import org.unicefdata.sdmx.CancellationToken;
import org.unicefdata.sdmx.QuerySpec;
import org.unicefdata.sdmx.metadata.DataflowSchema;
import org.unicefdata.sdmx.metadata.IndicatorEntry;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One indicator against one dataflow: everything the executor needs to build
 * and send the request.
 */
public final class FetchRequest {
  private final String indicatorCode;
  private final String dataflowId;
  private final @Nullable DataflowSchema schema;
  private final @Nullable IndicatorEntry indicator;
  private final QuerySpec query;
  private final CancellationToken token;

  public FetchRequest(String indicatorCode, String dataflowId,
      @Nullable DataflowSchema schema, @Nullable IndicatorEntry indicator,
      QuerySpec query, CancellationToken token) {
    this.indicatorCode = indicatorCode;
    this.dataflowId = dataflowId;
    this.schema = schema;
    this.indicator = indicator;
    this.query = query;
    this.token = token;
  }

  public String getIndicatorCode() {
    return indicatorCode;
  }

  public String getDataflowId() {
    return dataflowId;
  }

  /** Structure of the dataflow, or null when the metadata does not describe it. */
  public @Nullable DataflowSchema getSchema() {
    return schema;
  }

  public @Nullable IndicatorEntry getIndicator() {
    return indicator;
  }

  public QuerySpec getQuery() {
    return query;
  }

  public CancellationToken getToken() {
    return token;
  }

  @Override public String toString() {
    return indicatorCode + "@" + dataflowId;
  }
}
