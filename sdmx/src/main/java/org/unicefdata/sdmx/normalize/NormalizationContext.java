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
package org.unicefdata.sdmx.normalize;

import org.unicefdata.sdmx.QuerySpec;
import org.unicefdata.sdmx.metadata.DataflowSchema;
import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.MetadataStore;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything the normalizer needs besides the raw rows.
 */
public final class NormalizationContext {
  private final String indicatorCode;
  private final String dataflowId;
  private final QuerySpec query;
  private final MetadataStore metadata;

  public NormalizationContext(String indicatorCode, String dataflowId, QuerySpec query,
      MetadataStore metadata) {
    this.indicatorCode = indicatorCode;
    this.dataflowId = dataflowId;
    this.query = query;
    this.metadata = metadata;
  }

  public String getIndicatorCode() {
    return indicatorCode;
  }

  public String getDataflowId() {
    return dataflowId;
  }

  public QuerySpec getQuery() {
    return query;
  }

  public MetadataStore getMetadata() {
    return metadata;
  }

  public @Nullable IndicatorEntry getIndicator() {
    return metadata.getIndicator(indicatorCode);
  }

  public @Nullable DataflowSchema getSchema() {
    return metadata.getDataflowSchema(dataflowId);
  }
}
