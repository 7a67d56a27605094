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
package org.unicefdata.sdmx.metadata;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Structure of one dataflow: its key dimensions in position order.
 */
public final class DataflowSchema {
  private final String id;
  private final String version;
  private final ImmutableList<DataflowDimension> dimensions;

  public DataflowSchema(String id, String version, List<DataflowDimension> dimensions) {
    this.id = id;
    this.version = version;
    List<DataflowDimension> sorted = new ArrayList<DataflowDimension>(dimensions);
    sorted.sort(Comparator.comparingInt(DataflowDimension::getPosition));
    this.dimensions = ImmutableList.copyOf(sorted);
  }

  public String getId() {
    return id;
  }

  public String getVersion() {
    return version;
  }

  /** Key dimensions ordered by position. */
  public ImmutableList<DataflowDimension> getDimensions() {
    return dimensions;
  }

  public @Nullable DataflowDimension getDimension(String dimensionId) {
    for (DataflowDimension d : dimensions) {
      if (d.getId().equals(dimensionId)) {
        return d;
      }
    }
    return null;
  }

  public boolean hasDimension(String dimensionId) {
    return getDimension(dimensionId) != null;
  }

  @Override public String toString() {
    return "DataflowSchema{" + id + " " + dimensions + "}";
  }
}
