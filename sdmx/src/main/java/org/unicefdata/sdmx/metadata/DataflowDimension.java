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

/**
 * One dimension of a dataflow's key, with its position and known codes.
 */
public final class DataflowDimension {
  private final String id;
  private final int position;
  private final ImmutableList<String> values;

  public DataflowDimension(String id, int position, ImmutableList<String> values) {
    this.id = id;
    this.position = position;
    this.values = values;
  }

  public String getId() {
    return id;
  }

  /** One-based position of the dimension in the series key. */
  public int getPosition() {
    return position;
  }

  /** Codes observed for this dimension; empty when the sync did not record them. */
  public ImmutableList<String> getValues() {
    return values;
  }

  /** Whether the codelist contains the {@code _T} total. */
  public boolean hasTotal() {
    return values.contains("_T");
  }

  @Override public String toString() {
    return id + "@" + position;
  }
}
