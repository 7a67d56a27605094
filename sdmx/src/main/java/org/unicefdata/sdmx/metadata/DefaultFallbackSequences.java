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
import com.google.common.collect.ImmutableMap;

/**
 * Built-in fallback sequences, used when the fallback-sequence table cannot
 * be loaded. Every sequence ends with the universal dataflow.
 */
final class DefaultFallbackSequences {
  /** Key of the sequence used for prefixes that have no entry of their own. */
  static final String DEFAULT_KEY = "DEFAULT";

  private DefaultFallbackSequences() {
  }

  static ImmutableMap<String, ImmutableList<String>> create(String universal) {
    ImmutableMap.Builder<String, ImmutableList<String>> b = ImmutableMap.builder();
    b.put("CME", ImmutableList.of("CME", "CME_DF_2021_WQ", "MORTALITY", universal));
    b.put("COD", ImmutableList.of("CAUSE_OF_DEATH", "CME", "MORTALITY", universal));
    b.put("ED", ImmutableList.of("EDUCATION_UIS_SDG", "EDUCATION", universal));
    b.put("PT", ImmutableList.of("PT", "PT_CM", "PT_FGM", "CHILD_PROTECTION", universal));
    b.put("NT", ImmutableList.of("NUTRITION", universal));
    b.put("WS", ImmutableList.of("WASH_HOUSEHOLDS", "WASH_SCHOOLS",
        "WASH_HEALTHCARE_FACILITY", universal));
    b.put("HVA", ImmutableList.of("HIV_AIDS", universal));
    b.put("IM", ImmutableList.of("IMMUNISATION", universal));
    b.put("MNCH", ImmutableList.of("MNCH", universal));
    b.put("ECD", ImmutableList.of("ECD", universal));
    b.put("PV", ImmutableList.of("CHLD_PVTY", universal));
    b.put("DM", ImmutableList.of("DM", universal));
    b.put("MG", ImmutableList.of("MIGRATION", universal));
    b.put("FP", ImmutableList.of("FAMILY_PLANNING", universal));
    b.put("GN", ImmutableList.of("GENDER", universal));
    b.put("SPP", ImmutableList.of("SOC_PROTECTION", universal));
    b.put("WT", ImmutableList.of("PT", "CHILD_PROTECTION", universal));
    b.put("FD", ImmutableList.of("EDUCATION", "EDUCATION_FLS", universal));
    b.put("TRGT", ImmutableList.of("CHILD_RELATED_SDG", universal));
    b.put("ECON", ImmutableList.of("ECONOMIC", universal));
    b.put(DEFAULT_KEY, ImmutableList.of(universal));
    return b.build();
  }
}
