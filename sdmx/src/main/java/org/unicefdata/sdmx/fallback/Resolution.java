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

import com.google.common.collect.ImmutableList;

/**
 * Result of resolving an indicator code: the ordered candidate dataflows and
 * the rule that produced them.
 */
public final class Resolution {
  private final String indicatorCode;
  private final ImmutableList<String> candidates;
  private final ResolutionTier tier;

  public Resolution(String indicatorCode, ImmutableList<String> candidates,
      ResolutionTier tier) {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("Candidate list must not be empty");
    }
    this.indicatorCode = indicatorCode;
    this.candidates = candidates;
    this.tier = tier;
  }

  public String getIndicatorCode() {
    return indicatorCode;
  }

  /** Dataflows to try, in order; never empty and free of duplicates. */
  public ImmutableList<String> getCandidates() {
    return candidates;
  }

  public ResolutionTier getTier() {
    return tier;
  }

  @Override public String toString() {
    return indicatorCode + " -> " + candidates + " (" + tier + ")";
  }
}
