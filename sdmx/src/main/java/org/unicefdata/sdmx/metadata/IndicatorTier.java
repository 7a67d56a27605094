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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * Data-availability tier of an indicator, as recorded by the metadata sync.
 */
public enum IndicatorTier {
  /** Verified to return data from at least one dataflow. */
  VERIFIED(1),
  /** Limited coverage or deprecated; may still return data. */
  LIMITED_OR_DEPRECATED(2),
  /** Defined in the codelist but no data was found. */
  NO_DATA(3),
  /** Not mapped to any dataflow. */
  ORPHAN(4);

  private final int level;

  IndicatorTier(int level) {
    this.level = level;
  }

  public int getLevel() {
    return level;
  }

  /** Whether fetching this indicator is expected to fail. */
  public boolean isUnreliable() {
    return this == NO_DATA || this == ORPHAN;
  }

  /**
   * Parses a tier from its numeric level or its name. Unknown or missing
   * values are treated as {@link #VERIFIED}.
   */
  public static IndicatorTier parse(@Nullable Object value) {
    if (value instanceof Number) {
      return fromLevel(((Number) value).intValue());
    }
    if (value == null) {
      return VERIFIED;
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return VERIFIED;
    }
    try {
      return fromLevel(Integer.parseInt(text));
    } catch (NumberFormatException e) {
      try {
        return valueOf(text.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e2) {
        return VERIFIED;
      }
    }
  }

  private static IndicatorTier fromLevel(int level) {
    for (IndicatorTier tier : values()) {
      if (tier.level == level) {
        return tier;
      }
    }
    return VERIFIED;
  }
}
