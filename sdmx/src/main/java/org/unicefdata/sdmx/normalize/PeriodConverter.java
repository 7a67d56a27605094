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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts SDMX time periods to decimal years.
 *
 * <p>Accepted forms: {@code YYYY}, {@code YYYY-MM}, {@code YYYY-MM-DD}
 * (only the month is used), {@code YYYY-Qn} (first month of the quarter)
 * and plain decimals such as {@code 2020.5}. Anything else converts to
 * null.
 */
public class PeriodConverter {
  private static final Pattern YEAR = Pattern.compile("(\\d{4})");
  private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})-(\\d{1,2})(?:-\\d{1,2})?");
  private static final Pattern YEAR_QUARTER = Pattern.compile("(\\d{4})-Q([1-4])");
  private static final Pattern DECIMAL = Pattern.compile("\\d{4}\\.\\d+");
  private static final Pattern LEADING_YEAR = Pattern.compile("^(\\d{4})(?:$|[-.])");

  private final PeriodConvention convention;

  public PeriodConverter(PeriodConvention convention) {
    this.convention = convention;
  }

  public PeriodConvention getConvention() {
    return convention;
  }

  /** Returns the decimal year for a period, or null if it cannot be parsed. */
  public @Nullable Double toDecimalYear(@Nullable String period) {
    if (period == null) {
      return null;
    }
    String text = period.trim();
    if (text.isEmpty()) {
      return null;
    }
    if (YEAR.matcher(text).matches()) {
      return (double) Integer.parseInt(text);
    }
    Matcher m = YEAR_MONTH.matcher(text);
    if (m.matches()) {
      int month = Integer.parseInt(m.group(2));
      if (month < 1 || month > 12) {
        return null;
      }
      return convention.toDecimal(Integer.parseInt(m.group(1)), month);
    }
    m = YEAR_QUARTER.matcher(text);
    if (m.matches()) {
      int firstMonth = (Integer.parseInt(m.group(2)) - 1) * 3 + 1;
      return convention.toDecimal(Integer.parseInt(m.group(1)), firstMonth);
    }
    if (DECIMAL.matcher(text).matches()) {
      return Double.parseDouble(text);
    }
    return null;
  }

  /**
   * Returns the calendar year a period falls in, read from its leading
   * four digits, or null if there are none.
   */
  public static @Nullable Integer yearOf(@Nullable String period) {
    if (period == null) {
      return null;
    }
    Matcher m = LEADING_YEAR.matcher(period.trim());
    return m.find() ? Integer.valueOf(m.group(1)) : null;
  }
}
