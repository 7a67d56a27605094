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

/**
 * How a monthly period such as {@code 2020-06} becomes a decimal year.
 */
public enum PeriodConvention {
  /**
   * {@code year + month / 12}: {@code 2020-06} is 2020.5 and {@code 2020-12}
   * is 2021.0. This is the default.
   */
  MONTH_OVER_TWELVE,

  /**
   * {@code year + (month - 1) / 12}, the start of the month:
   * {@code 2020-01} is 2020.0 and {@code 2020-06} is 2020.4166...
   */
  START_OF_MONTH;

  double toDecimal(int year, int month) {
    switch (this) {
      case START_OF_MONTH:
        return year + (month - 1) / 12.0;
      case MONTH_OVER_TWELVE:
      default:
        return year + month / 12.0;
    }
  }
}
