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

import org.unicefdata.sdmx.QuerySpec;
import org.unicefdata.sdmx.SdmxClientConfig;
import org.unicefdata.sdmx.metadata.DataflowDimension;
import org.unicefdata.sdmx.metadata.DataflowSchema;
import org.unicefdata.sdmx.metadata.IndicatorEntry;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds SDMX REST data URLs.
 *
 * <p>URL shape:
 * <pre>
 * {base}/data/{AGENCY},{DATAFLOW},{VERSION}/{KEY}?format=csv&amp;labels=id
 *     [&amp;startPeriod=YYYY][&amp;endPeriod=YYYY][&amp;startIndex=N]
 * </pre>
 *
 * <p>The key has one dot-separated segment per dimension of the dataflow, in
 * position order. {@code REF_AREA} takes the requested countries and
 * {@code INDICATOR} the indicator code; other dimensions take the caller's
 * filter codes or stay empty (all values). Multiple codes in one segment are
 * joined with {@code +}. Filters on dimensions the dataflow does not have are
 * left out of the key and applied after the fetch.
 *
 * <p>When the dataflow's structure is unknown the key is
 * {@code {countries}.{indicator}.} and every filter is applied after the
 * fetch.
 */
public class SdmxQueryBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(SdmxQueryBuilder.class);

  private static final Joiner PLUS = Joiner.on('+');
  private static final Joiner DOT = Joiner.on('.');

  static final String WASH_HCF_DATAFLOW = "WASH_HEALTHCARE_FACILITY";
  private static final String WASH_HCF_PREFIX = "WS_HCF_";
  private static final ImmutableMap<String, String> WASH_HCF_SERVICE_TYPES =
      ImmutableMap.<String, String>builder()
          .put("WM-", "HCW")
          .put("W-", "WAT")
          .put("S-", "SAN")
          .put("H-", "HYG")
          .put("C-", "CLEAN")
          .build();
  private static final ImmutableList<String> WASH_HCF_TYPES =
      ImmutableList.of("_T", "NON_HOS", "HOS", "GOV", "NON_GOV");
  private static final ImmutableList<String> WASH_HCF_RESIDENCE = ImmutableList.of("_T", "U", "R");

  private final SdmxClientConfig config;

  public SdmxQueryBuilder(SdmxClientConfig config) {
    this.config = config;
  }

  /** URL for the first page. */
  public String buildUrl(FetchRequest request) {
    return buildUrl(request, 0);
  }

  /**
   * URL for the page starting at {@code startIndex}; the parameter is
   * omitted for the first page.
   */
  public String buildUrl(FetchRequest request, long startIndex) {
    StringBuilder url = new StringBuilder();
    url.append(config.getBaseUrl())
        .append("/data/")
        .append(config.getAgency()).append(',')
        .append(request.getDataflowId()).append(',')
        .append(config.getVersion()).append('/')
        .append(buildKey(request))
        .append("?format=csv&labels=").append(encode(config.getLabels()));
    QuerySpec query = request.getQuery();
    if (query.getYears().getStart() != null) {
      url.append("&startPeriod=").append(query.getYears().getStart());
    }
    if (query.getYears().getEnd() != null) {
      url.append("&endPeriod=").append(query.getYears().getEnd());
    }
    if (startIndex > 0) {
      url.append("&startIndex=").append(startIndex);
    }
    return url.toString();
  }

  /** Builds the dot-separated series key for a request. */
  public String buildKey(FetchRequest request) {
    QuerySpec query = request.getQuery();
    String areas = PLUS.join(query.getCountries());
    DataflowSchema schema = request.getSchema();
    if (schema == null || schema.getDimensions().isEmpty()) {
      if (!query.getFilters().isEmpty()) {
        LOGGER.debug("No structure known for {}; filters {} applied after fetch",
            request.getDataflowId(), query.getFilters().keySet());
      }
      return areas + "." + encode(request.getIndicatorCode()) + ".";
    }

    boolean washHcf = isWashHealthcareFacility(request);
    List<String> segments = new ArrayList<String>();
    for (DataflowDimension dim : schema.getDimensions()) {
      String id = dim.getId();
      if (id.equals("REF_AREA")) {
        segments.add(areas);
      } else if (id.equals("INDICATOR")) {
        segments.add(encode(request.getIndicatorCode()));
      } else if (query.isConstrained(id)) {
        segments.add(joinCodes(query.getFilter(id)));
      } else if (washHcf) {
        segments.add(washHcfSegment(request.getIndicatorCode(), dim));
      } else if (query.isTotalsInKey() && supportsTotal(dim, request.getIndicator())) {
        segments.add("_T");
      } else {
        segments.add("");
      }
    }
    for (String filtered : query.getFilters().keySet()) {
      if (!schema.hasDimension(filtered)) {
        LOGGER.debug("Dataflow {} has no {} dimension; filter applied after fetch",
            request.getDataflowId(), filtered);
      }
    }
    return DOT.join(segments);
  }

  private static boolean supportsTotal(DataflowDimension dim, @Nullable IndicatorEntry entry) {
    if (dim.hasTotal()) {
      return true;
    }
    return entry != null && entry.hasTotals(dim.getId());
  }

  private static boolean isWashHealthcareFacility(FetchRequest request) {
    return WASH_HCF_DATAFLOW.equals(request.getDataflowId())
        && request.getIndicatorCode().toUpperCase(Locale.ROOT).startsWith(WASH_HCF_PREFIX);
  }

  /**
   * Healthcare-facility WASH indicators need the service type spelled out and
   * every facility type and residence listed; an empty segment there returns
   * no data.
   */
  private static String washHcfSegment(String indicatorCode, DataflowDimension dim) {
    switch (dim.getId()) {
      case "SERVICE_TYPE":
        return serviceTypeOf(indicatorCode);
      case "HCF_TYPE":
        return joinCodes(dim.getValues().isEmpty() ? WASH_HCF_TYPES : dim.getValues());
      case "RESIDENCE":
        return joinCodes(dim.getValues().isEmpty() ? WASH_HCF_RESIDENCE : dim.getValues());
      default:
        return "";
    }
  }

  static String serviceTypeOf(String indicatorCode) {
    String upper = indicatorCode.toUpperCase(Locale.ROOT);
    if (!upper.startsWith(WASH_HCF_PREFIX)) {
      return "";
    }
    String tail = upper.substring(WASH_HCF_PREFIX.length());
    for (Map.Entry<String, String> e : WASH_HCF_SERVICE_TYPES.entrySet()) {
      if (tail.startsWith(e.getKey())) {
        return e.getValue();
      }
    }
    return "";
  }

  private static String joinCodes(List<String> codes) {
    List<String> encoded = new ArrayList<String>(codes.size());
    for (String code : codes) {
      encoded.add(encode(code));
    }
    return PLUS.join(encoded);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
