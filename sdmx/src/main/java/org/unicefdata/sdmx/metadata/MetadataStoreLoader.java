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

import org.unicefdata.sdmx.YamlUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads a {@link MetadataStore} snapshot from the metadata YAML tables.
 *
 * <p>Tables are read from a directory when one is configured, otherwise from
 * the copy bundled on the classpath under {@value #CLASSPATH_PREFIX}. A
 * table that is missing, unreadable or malformed never fails the load: the
 * fallback-sequence table is replaced by the built-in sequences, the other
 * tables are treated as empty, and the snapshot is marked degraded.
 *
 * <h3>Tables</h3>
 * <ul>
 *   <li>{@value #INDICATORS_FILE}: indicator codes, names, dataflows, tiers
 *       and disaggregations, plus the {@code synced_at} timestamp</li>
 *   <li>{@value #FALLBACK_FILE}: prefix to ordered dataflow list</li>
 *   <li>{@value #SCHEMAS_FILE}: dimensions of each dataflow</li>
 *   <li>{@value #REGIONS_FILE} and {@value #COUNTRIES_FILE}: area names</li>
 * </ul>
 */
public class MetadataStoreLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataStoreLoader.class);

  static final String CLASSPATH_PREFIX = "/unicefdata/metadata/";
  static final String INDICATORS_FILE = "_unicefdata_indicators_metadata.yaml";
  static final String FALLBACK_FILE = "_dataflow_fallback_sequences.yaml";
  static final String SCHEMAS_FILE = "_unicefdata_dataflow_schemas.yaml";
  static final String REGIONS_FILE = "_unicefdata_regions.yaml";
  static final String COUNTRIES_FILE = "_unicefdata_countries.yaml";

  private static final Pattern OFFSET_SUFFIX = Pattern.compile("[+-]\\d{2}:?\\d{2}$");

  private final @Nullable Path metadataDir;
  private final String universalDataflow;
  private final Duration staleAfter;
  private final Clock clock;

  public MetadataStoreLoader(@Nullable Path metadataDir, String universalDataflow,
      Duration staleAfter) {
    this(metadataDir, universalDataflow, staleAfter, Clock.systemUTC());
  }

  public MetadataStoreLoader(@Nullable Path metadataDir, String universalDataflow,
      Duration staleAfter, Clock clock) {
    this.metadataDir = metadataDir;
    this.universalDataflow = universalDataflow;
    this.staleAfter = staleAfter;
    this.clock = clock;
  }

  /**
   * Builds a fresh snapshot. Never throws for missing or malformed tables.
   */
  public MetadataStore load() {
    String source = metadataDir != null ? metadataDir.toString() : "classpath:" + CLASSPATH_PREFIX;
    MetadataStore.Builder builder = MetadataStore.builder(universalDataflow).source(source);
    boolean degraded = false;

    try {
      int skipped = loadIndicators(readTable(INDICATORS_FILE), builder);
      if (skipped > 0) {
        LOGGER.warn("Skipped {} malformed indicator entries in {}", skipped, INDICATORS_FILE);
        degraded = true;
      }
    } catch (MetadataUnavailableException e) {
      LOGGER.warn("Indicator metadata unavailable, continuing without it: {}", e.getMessage());
      degraded = true;
    }

    try {
      loadFallbackSequences(readTable(FALLBACK_FILE), builder);
    } catch (MetadataUnavailableException e) {
      LOGGER.warn("Fallback sequences unavailable, using built-in sequences: {}",
          e.getMessage());
      degraded = true;
    }
    if (!builder.hasFallbackSequences()) {
      builder.fallbackSequences(DefaultFallbackSequences.create(universalDataflow));
    }

    try {
      loadSchemas(readTable(SCHEMAS_FILE), builder);
    } catch (MetadataUnavailableException e) {
      LOGGER.warn("Dataflow schemas unavailable, keys will not be positional: {}",
          e.getMessage());
      degraded = true;
    }

    try {
      loadAreas(readTable(REGIONS_FILE), "regions", builder, true);
    } catch (MetadataUnavailableException e) {
      LOGGER.warn("Region table unavailable, geo_type will be 0 for every row: {}",
          e.getMessage());
      degraded = true;
    }

    try {
      loadAreas(readTable(COUNTRIES_FILE), "countries", builder, false);
    } catch (MetadataUnavailableException e) {
      LOGGER.warn("Country table unavailable, country names will be empty: {}",
          e.getMessage());
      degraded = true;
    }

    MetadataStore store = builder.degraded(degraded).build();
    if (store.isStale(staleAfter, clock.instant())) {
      LOGGER.warn("Metadata synced at {} is older than {} days; consider refreshing it",
          store.getSyncedAt() == null ? "an unknown time" : store.getSyncedAt(),
          staleAfter.toDays());
    }
    LOGGER.info("Loaded metadata: {}", store);
    return store;
  }

  /**
   * Reads and parses one table.
   *
   * @throws MetadataUnavailableException if the table is missing, unreadable or malformed
   */
  public JsonNode readTable(String fileName) {
    try (InputStream in = open(fileName)) {
      JsonNode root = YamlUtils.parseYamlOrJson(in, fileName);
      if (root.isMissingNode() || !root.isObject()) {
        throw new MetadataUnavailableException(
            "Metadata table " + fileName + " is empty or not a mapping");
      }
      return root;
    } catch (NoSuchFileException e) {
      throw new MetadataUnavailableException("Metadata table " + fileName + " not found", e);
    } catch (IOException e) {
      throw new MetadataUnavailableException(
          "Failed to read metadata table " + fileName + ": " + e.getMessage(), e);
    }
  }

  private InputStream open(String fileName) throws IOException {
    if (metadataDir != null) {
      return Files.newInputStream(metadataDir.resolve(fileName));
    }
    InputStream in = MetadataStoreLoader.class.getResourceAsStream(CLASSPATH_PREFIX + fileName);
    if (in == null) {
      throw new NoSuchFileException(CLASSPATH_PREFIX + fileName);
    }
    return in;
  }

  /** Loads the indicator table and returns the number of entries skipped as malformed. */
  private int loadIndicators(JsonNode root, MetadataStore.Builder builder) {
    JsonNode meta = root.has("_metadata") ? root.get("_metadata") : root.path("metadata");
    JsonNode syncedAt = meta.path("synced_at");
    // unquoted YAML timestamps arrive as epoch milliseconds
    builder.syncedAt(syncedAt.isNumber()
        ? Instant.ofEpochMilli(syncedAt.asLong())
        : parseTimestamp(syncedAt.asText(null)));

    JsonNode indicators = root.path("indicators");
    if (!indicators.isObject()) {
      throw new MetadataUnavailableException(INDICATORS_FILE + " has no 'indicators' mapping");
    }
    int skipped = 0;
    Iterator<Map.Entry<String, JsonNode>> fields = indicators.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode node = field.getValue();
      String code = node.path("code").asText(field.getKey());
      try {
        IndicatorEntry.Builder entry = IndicatorEntry.builder(code)
            .name(node.path("name").asText(""))
            .tier(IndicatorTier.parse(scalar(node.get("tier"))))
            .tierReason(node.path("tier_reason").asText(null))
            .disaggregations(textList(node.get("disaggregations")))
            .disaggregationsWithTotals(textList(node.get("disaggregations_with_totals")));
        // sync files use either a 'dataflows' list or a single 'dataflow' string
        entry.dataflows(textList(node.get("dataflows")));
        entry.dataflows(textList(node.get("dataflow")));
        builder.indicator(entry.build());
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Skipping indicator entry '{}': {}", field.getKey(), e.getMessage());
        skipped++;
      }
    }
    return skipped;
  }

  private void loadFallbackSequences(JsonNode root, MetadataStore.Builder builder) {
    JsonNode sequences = root.path("fallback_sequences");
    if (!sequences.isObject()) {
      throw new MetadataUnavailableException(
          FALLBACK_FILE + " has no 'fallback_sequences' mapping");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = sequences.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      builder.fallbackSequence(field.getKey(), textList(field.getValue()));
    }
  }

  private void loadSchemas(JsonNode root, MetadataStore.Builder builder) {
    JsonNode dataflows = root.path("dataflows");
    if (!dataflows.isObject()) {
      throw new MetadataUnavailableException(SCHEMAS_FILE + " has no 'dataflows' mapping");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = dataflows.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode node = field.getValue();
      List<DataflowDimension> dimensions = new ArrayList<DataflowDimension>();
      int index = 0;
      for (JsonNode dim : node.path("dimensions")) {
        index++;
        String id = dim.path("id").asText(null);
        if (id == null) {
          LOGGER.warn("Skipping dimension without id in dataflow {}", field.getKey());
          continue;
        }
        int position = dim.path("position").asInt(index);
        dimensions.add(
            new DataflowDimension(id, position,
                ImmutableList.copyOf(textList(dim.get("values")))));
      }
      builder.dataflow(
          new DataflowSchema(field.getKey(), node.path("version").asText("1.0"), dimensions));
    }
  }

  private void loadAreas(JsonNode root, String key, MetadataStore.Builder builder,
      boolean aggregates) {
    JsonNode areas = root.path(key);
    if (!areas.isObject()) {
      throw new MetadataUnavailableException("Area table has no '" + key + "' mapping");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = areas.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      String name = value.isObject() ? value.path("name").asText("") : value.asText("");
      builder.areaName(field.getKey(), name);
      if (aggregates) {
        builder.regionCode(field.getKey());
      }
    }
  }

  private static @Nullable Object scalar(@Nullable JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    return node.isNumber() ? (Object) node.numberValue() : node.asText();
  }

  /** Reads a string or a list of strings as a list. */
  private static List<String> textList(@Nullable JsonNode node) {
    List<String> result = new ArrayList<String>();
    if (node == null || node.isNull()) {
      return result;
    }
    if (node.isArray()) {
      for (JsonNode item : node) {
        if (!item.isNull()) {
          result.add(item.asText());
        }
      }
    } else if (!node.asText().isEmpty()) {
      result.add(node.asText());
    }
    return result;
  }

  static @Nullable Instant parseTimestamp(@Nullable String text) {
    if (text == null || text.trim().isEmpty()) {
      return null;
    }
    String value = text.trim();
    try {
      if (value.length() == 10) {
        return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
      }
      if (value.endsWith("Z")) {
        return Instant.parse(value);
      }
      if (OFFSET_SUFFIX.matcher(value).find()) {
        return OffsetDateTime.parse(value).toInstant();
      }
      return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      LOGGER.warn("Unrecognised synced_at timestamp '{}': {}", value, e.getMessage());
      return null;
    }
  }
}
