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
package org.unicefdata.sdmx;

import org.unicefdata.sdmx.normalize.PeriodConvention;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for {@link UnicefDataClient}.
 *
 * <p>Defaults are read from the classpath resource
 * {@value #DEFAULTS_RESOURCE}. Values can be overridden with the
 * {@link Builder} or from a map of options, for example one read from a
 * YAML or JSON configuration file:
 *
 * <pre>{@code
 * SdmxClientConfig config = SdmxClientConfig.fromMap(Map.of(
 *     "timeoutSeconds", 120,
 *     "maxRetries", 5,
 *     "periodConvention", "START_OF_MONTH"));
 * }</pre>
 */
public final class SdmxClientConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(SdmxClientConfig.class);

  /** Classpath location of the bundled defaults. */
  public static final String DEFAULTS_RESOURCE = "/unicefdata/unicefdata-defaults.yaml";

  private static final Map<String, Object> DEFAULT_VALUES = loadDefaults();

  private final String baseUrl;
  private final String agency;
  private final String version;
  private final String universalDataflow;
  private final Duration timeout;
  private final Duration connectTimeout;
  private final int maxRetries;
  private final Duration retryDelay;
  private final Duration maxRetryDelay;
  private final int pageSize;
  private final int maxPages;
  private final String totalCountHeader;
  private final String labels;
  private final @Nullable Path metadataDir;
  private final Duration staleAfter;
  private final @Nullable Duration aggregateTimeout;
  private final int parallelism;
  private final Duration minRequestInterval;
  private final boolean dropMissing;
  private final PeriodConvention periodConvention;
  private final String userAgent;

  private SdmxClientConfig(Builder builder) {
    this.baseUrl = stripTrailingSlash(builder.baseUrl);
    this.agency = builder.agency;
    this.version = builder.version;
    this.universalDataflow = builder.universalDataflow;
    this.timeout = builder.timeout;
    this.connectTimeout = builder.connectTimeout;
    this.maxRetries = builder.maxRetries;
    this.retryDelay = builder.retryDelay;
    this.maxRetryDelay = builder.maxRetryDelay;
    this.pageSize = builder.pageSize;
    this.maxPages = builder.maxPages;
    this.totalCountHeader = builder.totalCountHeader;
    this.labels = builder.labels;
    this.metadataDir = builder.metadataDir;
    this.staleAfter = builder.staleAfter;
    this.aggregateTimeout = builder.aggregateTimeout;
    this.parallelism = builder.parallelism;
    this.minRequestInterval = builder.minRequestInterval;
    this.dropMissing = builder.dropMissing;
    this.periodConvention = builder.periodConvention;
    this.userAgent = builder.userAgent;
  }

  /** Returns a configuration holding only the bundled defaults. */
  public static SdmxClientConfig defaults() {
    return builder().build();
  }

  /** Returns a builder pre-populated with the bundled defaults. */
  public static Builder builder() {
    return new Builder().apply(DEFAULT_VALUES);
  }

  /**
   * Creates a configuration from a map of options layered over the
   * bundled defaults. Unknown keys are ignored with a warning.
   */
  public static SdmxClientConfig fromMap(@Nullable Map<String, ?> map) {
    Builder builder = builder();
    if (map != null) {
      builder.apply(map);
    }
    return builder.build();
  }

  private static Map<String, Object> loadDefaults() {
    try (InputStream in = SdmxClientConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        LOGGER.warn("Defaults resource {} not found; using built-in values", DEFAULTS_RESOURCE);
        return Collections.emptyMap();
      }
      ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
      Map<String, Object> values =
          mapper.readValue(in, new TypeReference<Map<String, Object>>() { });
      return values == null ? Collections.<String, Object>emptyMap() : values;
    } catch (IOException e) {
      LOGGER.warn("Failed to read defaults resource {}: {}", DEFAULTS_RESOURCE, e.getMessage());
      return Collections.emptyMap();
    }
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getAgency() {
    return agency;
  }

  public String getVersion() {
    return version;
  }

  /** Dataflow appended to every resolved candidate list. */
  public String getUniversalDataflow() {
    return universalDataflow;
  }

  /** Per-attempt request timeout. */
  public Duration getTimeout() {
    return timeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  /** Number of retries after the first attempt of a transient failure. */
  public int getMaxRetries() {
    return maxRetries;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public Duration getMaxRetryDelay() {
    return maxRetryDelay;
  }

  public int getPageSize() {
    return pageSize;
  }

  public int getMaxPages() {
    return maxPages;
  }

  public String getTotalCountHeader() {
    return totalCountHeader;
  }

  public String getLabels() {
    return labels;
  }

  /** Directory holding the metadata YAML tables, or null for the bundled copy. */
  public @Nullable Path getMetadataDir() {
    return metadataDir;
  }

  public Duration getStaleAfter() {
    return staleAfter;
  }

  /** Upper bound for one complete fallback walk, or null for none. */
  public @Nullable Duration getAggregateTimeout() {
    return aggregateTimeout;
  }

  public int getParallelism() {
    return parallelism;
  }

  public Duration getMinRequestInterval() {
    return minRequestInterval;
  }

  public boolean isDropMissing() {
    return dropMissing;
  }

  public PeriodConvention getPeriodConvention() {
    return periodConvention;
  }

  public String getUserAgent() {
    return userAgent;
  }

  @Override public String toString() {
    return "SdmxClientConfig{baseUrl=" + baseUrl
        + ", agency=" + agency
        + ", version=" + version
        + ", timeout=" + timeout
        + ", maxRetries=" + maxRetries
        + ", pageSize=" + pageSize
        + ", metadataDir=" + metadataDir
        + "}";
  }

  /**
   * Builder for SdmxClientConfig.
   */
  public static final class Builder {
    private String baseUrl = "https://sdmx.data.unicef.org/ws/public/sdmxapi/rest";
    private String agency = "UNICEF";
    private String version = "1.0";
    private String universalDataflow = "GLOBAL_DATAFLOW";
    private Duration timeout = Duration.ofSeconds(60);
    private Duration connectTimeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    private Duration maxRetryDelay = Duration.ofSeconds(30);
    private int pageSize = 100000;
    private int maxPages = 100;
    private String totalCountHeader = "X-Total-Count";
    private String labels = "id";
    private @Nullable Path metadataDir;
    private Duration staleAfter = Duration.ofDays(30);
    private @Nullable Duration aggregateTimeout;
    private int parallelism = 4;
    private Duration minRequestInterval = Duration.ZERO;
    private boolean dropMissing = true;
    private PeriodConvention periodConvention = PeriodConvention.MONTH_OVER_TWELVE;
    private String userAgent = "unicefdata-java/1.0";

    private Builder() {
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder agency(String agency) {
      this.agency = agency;
      return this;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder universalDataflow(String universalDataflow) {
      this.universalDataflow = universalDataflow;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder maxRetryDelay(Duration maxRetryDelay) {
      this.maxRetryDelay = maxRetryDelay;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder maxPages(int maxPages) {
      this.maxPages = maxPages;
      return this;
    }

    public Builder totalCountHeader(String totalCountHeader) {
      this.totalCountHeader = totalCountHeader;
      return this;
    }

    public Builder labels(String labels) {
      this.labels = labels;
      return this;
    }

    public Builder metadataDir(@Nullable Path metadataDir) {
      this.metadataDir = metadataDir;
      return this;
    }

    public Builder staleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
      return this;
    }

    public Builder aggregateTimeout(@Nullable Duration aggregateTimeout) {
      this.aggregateTimeout = aggregateTimeout;
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public Builder minRequestInterval(Duration minRequestInterval) {
      this.minRequestInterval = minRequestInterval;
      return this;
    }

    public Builder dropMissing(boolean dropMissing) {
      this.dropMissing = dropMissing;
      return this;
    }

    public Builder periodConvention(PeriodConvention periodConvention) {
      this.periodConvention = periodConvention;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /**
     * Applies every recognised option in the map. Durations use the unit
     * named in the key ({@code timeoutSeconds}, {@code retryDelayMs},
     * {@code staleAfterDays}).
     */
    Builder apply(Map<String, ?> map) {
      for (Map.Entry<String, ?> e : map.entrySet()) {
        Object value = e.getValue();
        switch (e.getKey()) {
          case "baseUrl":
            baseUrl(requireString(e.getKey(), value));
            break;
          case "agency":
            agency(requireString(e.getKey(), value));
            break;
          case "version":
            version(requireString(e.getKey(), value));
            break;
          case "universalDataflow":
            universalDataflow(requireString(e.getKey(), value));
            break;
          case "timeoutSeconds":
            timeout(Duration.ofSeconds(requireLong(e.getKey(), value)));
            break;
          case "connectTimeoutSeconds":
            connectTimeout(Duration.ofSeconds(requireLong(e.getKey(), value)));
            break;
          case "maxRetries":
            maxRetries((int) requireLong(e.getKey(), value));
            break;
          case "retryDelayMs":
            retryDelay(Duration.ofMillis(requireLong(e.getKey(), value)));
            break;
          case "maxRetryDelayMs":
            maxRetryDelay(Duration.ofMillis(requireLong(e.getKey(), value)));
            break;
          case "pageSize":
            pageSize((int) requireLong(e.getKey(), value));
            break;
          case "maxPages":
            maxPages((int) requireLong(e.getKey(), value));
            break;
          case "totalCountHeader":
            totalCountHeader(requireString(e.getKey(), value));
            break;
          case "labels":
            labels(requireString(e.getKey(), value));
            break;
          case "metadataDir":
            metadataDir(value == null ? null : Paths.get(String.valueOf(value)));
            break;
          case "staleAfterDays":
            staleAfter(Duration.ofDays(requireLong(e.getKey(), value)));
            break;
          case "aggregateTimeoutSeconds":
            aggregateTimeout(value == null ? null
                : Duration.ofSeconds(requireLong(e.getKey(), value)));
            break;
          case "parallelism":
            parallelism((int) requireLong(e.getKey(), value));
            break;
          case "minRequestIntervalMs":
            minRequestInterval(Duration.ofMillis(requireLong(e.getKey(), value)));
            break;
          case "dropMissing":
            dropMissing(requireBoolean(e.getKey(), value));
            break;
          case "periodConvention":
            periodConvention(
                PeriodConvention.valueOf(
                    requireString(e.getKey(), value).toUpperCase(Locale.ROOT)));
            break;
          case "userAgent":
            userAgent(requireString(e.getKey(), value));
            break;
          default:
            LOGGER.warn("Ignoring unknown configuration option '{}'", e.getKey());
        }
      }
      return this;
    }

    private static String requireString(String key, @Nullable Object value) {
      if (value == null) {
        throw new IllegalArgumentException("Option '" + key + "' must not be null");
      }
      return String.valueOf(value);
    }

    private static long requireLong(String key, @Nullable Object value) {
      if (value instanceof Number) {
        return ((Number) value).longValue();
      }
      if (value instanceof String) {
        try {
          return Long.parseLong(((String) value).trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "Option '" + key + "' must be a number, got '" + value + "'", e);
        }
      }
      throw new IllegalArgumentException("Option '" + key + "' must be a number, got " + value);
    }

    private static boolean requireBoolean(String key, @Nullable Object value) {
      if (value instanceof Boolean) {
        return (Boolean) value;
      }
      if (value instanceof String) {
        return Boolean.parseBoolean(((String) value).trim());
      }
      throw new IllegalArgumentException("Option '" + key + "' must be a boolean, got " + value);
    }

    public SdmxClientConfig build() {
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalArgumentException("baseUrl must not be empty");
      }
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
      }
      if (pageSize <= 0) {
        throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
      }
      if (maxPages <= 0) {
        throw new IllegalArgumentException("maxPages must be positive, got " + maxPages);
      }
      if (parallelism <= 0) {
        throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
      }
      if (timeout.isNegative() || timeout.isZero()) {
        throw new IllegalArgumentException("timeout must be positive, got " + timeout);
      }
      return new SdmxClientConfig(this);
    }
  }
}
