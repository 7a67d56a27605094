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

import org.unicefdata.sdmx.fallback.BatchResult;
import org.unicefdata.sdmx.fallback.DataflowResolver;
import org.unicefdata.sdmx.fallback.FallbackController;
import org.unicefdata.sdmx.fallback.Resolution;
import org.unicefdata.sdmx.fetch.FetchExecutor;
import org.unicefdata.sdmx.fetch.HttpFetchExecutor;
import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.MetadataCache;
import org.unicefdata.sdmx.metadata.MetadataStore;
import org.unicefdata.sdmx.metadata.MetadataStoreLoader;
import org.unicefdata.sdmx.normalize.CanonicalTable;
import org.unicefdata.sdmx.normalize.ResponseNormalizer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for fetching UNICEF indicators.
 *
 * <p>The client resolves an indicator code to candidate dataflows, tries them
 * in order and returns the first response as a canonical table:
 *
 * <pre>{@code
 * try (UnicefDataClient client = UnicefDataClient.create()) {
 *   CanonicalTable table = client.fetch("CME_MRY0T4",
 *       QuerySpec.builder()
 *           .countries("ALB", "USA")
 *           .years("2015:2020")
 *           .build());
 * }
 * }</pre>
 *
 * <p>A client is thread-safe. Metadata is loaded on first use and shared by
 * all queries until {@link #reloadMetadata()} or {@link #clearCache()}.
 */
public class UnicefDataClient implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(UnicefDataClient.class);

  private final SdmxClientConfig config;
  private final MetadataCache metadataCache;
  private final DataflowResolver resolver;
  private final FallbackController controller;
  private final ExecutorService pool;

  private UnicefDataClient(Builder builder) {
    this.config = builder.config;
    this.metadataCache = builder.metadataCache != null
        ? builder.metadataCache
        : new MetadataCache(
            new MetadataStoreLoader(config.getMetadataDir(), config.getUniversalDataflow(),
                config.getStaleAfter()));
    this.resolver = new DataflowResolver();
    FetchExecutor executor = builder.executor != null
        ? builder.executor
        : new HttpFetchExecutor(config);
    this.controller = new FallbackController(metadataCache, resolver, executor,
        new ResponseNormalizer(config.getPeriodConvention(), config.isDropMissing()),
        config.getAggregateTimeout());
    this.pool = Executors.newFixedThreadPool(config.getParallelism(),
        new ThreadFactoryBuilder()
            .setNameFormat("unicefdata-fetch-%d")
            .setDaemon(true)
            .build());
  }

  /** A client with the bundled defaults. */
  public static UnicefDataClient create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public SdmxClientConfig getConfig() {
    return config;
  }

  /**
   * Fetches one indicator for all countries and years.
   *
   * @see #fetch(String, QuerySpec, CancellationToken)
   */
  public CanonicalTable fetch(String indicatorCode) {
    return fetch(indicatorCode, QuerySpec.defaults());
  }

  public CanonicalTable fetch(String indicatorCode, QuerySpec query) {
    return fetch(indicatorCode, query, CancellationToken.create());
  }

  /**
   * Fetches one indicator, trying its candidate dataflows in order.
   *
   * @throws org.unicefdata.sdmx.fallback.NotFoundAllCandidatesException
   *     if no dataflow has data for the indicator
   * @throws org.unicefdata.sdmx.fetch.FatalQueryException if the query was rejected
   * @throws FetchCancelledException if {@code token} is cancelled or a deadline passes
   */
  public CanonicalTable fetch(String indicatorCode, QuerySpec query, CancellationToken token) {
    return controller.fetchWithFallback(indicatorCode, query, token);
  }

  /** Fetches several indicators in parallel. */
  public BatchResult fetchAll(List<String> indicatorCodes, QuerySpec query) {
    return fetchAll(indicatorCodes, query, CancellationToken.create());
  }

  public BatchResult fetchAll(List<String> indicatorCodes, QuerySpec query,
      CancellationToken token) {
    return controller.fetchAll(indicatorCodes, query, token, pool);
  }

  public BatchResult fetchAll(String... indicatorCodes) {
    return fetchAll(Arrays.asList(indicatorCodes), QuerySpec.defaults());
  }

  /** Candidate dataflows for an indicator, in the order they would be tried. */
  public Resolution resolveDataflows(String indicatorCode) {
    return resolver.resolveWithTier(metadataCache.get(), indicatorCode, null);
  }

  /**
   * Searches indicators by code or name.
   *
   * @param keyword case-insensitive text; null matches everything
   * @param dataflow restricts to one dataflow; may be null
   * @param includeAllTiers whether indicators without data are included
   */
  public List<IndicatorEntry> searchIndicators(@Nullable String keyword,
      @Nullable String dataflow, boolean includeAllTiers) {
    return metadataCache.get().searchIndicators(keyword, dataflow, includeAllTiers);
  }

  public List<IndicatorEntry> searchIndicators(String keyword) {
    return searchIndicators(keyword, null, false);
  }

  /** Dataflow ids known to the metadata. */
  public SortedSet<String> getDataflowIds() {
    return metadataCache.get().getDataflowIds();
  }

  /** Current metadata snapshot, loading it if necessary. */
  public MetadataStore getMetadata() {
    return metadataCache.get();
  }

  /** Loads metadata again and swaps it in for subsequent queries. */
  public MetadataStore reloadMetadata() {
    return metadataCache.reload();
  }

  /** Drops cached metadata; the next query loads it again. */
  public void clearCache() {
    metadataCache.clear();
  }

  @Override public void close() {
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Fetch threads did not stop within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for UnicefDataClient.
   */
  public static final class Builder {
    private SdmxClientConfig config = SdmxClientConfig.defaults();
    private @Nullable MetadataCache metadataCache;
    private @Nullable FetchExecutor executor;

    private Builder() {
    }

    public Builder config(SdmxClientConfig config) {
      this.config = config;
      return this;
    }

    /** Shares a metadata cache between clients. */
    public Builder metadataCache(MetadataCache metadataCache) {
      this.metadataCache = metadataCache;
      return this;
    }

    /** Replaces the HTTP executor, for example with one backed by recorded responses. */
    public Builder executor(FetchExecutor executor) {
      this.executor = executor;
      return this;
    }

    public UnicefDataClient build() {
      return new UnicefDataClient(this);
    }
  }
}
