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

import org.unicefdata.sdmx.CancellationToken;
import org.unicefdata.sdmx.FetchCancelledException;
import org.unicefdata.sdmx.QuerySpec;
import org.unicefdata.sdmx.UnicefDataException;
import org.unicefdata.sdmx.fetch.FetchExecutor;
import org.unicefdata.sdmx.fetch.FetchOutcome;
import org.unicefdata.sdmx.fetch.FetchRequest;
import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.MetadataCache;
import org.unicefdata.sdmx.metadata.MetadataStore;
import org.unicefdata.sdmx.normalize.CanonicalTable;
import org.unicefdata.sdmx.normalize.NormalizationContext;
import org.unicefdata.sdmx.normalize.ResponseNormalizer;

import com.google.common.base.Joiner;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Walks the candidate dataflows of an indicator until one returns data.
 *
 * <p>Candidates are tried exactly once each, in resolver order, and the walk
 * never restarts. The first successful response is normalized and returned;
 * results from different dataflows are never merged. Empty, not-found and
 * transiently failing candidates are recorded and skipped. A fatal error
 * ends the walk at once, since a malformed query is malformed everywhere.
 *
 * <p>Each walk reads a single metadata snapshot, so a concurrent reload
 * cannot change the candidate list halfway through.
 */
public class FallbackController {
  private static final Logger LOGGER = LoggerFactory.getLogger(FallbackController.class);

  private final MetadataCache metadata;
  private final DataflowResolver resolver;
  private final FetchExecutor executor;
  private final ResponseNormalizer normalizer;
  private final @Nullable Duration aggregateTimeout;

  public FallbackController(MetadataCache metadata, DataflowResolver resolver,
      FetchExecutor executor, ResponseNormalizer normalizer,
      @Nullable Duration aggregateTimeout) {
    this.metadata = metadata;
    this.resolver = resolver;
    this.executor = executor;
    this.normalizer = normalizer;
    this.aggregateTimeout = aggregateTimeout;
  }

  /**
   * Fetches one indicator.
   *
   * @param indicatorCode indicator code, for example {@code CME_MRY0T4}
   * @param query countries, years, filters and schema level
   * @param token cancellation signal; the aggregate timeout is applied on top of it
   * @return normalized table from the first candidate that returned data
   * @throws NotFoundAllCandidatesException if no candidate returned data
   * @throws org.unicefdata.sdmx.fetch.FatalQueryException if the query was rejected
   * @throws FetchCancelledException if cancelled or past the aggregate deadline
   */
  public CanonicalTable fetchWithFallback(String indicatorCode, QuerySpec query,
      CancellationToken token) {
    if (indicatorCode == null || indicatorCode.trim().isEmpty()) {
      throw new IllegalArgumentException("Indicator code must not be empty");
    }
    String code = indicatorCode.trim();
    MetadataStore store = metadata.get();
    IndicatorEntry entry = store.getIndicator(code);
    if (entry != null && entry.getTier().isUnreliable()) {
      LOGGER.warn("Indicator {} is classified {}{}; the fetch is likely to return nothing",
          code, entry.getTier(),
          entry.getTierReason() == null ? "" : " (" + entry.getTierReason() + ")");
    }

    Resolution resolution = resolver.resolveWithTier(store, code, query.getPreferredDataflow());
    CancellationToken walkToken = token.withTimeout(aggregateTimeout);
    List<FallbackAttempt> attempts = new ArrayList<FallbackAttempt>();
    List<UnicefDataException> transientCauses = new ArrayList<UnicefDataException>();
    List<String> tried = new ArrayList<String>();
    FallbackState state = FallbackState.PENDING;
    LOGGER.debug("{} {}: candidates {}", code, state, resolution);

    for (String dataflow : resolution.getCandidates()) {
      state = FallbackState.TRYING_CANDIDATE;
      LOGGER.debug("{} {}: {} ({} of {})", code, state, dataflow,
          tried.size() + 1, resolution.getCandidates().size());
      try {
        walkToken.throwIfCancelled("trying dataflow " + dataflow);
      } catch (FetchCancelledException e) {
        throw cancelled(code, tried, e);
      }
      tried.add(dataflow);

      FetchOutcome outcome;
      try {
        outcome = executor.fetch(
            new FetchRequest(code, dataflow, store.getDataflowSchema(dataflow), entry, query,
                walkToken));
      } catch (FetchCancelledException e) {
        throw cancelled(code, tried, e);
      }
      attempts.add(new FallbackAttempt(dataflow, outcome.getKind(), outcome.getDetail()));

      switch (outcome.getKind()) {
        case SUCCESS:
          state = FallbackState.SUCCEEDED;
          LOGGER.info("{} {}: {} returned {} rows", code, state, dataflow,
              outcome.getRows().size());
          CanonicalTable table = normalizer.normalize(outcome.getRows(),
              new NormalizationContext(code, dataflow, query, store));
          return table.withTriedDataflows(tried);
        case FATAL_ERROR:
          LOGGER.warn("{}: fatal error from {}, not trying remaining candidates", code, dataflow);
          throw fatalCause(outcome);
        case TRANSIENT_ERROR:
          if (outcome.getCause() != null) {
            transientCauses.add(outcome.getCause());
          }
          LOGGER.info("{}: {} failed transiently, trying next candidate", code, dataflow);
          break;
        default:
          LOGGER.info("{}: {} was {}, trying next candidate", code, dataflow, outcome.getKind());
          break;
      }
    }

    state = FallbackState.EXHAUSTED_FAILED;
    LOGGER.debug("{} {}: {}", code, state, attempts);
    throw new NotFoundAllCandidatesException(code, attempts, transientCauses);
  }

  /**
   * Fetches several indicators in parallel. Each indicator's fallback walk
   * is sequential; indicators are independent of each other. Duplicate
   * codes are fetched once.
   *
   * @param pool executor running the walks; its size bounds the parallelism
   * @return tables and failures keyed by indicator code, in request order
   * @throws FetchCancelledException if interrupted while waiting
   */
  public BatchResult fetchAll(List<String> indicatorCodes, QuerySpec query,
      CancellationToken token, ExecutorService pool) {
    CancellationToken batchToken = token.withTimeout(null);
    Map<String, Future<CanonicalTable>> futures =
        new LinkedHashMap<String, Future<CanonicalTable>>();
    for (final String code : new LinkedHashSet<String>(indicatorCodes)) {
      futures.put(code, pool.submit(() -> fetchWithFallback(code, query, batchToken)));
    }

    Map<String, CanonicalTable> tables = new LinkedHashMap<String, CanonicalTable>();
    Map<String, UnicefDataException> failures = new LinkedHashMap<String, UnicefDataException>();
    for (Map.Entry<String, Future<CanonicalTable>> e : futures.entrySet()) {
      try {
        tables.put(e.getKey(), e.getValue().get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        UnicefDataException failure = cause instanceof UnicefDataException
            ? (UnicefDataException) cause
            : new UnicefDataException("Failed to fetch " + e.getKey() + ": " + cause, cause);
        LOGGER.warn("Indicator {} failed: {}", e.getKey(), failure.getMessage());
        failures.put(e.getKey(), failure);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        batchToken.cancel();
        for (Future<CanonicalTable> f : futures.values()) {
          f.cancel(true);
        }
        throw new FetchCancelledException("Interrupted while fetching " + futures.keySet(), ex);
      }
    }
    LOGGER.info("Fetched {} of {} indicators", tables.size(), futures.size());
    return new BatchResult(tables, failures);
  }

  private static UnicefDataException fatalCause(FetchOutcome outcome) {
    UnicefDataException cause = outcome.getCause();
    if (cause != null) {
      return cause;
    }
    return new UnicefDataException("Fatal error from dataflow " + outcome.getDataflowId());
  }

  private static FetchCancelledException cancelled(String code, List<String> tried,
      FetchCancelledException e) {
    String triedText = tried.isEmpty() ? "none" : Joiner.on(", ").join(tried);
    FetchCancelledException wrapped = new FetchCancelledException(
        e.getMessage() + " while fetching " + code + " (tried: " + triedText + ")",
        e.isDeadlineExceeded());
    wrapped.initCause(e);
    return wrapped;
  }
}
