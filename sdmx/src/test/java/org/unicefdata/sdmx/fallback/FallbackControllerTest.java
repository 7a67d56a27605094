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
import org.unicefdata.sdmx.FakeTicker;
import org.unicefdata.sdmx.FetchCancelledException;
import org.unicefdata.sdmx.QuerySpec;
import org.unicefdata.sdmx.fetch.FatalQueryException;
import org.unicefdata.sdmx.fetch.FetchOutcome;
import org.unicefdata.sdmx.fetch.TransientExhaustedException;
import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.IndicatorTier;
import org.unicefdata.sdmx.metadata.MetadataCache;
import org.unicefdata.sdmx.metadata.MetadataStore;
import org.unicefdata.sdmx.normalize.CanonicalColumn;
import org.unicefdata.sdmx.normalize.CanonicalTable;
import org.unicefdata.sdmx.normalize.PeriodConvention;
import org.unicefdata.sdmx.normalize.ResponseNormalizer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FallbackController}.
 */
@Tag("unit")
public class FallbackControllerTest {
  private static final String UNIVERSAL = "GLOBAL_DATAFLOW";

  private static final MetadataStore STORE = MetadataStore.builder(UNIVERSAL)
      .indicator(IndicatorEntry.builder("CME_MRY0T4")
          .name("Under-five mortality rate")
          .dataflow("CME")
          .build())
      .indicator(IndicatorEntry.builder("COD_MALARIA")
          .tier(IndicatorTier.NO_DATA)
          .build())
      .fallbackSequence("ED", Arrays.asList("EDUCATION_UIS_SDG", "EDUCATION", UNIVERSAL))
      .fallbackSequence("DEFAULT", Arrays.asList(UNIVERSAL))
      .areaName("ALB", "Albania")
      .build();

  private final ScriptedFetchExecutor executor = new ScriptedFetchExecutor();

  private FallbackController controller() {
    return controller(null);
  }

  private FallbackController controller(Duration aggregateTimeout) {
    return new FallbackController(new MetadataCache(() -> STORE), new DataflowResolver(),
        executor, new ResponseNormalizer(PeriodConvention.MONTH_OVER_TWELVE, true),
        aggregateTimeout);
  }

  private CanonicalTable fetch(String code) {
    return controller().fetchWithFallback(code, QuerySpec.defaults(), CancellationToken.create());
  }

  @Test void testFirstSuccessfulCandidateWins() {
    executor.succeed("CME").succeed(UNIVERSAL);

    CanonicalTable table = fetch("CME_MRY0T4");

    assertEquals("CME", table.getSourceDataflow());
    assertEquals(Arrays.asList("CME"), table.getTriedDataflows());
    assertEquals(Arrays.asList("CME"), executor.getCalls());
    assertEquals(2, table.size());
    assertEquals("ALB", table.getRecords().get(0).getString(CanonicalColumn.ISO3));
    assertEquals("Albania", table.getRecords().get(0).getString(CanonicalColumn.COUNTRY));
    assertEquals("Under-five mortality rate",
        table.getRecords().get(0).getString(CanonicalColumn.INDICATOR_NAME));
  }

  @Test void testNotFoundFallsThroughToUniversal() {
    executor.succeed(UNIVERSAL);

    CanonicalTable table = fetch("CME_MRY0T4");

    assertEquals(UNIVERSAL, table.getSourceDataflow());
    assertEquals(Arrays.asList("CME", UNIVERSAL), table.getTriedDataflows());
  }

  @Test void testEmptyResultFallsThrough() {
    executor.on("EDUCATION_UIS_SDG", request -> FetchOutcome.empty("EDUCATION_UIS_SDG", "no rows"))
        .succeed("EDUCATION");

    CanonicalTable table = fetch("ED_ANAR_L02");

    assertEquals("EDUCATION", table.getSourceDataflow());
    assertEquals(Arrays.asList("EDUCATION_UIS_SDG", "EDUCATION"), executor.getCalls());
  }

  @Test void testExhaustionNamesEveryCandidate() {
    NotFoundAllCandidatesException e =
        assertThrows(NotFoundAllCandidatesException.class, () -> fetch("ED_ANAR_L02"));

    assertEquals(Arrays.asList("EDUCATION_UIS_SDG", "EDUCATION", UNIVERSAL),
        e.getTriedDataflows());
    assertEquals(executor.getCalls(), e.getTriedDataflows());
    assertFalse(e.hasTransientFailures());
    assertEquals("ED_ANAR_L02", e.getIndicatorCode());
    assertTrue(e.getMessage().startsWith(
        "Not Found (404): Indicator 'ED_ANAR_L02' not found in any dataflow."), e.getMessage());
    assertTrue(e.getMessage().contains(
        "Tried dataflows: EDUCATION_UIS_SDG, EDUCATION, GLOBAL_DATAFLOW"), e.getMessage());
    assertTrue(e.getMessage().contains("https://data.unicef.org/"));
  }

  @Test void testTransientFailuresAreReportedApartFromNotFound() {
    final TransientExhaustedException timeout = new TransientExhaustedException(
        "https://example.org/data", 4, 503, new IOException("HTTP 503"));
    executor.on("EDUCATION_UIS_SDG",
        request -> FetchOutcome.transientError("EDUCATION_UIS_SDG", timeout));

    NotFoundAllCandidatesException e =
        assertThrows(NotFoundAllCandidatesException.class, () -> fetch("ED_ANAR_L02"));

    assertTrue(e.hasTransientFailures());
    assertFalse(e.getMessage().startsWith("Not Found (404)"), e.getMessage());
    assertTrue(e.getMessage().contains("1 of 3 candidate dataflow(s) failed with transient"),
        e.getMessage());
    assertTrue(e.getMessage().contains("EDUCATION_UIS_SDG=TRANSIENT_ERROR"), e.getMessage());
    assertEquals(1, e.getSuppressed().length);
    assertSame(timeout, e.getSuppressed()[0]);
    assertEquals(3, executor.getCalls().size());
  }

  @Test void testFatalErrorStopsTheWalk() {
    final FatalQueryException rejected =
        new FatalQueryException("https://example.org/data", 400, "Invalid key");
    executor.on("CME", request -> FetchOutcome.fatalError("CME", rejected)).succeed(UNIVERSAL);

    FatalQueryException e =
        assertThrows(FatalQueryException.class, () -> fetch("CME_MRY0T4"));

    assertSame(rejected, e);
    assertEquals(Arrays.asList("CME"), executor.getCalls());
  }

  @Test void testUnknownPrefixUsesDefaultSequence() {
    executor.succeed(UNIVERSAL);

    CanonicalTable table = fetch("XYZ_NEW_INDICATOR");

    assertEquals(Arrays.asList(UNIVERSAL), executor.getCalls());
    assertEquals(UNIVERSAL, table.getSourceDataflow());
  }

  @Test void testPreferredDataflowIsTriedFirst() {
    QuerySpec query = QuerySpec.builder().preferredDataflow("cme_df_2021_wq").build();

    assertThrows(NotFoundAllCandidatesException.class, () -> {
      controller().fetchWithFallback("CME_MRY0T4", query, CancellationToken.create());
    });
    assertEquals(Arrays.asList("CME_DF_2021_WQ", "CME", UNIVERSAL), executor.getCalls());
  }

  @Test void testRequestCarriesSnapshotAndQuery() {
    executor.succeed("CME");
    QuerySpec query = QuerySpec.builder().countries("ALB").build();

    controller().fetchWithFallback("CME_MRY0T4", query, CancellationToken.create());

    assertEquals(1, executor.getRequests().size());
    assertNotNull(executor.getRequests().get(0).getIndicator());
    assertSame(query, executor.getRequests().get(0).getQuery());
  }

  @Test void testUnreliableTierIsStillFetched() {
    assertThrows(NotFoundAllCandidatesException.class, () -> fetch("COD_MALARIA"));
    assertEquals(Arrays.asList(UNIVERSAL), executor.getCalls());
  }

  @Test void testBlankCodeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> fetch("  "));
    assertTrue(executor.getCalls().isEmpty());
  }

  @Test void testAggregateDeadlineStopsTheWalk() {
    final FakeTicker ticker = new FakeTicker();
    executor.on("CME", request -> {
      ticker.advance(Duration.ofSeconds(11));
      return FetchOutcome.notFound("CME", "HTTP 404");
    }).succeed(UNIVERSAL);

    FetchCancelledException e = assertThrows(FetchCancelledException.class, () -> {
      controller(Duration.ofSeconds(10))
          .fetchWithFallback("CME_MRY0T4", QuerySpec.defaults(), CancellationToken.create(ticker));
    });

    assertTrue(e.isDeadlineExceeded());
    assertTrue(e.getMessage().contains("tried: CME"), e.getMessage());
    assertEquals(Arrays.asList("CME"), executor.getCalls());
  }

  @Test void testCancelledTokenTriesNothing() {
    CancellationToken token = CancellationToken.create();
    token.cancel();

    FetchCancelledException e = assertThrows(FetchCancelledException.class, () -> {
      controller().fetchWithFallback("CME_MRY0T4", QuerySpec.defaults(), token);
    });

    assertFalse(e.isDeadlineExceeded());
    assertTrue(executor.getCalls().isEmpty());
  }

  @Test void testRowsAreSameShapeWhicheverDataflowAnswers() {
    executor.on("CME", request -> {
      List<Map<String, String>> rows = ScriptedFetchExecutor.rows("CME_MRY0T4", "ALB");
      rows.get(0).put("WEALTH_QUINTILE", "_T");
      rows.get(0).put("UNIT_MEASURE", "D_PER_1000_B");
      return FetchOutcome.success("CME", rows);
    });
    CanonicalTable fromCme = fetch("CME_MRY0T4");

    ScriptedFetchExecutor other = new ScriptedFetchExecutor().succeed(UNIVERSAL);
    CanonicalTable fromUniversal = new FallbackController(new MetadataCache(() -> STORE),
        new DataflowResolver(), other,
        new ResponseNormalizer(PeriodConvention.MONTH_OVER_TWELVE, true), null)
        .fetchWithFallback("CME_MRY0T4", QuerySpec.defaults(), CancellationToken.create());

    assertEquals("CME", fromCme.getSourceDataflow());
    assertEquals(UNIVERSAL, fromUniversal.getSourceDataflow());
    assertEquals(fromCme.getColumnNames(), fromUniversal.getColumnNames());
    assertEquals("D_PER_1000_B", fromCme.getRecords().get(0).getString(CanonicalColumn.UNIT));
    assertNull(fromUniversal.getRecords().get(0).getString(CanonicalColumn.UNIT));
  }

  @Test void testFetchAllKeepsRequestOrderAndCollectsFailures() {
    executor.succeed("CME");
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      BatchResult result = controller().fetchAll(
          Arrays.asList("ED_ANAR_L02", "CME_MRY0T4", "ED_ANAR_L02"),
          QuerySpec.defaults(), CancellationToken.create(), pool);

      assertFalse(result.isComplete());
      assertEquals(Arrays.asList("CME_MRY0T4"),
          Arrays.asList(result.getTables().keySet().toArray()));
      assertEquals(Arrays.asList("ED_ANAR_L02"),
          Arrays.asList(result.getFailures().keySet().toArray()));
      assertTrue(result.getFailures().get("ED_ANAR_L02")
          instanceof NotFoundAllCandidatesException);
      assertEquals(2, result.getTable("CME_MRY0T4").size());
      assertEquals(4, executor.getCalls().size());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test void testFetchAllDoesNotCancelCallerToken() {
    executor.succeed("CME");
    CancellationToken token = CancellationToken.create();
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      BatchResult result = controller().fetchAll(Arrays.asList("CME_MRY0T4"),
          QuerySpec.defaults(), token, pool);
      assertTrue(result.isComplete());
      assertFalse(token.isCancelled());
    } finally {
      pool.shutdownNow();
    }
  }
}
