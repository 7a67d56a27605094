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

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MetadataStore} and {@link IndicatorTier}.
 */
@Tag("unit")
public class MetadataStoreTest {
  private static final MetadataStore STORE = MetadataStore.builder("GLOBAL_DATAFLOW")
      .indicator(IndicatorEntry.builder("CME_MRY0T4")
          .name("Under-five mortality rate")
          .dataflow("CME")
          .build())
      .indicator(IndicatorEntry.builder("CME_MRM0")
          .name("Neonatal mortality rate")
          .dataflow("CME")
          .build())
      .indicator(IndicatorEntry.builder("IM_DTP3")
          .name("Vaccination coverage for DTP3")
          .dataflow("IMMUNISATION")
          .build())
      .indicator(IndicatorEntry.builder("COD_MALARIA")
          .name("Deaths due to malaria")
          .tier(IndicatorTier.NO_DATA)
          .build())
      .fallbackSequence("ED", Arrays.asList("EDUCATION_UIS_SDG", "EDUCATION", "GLOBAL_DATAFLOW"))
      .syncedAt(Instant.parse("2026-01-01T00:00:00Z"))
      .build();

  private static List<String> codes(List<IndicatorEntry> entries) {
    List<String> codes = new ArrayList<String>();
    for (IndicatorEntry entry : entries) {
      codes.add(entry.getCode());
    }
    return codes;
  }

  @Test void testSearchMatchesCodeAndName() {
    assertEquals(Arrays.asList("CME_MRM0", "CME_MRY0T4"),
        codes(STORE.searchIndicators("mortality", null, false)));
    assertEquals(Arrays.asList("IM_DTP3"), codes(STORE.searchIndicators("dtp", null, false)));
  }

  @Test void testSearchByDataflow() {
    assertEquals(Arrays.asList("CME_MRM0", "CME_MRY0T4"),
        codes(STORE.searchIndicators(null, "cme", false)));
  }

  @Test void testSearchHidesIndicatorsWithoutData() {
    assertTrue(STORE.searchIndicators("malaria", null, false).isEmpty());
    assertEquals(Arrays.asList("COD_MALARIA"),
        codes(STORE.searchIndicators("malaria", null, true)));
  }

  @Test void testDataflowIdsUnionEverySource() {
    assertEquals(Arrays.asList("CME", "EDUCATION", "EDUCATION_UIS_SDG", "GLOBAL_DATAFLOW",
            "IMMUNISATION"),
        new ArrayList<String>(STORE.getDataflowIds()));
  }

  @Test void testStaleness() {
    assertFalse(STORE.isStale(Duration.ofDays(30), Instant.parse("2026-01-15T00:00:00Z")));
    assertTrue(STORE.isStale(Duration.ofDays(30), Instant.parse("2026-03-01T00:00:00Z")));
  }

  @Test void testFallbackSequenceKeysAreCaseInsensitive() {
    assertEquals(ImmutableList.of("EDUCATION_UIS_SDG", "EDUCATION", "GLOBAL_DATAFLOW"),
        STORE.getFallbackSequence("ed"));
    assertNull(STORE.getFallbackSequence("NT"));
    assertNull(STORE.getDefaultSequence());
  }

  @Test void testEmptySequenceIsIgnored() {
    MetadataStore store = MetadataStore.builder("GLOBAL_DATAFLOW")
        .fallbackSequence("PT", Arrays.asList("", " "))
        .build();
    assertNull(store.getFallbackSequence("PT"));
  }

  @Test void testDefaultsAreDegraded() {
    MetadataStore store = MetadataStore.defaults("GLOBAL_DATAFLOW");
    assertTrue(store.isDegraded());
    assertEquals(ImmutableList.of("NUTRITION", "GLOBAL_DATAFLOW"),
        store.getFallbackSequence("NT"));
  }

  @Test void testTotalsMetadata() {
    IndicatorEntry none = IndicatorEntry.builder("X").build();
    assertFalse(none.isTotalsMetadataPresent());

    IndicatorEntry some = IndicatorEntry.builder("X")
        .disaggregationsWithTotals(Arrays.asList("sex"))
        .build();
    assertTrue(some.isTotalsMetadataPresent());
    assertTrue(some.hasTotals("SEX"));
    assertFalse(some.hasTotals("WEALTH_QUINTILE"));
  }

  @Test void testTierParsing() {
    assertEquals(IndicatorTier.VERIFIED, IndicatorTier.parse(1));
    assertEquals(IndicatorTier.NO_DATA, IndicatorTier.parse("3"));
    assertEquals(IndicatorTier.ORPHAN, IndicatorTier.parse("orphan"));
    assertEquals(IndicatorTier.VERIFIED, IndicatorTier.parse(null));
    assertEquals(IndicatorTier.VERIFIED, IndicatorTier.parse("unheard-of"));
    assertTrue(IndicatorTier.NO_DATA.isUnreliable());
    assertFalse(IndicatorTier.LIMITED_OR_DEPRECATED.isUnreliable());
  }
}
