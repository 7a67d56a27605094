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

import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.MetadataStore;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link DataflowResolver}.
 */
@Tag("unit")
public class DataflowResolverTest {
  private static final String UNIVERSAL = "GLOBAL_DATAFLOW";

  private final DataflowResolver resolver = new DataflowResolver();

  private static MetadataStore.Builder store() {
    return MetadataStore.builder(UNIVERSAL)
        .indicator(IndicatorEntry.builder("CME_MRY0T4").dataflow("CME").build())
        .indicator(IndicatorEntry.builder("PT_F_20-24_MRD_U18_TND")
            .dataflows(Arrays.asList("PT", "PT_CM", UNIVERSAL))
            .build())
        .indicator(IndicatorEntry.builder("ED_ORPHAN").build())
        .fallbackSequence("CME", Arrays.asList("CME", "CME_DF_2021_WQ", UNIVERSAL))
        .fallbackSequence("ED", Arrays.asList("EDUCATION_UIS_SDG", "EDUCATION", UNIVERSAL))
        .fallbackSequence("XYZ", Arrays.asList("FOO", "BAR"))
        .fallbackSequence("DEFAULT", Arrays.asList(UNIVERSAL));
  }

  @Test void testDirectMappingAppendsUniversal() {
    Resolution resolution = resolver.resolveWithTier(store().build(), "CME_MRY0T4", null);
    assertEquals(ImmutableList.of("CME", UNIVERSAL), resolution.getCandidates());
    assertEquals(ResolutionTier.DIRECT, resolution.getTier());
  }

  @Test void testDirectMappingDoesNotRepeatUniversal() {
    assertEquals(ImmutableList.of("PT", "PT_CM", UNIVERSAL),
        resolver.resolve(store().build(), "PT_F_20-24_MRD_U18_TND"));
  }

  @Test void testPrefixSequenceIsUsedExactly() {
    Resolution resolution = resolver.resolveWithTier(store().build(), "XYZ_NEW", null);
    assertEquals(ImmutableList.of("FOO", "BAR"), resolution.getCandidates());
    assertEquals(ResolutionTier.PREFIX, resolution.getTier());
  }

  @Test void testEntryWithoutDataflowsFallsBackToPrefix() {
    assertEquals(ImmutableList.of("EDUCATION_UIS_SDG", "EDUCATION", UNIVERSAL),
        resolver.resolve(store().build(), "ED_ORPHAN"));
  }

  @Test void testUnknownPrefixUsesDefaultSequence() {
    Resolution resolution = resolver.resolveWithTier(store().build(), "QQQ_UNKNOWN", null);
    assertEquals(ImmutableList.of(UNIVERSAL), resolution.getCandidates());
    assertEquals(ResolutionTier.UNIVERSAL, resolution.getTier());
  }

  @Test void testNoSequencesAtAllStillYieldsUniversal() {
    MetadataStore empty = MetadataStore.builder(UNIVERSAL).build();
    assertEquals(ImmutableList.of(UNIVERSAL), resolver.resolve(empty, "ANYTHING"));
  }

  @Test void testPreferredDataflowGoesFirst() {
    Resolution resolution =
        resolver.resolveWithTier(store().build(), "CME_MRY0T4", "CME_DF_2021_WQ");
    assertEquals(ImmutableList.of("CME_DF_2021_WQ", "CME", UNIVERSAL),
        resolution.getCandidates());

    Resolution already = resolver.resolveWithTier(store().build(), "CME_MRY0T4", UNIVERSAL);
    assertEquals(ImmutableList.of(UNIVERSAL, "CME"), already.getCandidates());
  }

  @Test void testResolutionIsDeterministic() {
    MetadataStore snapshot = store().build();
    assertEquals(resolver.resolve(snapshot, "ED_ANAR_L02"),
        resolver.resolve(snapshot, "ED_ANAR_L02"));
  }

  @Test void testPrefixOf() {
    assertEquals("CME", DataflowResolver.prefixOf("CME_MRY0T4"));
    assertEquals("WS", DataflowResolver.prefixOf("WS_HCF_W-B"));
    assertEquals("NT", DataflowResolver.prefixOf("NT01"));
    assertEquals("ED", DataflowResolver.prefixOf("ed_anar_l02"));
    assertEquals("", DataflowResolver.prefixOf("2020"));
  }
}
