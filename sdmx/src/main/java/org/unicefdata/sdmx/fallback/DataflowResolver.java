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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Maps an indicator code to the ordered list of dataflows to try.
 *
 * <p>Resolution is a pure function of the code and the metadata snapshot;
 * it performs no I/O and always returns a non-empty list. The first rule
 * that applies wins:
 *
 * <ol>
 *   <li><b>Direct</b>: the indicator's own dataflows, in stored order, with
 *       the universal dataflow appended if it is not already listed;</li>
 *   <li><b>Prefix</b>: the stored sequence for the code's prefix, exactly
 *       as stored;</li>
 *   <li><b>Universal</b>: the {@code DEFAULT} sequence, or the universal
 *       dataflow alone.</li>
 * </ol>
 *
 * <p>The prefix is the text before the first underscore, or the leading
 * run of letters for a code without one ({@code "CME"} for
 * {@code "CME_MRY0T4"}, {@code "NT"} for {@code "NT01"}).
 */
public class DataflowResolver {

  /** Resolves {@code indicatorCode} to its candidate dataflows. */
  public ImmutableList<String> resolve(MetadataStore store, String indicatorCode) {
    return resolveWithTier(store, indicatorCode, null).getCandidates();
  }

  /**
   * Resolves {@code indicatorCode}, placing {@code preferredDataflow} first
   * when it is given.
   */
  public Resolution resolveWithTier(MetadataStore store, String indicatorCode,
      @Nullable String preferredDataflow) {
    Resolution base = resolveBase(store, indicatorCode);
    if (preferredDataflow == null || preferredDataflow.isEmpty()) {
      return base;
    }
    LinkedHashSet<String> ordered = new LinkedHashSet<String>();
    ordered.add(preferredDataflow);
    ordered.addAll(base.getCandidates());
    return new Resolution(indicatorCode, ImmutableList.copyOf(ordered), base.getTier());
  }

  private Resolution resolveBase(MetadataStore store, String indicatorCode) {
    String universal = store.getUniversalDataflow();

    IndicatorEntry entry = store.getIndicator(indicatorCode);
    if (entry != null && !entry.getDirectDataflows().isEmpty()) {
      LinkedHashSet<String> ordered = new LinkedHashSet<String>(entry.getDirectDataflows());
      ordered.add(universal);
      return new Resolution(indicatorCode, ImmutableList.copyOf(ordered),
          ResolutionTier.DIRECT);
    }

    String prefix = prefixOf(indicatorCode);
    if (!prefix.isEmpty()) {
      List<String> sequence = store.getFallbackSequence(prefix);
      if (sequence != null && !sequence.isEmpty()) {
        return new Resolution(indicatorCode, ImmutableList.copyOf(sequence),
            ResolutionTier.PREFIX);
      }
    }

    List<String> fallback = store.getDefaultSequence();
    if (fallback == null || fallback.isEmpty()) {
      return new Resolution(indicatorCode, ImmutableList.of(universal),
          ResolutionTier.UNIVERSAL);
    }
    return new Resolution(indicatorCode, ImmutableList.copyOf(fallback),
        ResolutionTier.UNIVERSAL);
  }

  /**
   * Returns the upper-cased prefix of an indicator code, or an empty string
   * if the code has none.
   */
  public static String prefixOf(String indicatorCode) {
    String code = indicatorCode.trim();
    int underscore = code.indexOf('_');
    if (underscore >= 0) {
      return code.substring(0, underscore).toUpperCase(Locale.ROOT);
    }
    int end = 0;
    while (end < code.length() && Character.isLetter(code.charAt(end))) {
      end++;
    }
    return code.substring(0, end).toUpperCase(Locale.ROOT);
  }
}
