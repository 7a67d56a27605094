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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MetadataCache}.
 */
@Tag("unit")
public class MetadataCacheTest {
  private final AtomicInteger loads = new AtomicInteger();

  private final MetadataCache cache = new MetadataCache(() -> {
    loads.incrementAndGet();
    return MetadataStore.defaults("GLOBAL_DATAFLOW");
  });

  @Test void testLoadsLazilyAndOnce() {
    assertFalse(cache.isLoaded());
    assertEquals(0, loads.get());

    MetadataStore first = cache.get();
    MetadataStore second = cache.get();

    assertSame(first, second);
    assertTrue(cache.isLoaded());
    assertEquals(1, loads.get());
  }

  @Test void testReloadSwapsSnapshot() {
    MetadataStore before = cache.get();
    MetadataStore reloaded = cache.reload();

    assertNotSame(before, reloaded);
    assertSame(reloaded, cache.get());
    assertEquals(2, loads.get());
  }

  @Test void testClearForcesNextLoad() {
    cache.get();
    cache.clear();
    assertFalse(cache.isLoaded());

    cache.get();
    assertEquals(2, loads.get());
  }
}
