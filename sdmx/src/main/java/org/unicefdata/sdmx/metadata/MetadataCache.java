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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holder for the current {@link MetadataStore} snapshot.
 *
 * <p>The snapshot is loaded lazily on first use. {@link #reload()} builds a
 * complete new snapshot before swapping it in, so a query always sees one
 * consistent snapshot and never a half-loaded one. {@link #clear()} drops the
 * snapshot; the next {@link #get()} loads again.
 */
public class MetadataCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataCache.class);

  private final Supplier<MetadataStore> loader;
  private final AtomicReference<MetadataStore> current = new AtomicReference<MetadataStore>();
  private final Object loadLock = new Object();

  public MetadataCache(MetadataStoreLoader loader) {
    this(loader::load);
  }

  public MetadataCache(Supplier<MetadataStore> loader) {
    this.loader = loader;
  }

  /** Returns the current snapshot, loading it if necessary. */
  public MetadataStore get() {
    MetadataStore store = current.get();
    if (store != null) {
      return store;
    }
    synchronized (loadLock) {
      store = current.get();
      if (store == null) {
        store = loader.get();
        current.set(store);
      }
      return store;
    }
  }

  /**
   * Loads a new snapshot and swaps it in. Queries already running keep the
   * snapshot they started with.
   */
  public MetadataStore reload() {
    synchronized (loadLock) {
      MetadataStore fresh = loader.get();
      MetadataStore previous = current.getAndSet(fresh);
      LOGGER.info("Reloaded metadata (previous: {})", previous == null ? "none" : previous);
      return fresh;
    }
  }

  /** Drops the cached snapshot. */
  public void clear() {
    current.set(null);
    LOGGER.debug("Metadata cache cleared");
  }

  /** Whether a snapshot is currently cached. */
  public boolean isLoaded() {
    return current.get() != null;
  }
}
