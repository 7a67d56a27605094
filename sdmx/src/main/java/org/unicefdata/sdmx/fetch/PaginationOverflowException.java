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
package org.unicefdata.sdmx.fetch;

/**
 * Pagination did not terminate within the configured page ceiling while the
 * server still signalled more data. Returning the partial result would
 * silently truncate it, so the fetch fails instead.
 */
public class PaginationOverflowException extends FatalQueryException {
  private final int pagesFetched;
  private final long rowsFetched;

  public PaginationOverflowException(String url, int pagesFetched, long rowsFetched) {
    super("Pagination for " + url + " did not finish after " + pagesFetched
        + " pages (" + rowsFetched + " rows); raise maxPages or narrow the query",
        url, 0);
    this.pagesFetched = pagesFetched;
    this.rowsFetched = rowsFetched;
  }

  public int getPagesFetched() {
    return pagesFetched;
  }

  public long getRowsFetched() {
    return rowsFetched;
  }
}
