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

import org.unicefdata.sdmx.CancellationToken;
import org.unicefdata.sdmx.FetchCancelledException;
import org.unicefdata.sdmx.SdmxClientConfig;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches indicator data over HTTP from the SDMX REST API.
 *
 * <h3>Retries</h3>
 * Timeouts, connection failures, HTTP 408, 429 and 5xx, and 2xx bodies
 * carrying markup instead of CSV are retried up to {@code maxRetries} times
 * with exponential backoff ({@link BackoffSchedule}). HTTP 400, 401, 403 and
 * other 4xx are never retried. A CSV body that does not parse is the same on
 * every attempt, so it is reported as not found without retrying.
 *
 * <h3>Pagination</h3>
 * Pages are requested with an increasing {@code startIndex}. Paging stops
 * when the rows fetched reach the total advertised in the configured
 * header, when a page is empty, when a page repeats the previous page
 * byte for byte, or, without an advertised total, when a page is shorter
 * than the page size. Hitting {@code maxPages} while more data is expected
 * is a fatal error rather than a silent truncation.
 *
 * <h3>Cancellation</h3>
 * The request's {@link CancellationToken} is checked before every attempt,
 * while waiting for a response and around each backoff sleep. The
 * per-attempt timeout never exceeds the token's remaining time.
 */
public class HttpFetchExecutor implements FetchExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpFetchExecutor.class);

  private static final long POLL_INTERVAL_MS = 50;

  private final SdmxClientConfig config;
  private final HttpClient httpClient;
  private final Sleeper sleeper;
  private final SdmxQueryBuilder queryBuilder;
  private final SdmxCsvParser parser = new SdmxCsvParser();
  private final BackoffSchedule backoff;
  private final Object rateLock = new Object();
  private long lastRequestTime;

  public HttpFetchExecutor(SdmxClientConfig config) {
    this(config,
        HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        Sleeper.SYSTEM);
  }

  public HttpFetchExecutor(SdmxClientConfig config, HttpClient httpClient, Sleeper sleeper) {
    this.config = config;
    this.httpClient = httpClient;
    this.sleeper = sleeper;
    this.queryBuilder = new SdmxQueryBuilder(config);
    this.backoff = new BackoffSchedule(config.getRetryDelay(), config.getMaxRetryDelay());
  }

  @Override public FetchOutcome fetch(FetchRequest request) {
    String dataflow = request.getDataflowId();
    try {
      return fetchPages(request);
    } catch (FatalQueryException e) {
      LOGGER.warn("Fatal error fetching {} from {}: {}",
          request.getIndicatorCode(), dataflow, e.getMessage());
      return FetchOutcome.fatalError(dataflow, e);
    } catch (TransientExhaustedException e) {
      LOGGER.warn("Giving up on {} for {}: {}",
          dataflow, request.getIndicatorCode(), e.getMessage());
      return FetchOutcome.transientError(dataflow, e);
    }
  }

  private FetchOutcome fetchPages(FetchRequest request) {
    String dataflow = request.getDataflowId();
    CancellationToken token = request.getToken();
    List<Map<String, String>> rows = new ArrayList<Map<String, String>>();
    String previousBody = null;
    long startIndex = 0;
    int page = 0;

    while (true) {
      String url = queryBuilder.buildUrl(request, startIndex);
      if (page >= config.getMaxPages()) {
        throw new PaginationOverflowException(url, page, rows.size());
      }
      LOGGER.debug("Fetching page {} of {} from {}", page + 1, request, url);
      Page current = executeWithRetry(url, token);

      if (current.status == 404) {
        if (page == 0) {
          LOGGER.info("Indicator {} not found in dataflow {} (404)",
              request.getIndicatorCode(), dataflow);
          return FetchOutcome.notFound(dataflow,
              "HTTP 404" + excerptSuffix(current.body));
        }
        LOGGER.debug("Page {} of {} returned 404; treating as end of data", page + 1, request);
        break;
      }
      if (current.malformed != null) {
        LOGGER.warn("Dataflow {} returned malformed CSV for {} on page {}: {}",
            dataflow, request.getIndicatorCode(), page + 1, current.malformed);
        return FetchOutcome.notFound(dataflow, "malformed CSV: " + current.malformed);
      }
      if (current.error != null) {
        if (page == 0) {
          LOGGER.info("Dataflow {} answered {} for {}",
              dataflow, current.error, request.getIndicatorCode());
          return current.error.isNoResults()
              ? FetchOutcome.empty(dataflow, current.error.toString())
              : FetchOutcome.notFound(dataflow, current.error.toString());
        }
        break;
      }
      if (previousBody != null && previousBody.equals(current.body)) {
        LOGGER.warn("Page {} of {} repeats the previous page; server ignores startIndex,"
            + " stopping pagination", page + 1, request);
        break;
      }
      if (current.rows.isEmpty()) {
        break;
      }

      rows.addAll(current.rows);
      page++;

      if (current.total != null) {
        if (rows.size() >= current.total) {
          break;
        }
      } else if (current.rows.size() < config.getPageSize()) {
        break;
      }
      previousBody = current.body;
      startIndex += current.rows.size();
    }

    if (rows.isEmpty()) {
      LOGGER.info("Dataflow {} returned no rows for {}", dataflow, request.getIndicatorCode());
      return FetchOutcome.empty(dataflow, "no rows");
    }
    LOGGER.info("Fetched {} rows for {} from {} in {} page(s)",
        rows.size(), request.getIndicatorCode(), dataflow, Math.max(page, 1));
    return FetchOutcome.success(dataflow, rows);
  }

  /**
   * Sends one page request, retrying transient failures.
   *
   * @return the page; status 404 and SDMX error bodies are returned, not thrown
   * @throws FatalQueryException on a non-retryable status
   * @throws TransientExhaustedException when retries run out
   */
  private Page executeWithRetry(String url, CancellationToken token) {
    int retries = 0;
    int lastStatus = 0;
    IOException lastFailure;

    while (true) {
      token.throwIfCancelled("requesting " + url);
      enforceRateLimit(token);
      try {
        HttpResponse<String> response = send(url, token);
        int status = response.statusCode();
        LOGGER.debug("GET {} -> {}", url, status);
        if (status >= 200 && status < 300) {
          return readPage(status, response);
        }
        if (status == 404) {
          return new Page(status, response.body(), Collections.<Map<String, String>>emptyList(),
              null, null, null);
        }
        if (!isRetryable(status)) {
          throw new FatalQueryException(url, status, response.body());
        }
        lastStatus = status;
        lastFailure = new IOException("HTTP " + status
            + excerptSuffix(response.body()));
      } catch (IOException e) {
        lastStatus = 0;
        lastFailure = e;
      }

      retries++;
      if (retries > config.getMaxRetries()) {
        throw new TransientExhaustedException(url, retries, lastStatus, lastFailure);
      }
      Duration delay = backoff.delayBefore(retries);
      LOGGER.warn("Request failed, retrying in {}ms (attempt {}/{}): {}",
          delay.toMillis(), retries, config.getMaxRetries(), lastFailure.getMessage());
      pause(token.cap(delay), token, "retrying " + url);
    }
  }

  private Page readPage(int status, HttpResponse<String> response) throws IOException {
    String body = response.body() == null ? "" : response.body();
    SdmxErrorMessage error = SdmxErrorMessage.parse(body);
    if (error != null) {
      return new Page(status, body, Collections.<Map<String, String>>emptyList(), null, error,
          null);
    }
    if (body.trim().startsWith("<")) {
      throw new IOException("Expected CSV but received markup" + excerptSuffix(body));
    }
    List<Map<String, String>> rows;
    try {
      rows = parser.parse(body);
    } catch (IOException e) {
      return new Page(status, body, Collections.<Map<String, String>>emptyList(), null, null,
          e.getMessage());
    }
    return new Page(status, body, rows, totalCount(response), null, null);
  }

  private @Nullable Long totalCount(HttpResponse<String> response) {
    Optional<String> header = response.headers().firstValue(config.getTotalCountHeader());
    if (!header.isPresent()) {
      return null;
    }
    try {
      return Long.parseLong(header.get().trim());
    } catch (NumberFormatException e) {
      LOGGER.warn("Ignoring non-numeric {} header '{}'",
          config.getTotalCountHeader(), header.get());
      return null;
    }
  }

  private HttpResponse<String> send(String url, CancellationToken token) throws IOException {
    Duration timeout = token.cap(config.getTimeout());
    if (timeout.isZero()) {
      token.throwIfCancelled("requesting " + url);
    }
    HttpRequest request = HttpRequest.newBuilder(URI.create(url))
        .timeout(timeout)
        .header("Accept", "text/csv")
        .header("User-Agent", config.getUserAgent())
        .GET()
        .build();
    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    while (true) {
      try {
        return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        if (token.isCancelled()) {
          future.cancel(true);
          token.throwIfCancelled("response from " + url);
        }
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
          throw (IOException) cause;
        }
        throw new IOException("Request to " + url + " failed: " + cause, cause);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        throw new FetchCancelledException("Interrupted while waiting for " + url, e);
      }
    }
  }

  private void pause(Duration delay, CancellationToken token, String what) {
    if (!delay.isZero()) {
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FetchCancelledException("Interrupted before " + what, e);
      }
    }
    token.throwIfCancelled(what);
  }

  /**
   * Spaces requests at least {@code minRequestInterval} apart across all
   * threads sharing this executor.
   */
  private void enforceRateLimit(CancellationToken token) {
    long interval = config.getMinRequestInterval().toMillis();
    if (interval <= 0) {
      return;
    }
    long waitMs;
    synchronized (rateLock) {
      long now = System.currentTimeMillis();
      long next = Math.max(now, lastRequestTime + interval);
      waitMs = next - now;
      lastRequestTime = next;
    }
    if (waitMs > 0) {
      LOGGER.debug("Rate limiting: waiting {}ms", waitMs);
      pause(Duration.ofMillis(waitMs), token, "rate-limited request");
    }
  }

  static boolean isRetryable(int status) {
    return status == 408 || status == 429 || status >= 500;
  }

  private static String excerptSuffix(@Nullable String body) {
    String excerpt = FatalQueryException.excerpt(body);
    return excerpt == null || excerpt.isEmpty() ? "" : ": " + excerpt;
  }

  /** One response page. */
  private static final class Page {
    final int status;
    final String body;
    final List<Map<String, String>> rows;
    final @Nullable Long total;
    final @Nullable SdmxErrorMessage error;
    final @Nullable String malformed;

    Page(int status, @Nullable String body, List<Map<String, String>> rows,
        @Nullable Long total, @Nullable SdmxErrorMessage error, @Nullable String malformed) {
      this.status = status;
      this.body = body == null ? "" : body;
      this.rows = rows;
      this.total = total;
      this.error = error;
      this.malformed = malformed;
    }
  }
}
