package com.flamingo.ai.corpusprep.service.source;

import com.flamingo.ai.corpusprep.config.CorpusConfig;
import com.flamingo.ai.corpusprep.exception.NetworkFetchException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

/**
 * Fetches remote sources over HTTP(S).
 *
 * <p>Each request is bounded by {@code corpus.fetch.timeout-ms}. Connection failures, timeouts,
 * {@code 429} and {@code 5xx} responses are retried with exponential backoff up to {@code
 * corpus.fetch.max-attempts} attempts in total; other {@code 4xx} responses, and bodies larger than
 * {@code corpus.fetch.max-response-bytes}, fail at once. When the fetch is abandoned a {@link
 * NetworkFetchException} is thrown and nothing is emitted for the source.
 */
@Component
@Slf4j
public class UrlFetcher {

  private final WebClient webClient;
  private final Retry retry;
  private final Duration timeout;
  private final int maxAttempts;

  public UrlFetcher(CorpusConfig corpusConfig) {
    CorpusConfig.Fetch fetch = corpusConfig.getFetch();
    this.timeout = Duration.ofMillis(fetch.getTimeoutMs());
    this.maxAttempts = fetch.getMaxAttempts();
    HttpClient httpClient = HttpClient.create().followRedirect(true).responseTimeout(timeout);
    this.webClient =
        WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, fetch.getUserAgent())
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(fetch.getMaxResponseBytes()))
            .build();
    this.retry =
        Retry.of(
            "url-fetch",
            RetryConfig.custom()
                .maxAttempts(fetch.getMaxAttempts())
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(fetch.getInitialBackoffMs()),
                        fetch.getBackoffMultiplier()))
                .retryOnException(UrlFetcher::isRetryable)
                .build());
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Fetch attempt {} failed ({}); retrying in {} ms",
                    event.getNumberOfRetryAttempts(),
                    describe(event.getLastThrowable()),
                    event.getWaitInterval().toMillis()));
    log.debug(
        "URL fetcher initialized: timeout={}ms, maxAttempts={}", fetch.getTimeoutMs(), maxAttempts);
  }

  /**
   * Fetches the URL.
   *
   * @param url absolute {@code http} or {@code https} URL
   * @return the response body and content type
   * @throws NetworkFetchException if the URL could not be fetched
   */
  public FetchedResource fetch(String url) {
    AtomicInteger attempts = new AtomicInteger();
    try {
      FetchedResource resource =
          Retry.decorateSupplier(
                  retry,
                  () -> {
                    attempts.incrementAndGet();
                    return get(url);
                  })
              .get();
      log.debug(
          "Fetched {} ({} bytes, {}) after {} attempt(s)",
          url,
          resource.body().length,
          resource.contentType(),
          attempts.get());
      return resource;
    } catch (RuntimeException e) {
      throw new NetworkFetchException(
          url,
          attempts.get(),
          "Failed to fetch " + url + " after " + attempts.get() + " attempt(s): " + describe(e),
          Exceptions.unwrap(e));
    }
  }

  // ---- private helpers ----

  private FetchedResource get(String url) {
    ResponseEntity<byte[]> response =
        webClient.get().uri(url).retrieve().toEntity(byte[].class).timeout(timeout).block();
    if (response == null) {
      throw new IllegalStateException("Empty response from " + url);
    }
    String contentType =
        response.getHeaders().getContentType() != null
            ? response.getHeaders().getContentType().toString()
            : null;
    byte[] body = response.getBody() != null ? response.getBody() : new byte[0];
    return new FetchedResource(url, contentType, body);
  }

  static boolean isRetryable(Throwable throwable) {
    Throwable cause = Exceptions.unwrap(throwable);
    for (Throwable t = cause; t != null; t = t.getCause()) {
      if (t instanceof DataBufferLimitException) {
        return false;
      }
    }
    if (cause instanceof WebClientResponseException responseException) {
      return responseException.getStatusCode().is5xxServerError()
          || responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }
    return true;
  }

  private static String describe(Throwable throwable) {
    Throwable cause = Exceptions.unwrap(throwable);
    if (cause instanceof WebClientResponseException responseException) {
      return "HTTP " + responseException.getStatusCode().value();
    }
    return cause.getClass().getSimpleName()
        + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
  }
}
