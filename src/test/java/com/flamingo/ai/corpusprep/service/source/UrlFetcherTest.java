package com.flamingo.ai.corpusprep.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.corpusprep.config.CorpusConfig;
import com.flamingo.ai.corpusprep.exception.NetworkFetchException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;

@DisplayName("UrlFetcher Tests")
class UrlFetcherTest {

  private HttpServer server;
  private UrlFetcher fetcher;
  private String baseUrl;

  private final AtomicInteger flakyHits = new AtomicInteger();
  private final AtomicInteger unavailableHits = new AtomicInteger();
  private final AtomicInteger missingHits = new AtomicInteger();
  private final AtomicInteger largeHits = new AtomicInteger();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/page", exchange -> respond(exchange, 200, "text/html; charset=utf-8", "<p>Hello.</p>"));
    server.createContext(
        "/flaky",
        exchange -> {
          if (flakyHits.incrementAndGet() == 1) {
            respond(exchange, 503, "text/plain", "busy");
          } else {
            respond(exchange, 200, "text/plain", "Recovered.");
          }
        });
    server.createContext(
        "/unavailable",
        exchange -> {
          unavailableHits.incrementAndGet();
          respond(exchange, 503, "text/plain", "down");
        });
    server.createContext(
        "/missing",
        exchange -> {
          missingHits.incrementAndGet();
          respond(exchange, 404, "text/plain", "nope");
        });
    server.createContext(
        "/large",
        exchange -> {
          largeHits.incrementAndGet();
          respond(exchange, 200, "text/plain", "x".repeat(4096));
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

    CorpusConfig config = new CorpusConfig();
    config.getFetch().setTimeoutMs(5000);
    config.getFetch().setMaxAttempts(3);
    config.getFetch().setInitialBackoffMs(10);
    config.getFetch().setBackoffMultiplier(1.5);
    fetcher = new UrlFetcher(config);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  @DisplayName("should return body and content type of a successful response")
  void shouldFetchBodyAndContentType() {
    FetchedResource resource = fetcher.fetch(baseUrl + "/page");

    assertThat(resource.url()).isEqualTo(baseUrl + "/page");
    assertThat(resource.contentType()).startsWith("text/html");
    assertThat(new String(resource.body(), StandardCharsets.UTF_8)).isEqualTo("<p>Hello.</p>");
  }

  @Test
  @DisplayName("should retry a server error and succeed on the next attempt")
  void shouldRetryServerError() {
    FetchedResource resource = fetcher.fetch(baseUrl + "/flaky");

    assertThat(new String(resource.body(), StandardCharsets.UTF_8)).isEqualTo("Recovered.");
    assertThat(flakyHits).hasValue(2);
  }

  @Test
  @DisplayName("should give up after the configured number of attempts")
  void shouldGiveUpAfterMaxAttempts() {
    assertThatThrownBy(() -> fetcher.fetch(baseUrl + "/unavailable"))
        .isInstanceOfSatisfying(
            NetworkFetchException.class,
            e -> {
              assertThat(e.getAttempts()).isEqualTo(3);
              assertThat(e.getUrl()).isEqualTo(baseUrl + "/unavailable");
              assertThat(e.getMessage()).contains("503");
            });
    assertThat(unavailableHits).hasValue(3);
  }

  @Test
  @DisplayName("should not retry a client error")
  void shouldNotRetryClientError() {
    assertThatThrownBy(() -> fetcher.fetch(baseUrl + "/missing"))
        .isInstanceOfSatisfying(
            NetworkFetchException.class, e -> assertThat(e.getAttempts()).isEqualTo(1));
    assertThat(missingHits).hasValue(1);
  }

  @Test
  @DisplayName("should not retry a response larger than the configured limit")
  void shouldNotRetryOversizedResponse() {
    CorpusConfig config = new CorpusConfig();
    config.getFetch().setMaxAttempts(3);
    config.getFetch().setInitialBackoffMs(10);
    config.getFetch().setMaxResponseBytes(1024);
    UrlFetcher limited = new UrlFetcher(config);

    assertThatThrownBy(() -> limited.fetch(baseUrl + "/large"))
        .isInstanceOfSatisfying(
            NetworkFetchException.class, e -> assertThat(e.getAttempts()).isEqualTo(1));
    assertThat(largeHits).hasValue(1);
  }

  @Test
  @DisplayName("should treat a response over the size limit as final")
  void shouldClassifyBufferLimitAsNotRetryable() {
    assertThat(UrlFetcher.isRetryable(new DataBufferLimitException("limit"))).isFalse();
    assertThat(
            UrlFetcher.isRetryable(
                new IllegalStateException("wrapped", new DataBufferLimitException("limit"))))
        .isFalse();
    assertThat(UrlFetcher.isRetryable(new IOException("reset"))).isTrue();
  }

  @Test
  @DisplayName("should fail with NetworkFetchException when nothing listens")
  void shouldFail_whenConnectionRefused() throws IOException {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    String url = "http://127.0.0.1:" + closedPort + "/page";

    assertThatThrownBy(() -> fetcher.fetch(url)).isInstanceOf(NetworkFetchException.class);
  }

  private static void respond(HttpExchange exchange, int status, String contentType, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", contentType);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
    exchange.close();
  }
}
