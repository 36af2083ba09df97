package com.scholary.chaptify.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.chaptify.catalog.CatalogException.Reason;
import com.scholary.chaptify.identity.IdentityKey;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SpotifyCatalogClientTest {

  private static final IdentityKey HOWL = new IdentityKey("Diana Wynne Jones", "Howl's Moving Castle");

  private HttpServer server;
  private String baseUrl;
  private final List<String> requestedUris = new CopyOnWriteArrayList<>();
  private final List<String> authorizationHeaders = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void search_shouldParseCandidatesAndSkipNullItems() {
    respond(
        "/v1/search",
        200,
        """
        {"audiobooks": {"items": [
          {"id": "w1", "name": "Howl's Moving Castle", "total_chapters": 21,
           "authors": [{"name": "Diana Wynne Jones"}]},
          null,
          {"id": "w2", "name": "Castle in the Air", "total_chapters": 17,
           "authors": [{"name": "Diana Wynne Jones"}, {"name": ""}]}
        ]}}
        """);

    List<WorkSummary> candidates = client("token-123").search(HOWL);

    assertThat(candidates).extracting(WorkSummary::id).containsExactly("w1", "w2");
    assertThat(candidates.get(0).title()).isEqualTo("Howl's Moving Castle");
    assertThat(candidates.get(0).totalTracks()).isEqualTo(21);
    assertThat(candidates.get(1).authors()).containsExactly("Diana Wynne Jones");

    assertThat(authorizationHeaders).containsExactly("Bearer token-123");
    assertThat(requestedUris.get(0))
        .startsWith("/v1/search?q=howls+moving+castle+diana+wynne+jones")
        .contains("type=audiobook")
        .contains("market=US")
        .contains("limit=10");
  }

  @Test
  void search_shouldRejectResponseWithoutItems() {
    respond("/v1/search", 200, "{\"tracks\": {}}");

    assertThatThrownBy(() -> client("token").search(HOWL))
        .isInstanceOf(CatalogException.class)
        .satisfies(e -> assertThat(((CatalogException) e).reason()).isEqualTo(Reason.MALFORMED));
  }

  @Test
  void search_shouldRejectCandidateWithoutId() {
    respond("/v1/search", 200, "{\"audiobooks\": {\"items\": [{\"name\": \"No id\"}]}}");

    assertThatThrownBy(() -> client("token").search(HOWL))
        .isInstanceOf(CatalogException.class)
        .hasMessageStartingWith("MALFORMED: ");
  }

  @Test
  void fetchTracks_shouldFollowNextLinksInOrder() {
    server.createContext(
        "/v1/audiobooks/abc/chapters",
        exchange -> {
          capture(exchange);
          String query = exchange.getRequestURI().getQuery();
          if (query.contains("offset=2")) {
            write(
                exchange,
                200,
                """
                {"items": [{"name": "Chapter 3", "duration_ms": 300000}], "next": null}
                """);
          } else {
            write(
                exchange,
                200,
                """
                {"items": [
                  {"name": "Opening Credits", "duration_ms": 15000},
                  {"name": "Chapter 1", "duration_ms": 600000}
                ],
                 "next": "%s/audiobooks/abc/chapters?offset=2&limit=2"}
                """
                    .formatted(baseUrl));
          }
        });

    List<CatalogTrack> tracks = client("token").fetchTracks("abc");

    assertThat(tracks).extracting(CatalogTrack::index).containsExactly(0, 1, 2);
    assertThat(tracks)
        .extracting(CatalogTrack::name)
        .containsExactly("Opening Credits", "Chapter 1", "Chapter 3");
    assertThat(tracks)
        .extracting(CatalogTrack::nominalDurationMs)
        .containsExactly(15_000L, 600_000L, 300_000L);
    assertThat(requestedUris).hasSize(2);
    assertThat(requestedUris.get(0)).contains("market=US").contains("limit=50");
  }

  @Test
  void fetchTracks_shouldRejectMissingDuration() {
    respond("/v1/audiobooks/abc/chapters", 200, "{\"items\": [{\"name\": \"Chapter 1\"}]}");

    assertThatThrownBy(() -> client("token").fetchTracks("abc"))
        .isInstanceOf(CatalogException.class)
        .hasMessageContaining("duration_ms")
        .satisfies(e -> assertThat(((CatalogException) e).reason()).isEqualTo(Reason.MALFORMED));
  }

  @Test
  void fetchTracks_shouldMapNotFound() {
    respond("/v1/audiobooks/missing/chapters", 404, "{\"error\": {\"status\": 404}}");

    assertThatThrownBy(() -> client("token").fetchTracks("missing"))
        .isInstanceOf(CatalogException.class)
        .satisfies(
            e -> {
              CatalogException failure = (CatalogException) e;
              assertThat(failure.reason()).isEqualTo(Reason.NOT_FOUND);
              assertThat(failure.isRetryable()).isFalse();
            });
  }

  @Test
  void search_shouldMapRateLimitAsTransient() {
    respond("/v1/search", 429, "");

    assertThatThrownBy(() -> client("token").search(HOWL))
        .isInstanceOf(CatalogException.class)
        .satisfies(
            e -> {
              CatalogException failure = (CatalogException) e;
              assertThat(failure.reason()).isEqualTo(Reason.TRANSIENT);
              assertThat(failure.isRetryable()).isTrue();
            });
  }

  @Test
  void search_shouldRejectInvalidJson() {
    respond("/v1/search", 200, "<html>gateway</html>");

    assertThatThrownBy(() -> client("token").search(HOWL))
        .isInstanceOf(CatalogException.class)
        .satisfies(e -> assertThat(((CatalogException) e).reason()).isEqualTo(Reason.MALFORMED));
  }

  @Test
  void search_shouldFailWithoutTokenBeforeCallingCatalog() {
    respond("/v1/search", 200, "{\"audiobooks\": {\"items\": []}}");

    assertThatThrownBy(() -> client(" ").search(HOWL))
        .isInstanceOf(CatalogException.class)
        .satisfies(e -> assertThat(((CatalogException) e).reason()).isEqualTo(Reason.UNAUTHORIZED));
    assertThat(requestedUris).isEmpty();
  }

  @Test
  void search_shouldReportTransientWhenConnectionDrops() {
    server.createContext("/v1/search", HttpExchange::close);

    assertThatThrownBy(() -> client("token").search(HOWL))
        .isInstanceOf(CatalogException.class)
        .satisfies(e -> assertThat(((CatalogException) e).reason()).isEqualTo(Reason.TRANSIENT));
  }

  @Test
  void classify_shouldMapStatusCodes() {
    assertThat(SpotifyCatalogClient.classify(401)).isEqualTo(Reason.UNAUTHORIZED);
    assertThat(SpotifyCatalogClient.classify(403)).isEqualTo(Reason.UNAUTHORIZED);
    assertThat(SpotifyCatalogClient.classify(404)).isEqualTo(Reason.NOT_FOUND);
    assertThat(SpotifyCatalogClient.classify(429)).isEqualTo(Reason.TRANSIENT);
    assertThat(SpotifyCatalogClient.classify(500)).isEqualTo(Reason.TRANSIENT);
    assertThat(SpotifyCatalogClient.classify(503)).isEqualTo(Reason.TRANSIENT);
    assertThat(SpotifyCatalogClient.classify(400)).isEqualTo(Reason.REJECTED);
  }

  private SpotifyCatalogClient client(String token) {
    CatalogProperties properties =
        new CatalogProperties(baseUrl, token, "US", 10, 50, 5, 5, 3, 0, 0);
    return new SpotifyCatalogClient(properties, new ObjectMapper());
  }

  private void respond(String path, int status, String body) {
    server.createContext(
        path,
        exchange -> {
          capture(exchange);
          write(exchange, status, body);
        });
  }

  private void capture(HttpExchange exchange) {
    requestedUris.add(exchange.getRequestURI().toString());
    authorizationHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
  }

  private static void write(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
