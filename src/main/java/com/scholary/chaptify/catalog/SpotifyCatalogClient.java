package com.scholary.chaptify.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.chaptify.catalog.CatalogException.Reason;
import com.scholary.chaptify.identity.IdentityKey;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Catalog client for Spotify's audiobook API.
 *
 * <p>Two endpoints are used:
 *
 * <ul>
 *   <li>{@code GET /search?type=audiobook} to find candidate works
 *   <li>{@code GET /audiobooks/{id}/chapters} to list a work's chapters, following {@code next}
 *       links until the listing is exhausted
 * </ul>
 *
 * <p>Every response is mapped onto {@link WorkSummary} and {@link CatalogTrack} here, so a
 * response with missing ids or durations surfaces as a {@link CatalogException} with reason {@link
 * Reason#MALFORMED} instead of failing somewhere downstream.
 */
@Component
public class SpotifyCatalogClient implements CatalogClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpotifyCatalogClient.class);

  // Upper bound on followed "next" links; a 50-per-page listing this long is not a real book
  private static final int MAX_PAGES = 200;

  private final HttpClient httpClient;
  private final CatalogProperties properties;
  private final ObjectMapper objectMapper;

  public SpotifyCatalogClient(CatalogProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized catalog client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public List<WorkSummary> search(IdentityKey key) {
    String query = key.title() + " " + key.author();
    URI uri =
        URI.create(
            String.format(
                "%s/search?q=%s&type=audiobook&market=%s&limit=%d",
                properties.baseUrl(),
                encode(query),
                encode(properties.market()),
                properties.searchLimit()));

    LOGGER.info("Searching catalog: query='{}'", query);
    JsonNode root = getJson(uri);

    JsonNode items = root.path("audiobooks").path("items");
    if (!items.isArray()) {
      throw new CatalogException(Reason.MALFORMED, "Search response has no audiobooks.items array");
    }

    List<WorkSummary> candidates = new ArrayList<>();
    for (JsonNode item : items) {
      // The search endpoint pads results with nulls for items unavailable in the market
      if (item == null || item.isNull()) {
        continue;
      }
      candidates.add(parseWork(item));
    }

    LOGGER.info("Catalog returned {} candidates", candidates.size());
    return candidates;
  }

  @Override
  public List<CatalogTrack> fetchTracks(String workId) {
    URI next =
        URI.create(
            String.format(
                "%s/audiobooks/%s/chapters?market=%s&limit=%d",
                properties.baseUrl(),
                encode(workId),
                encode(properties.market()),
                properties.pageSize()));

    List<CatalogTrack> tracks = new ArrayList<>();
    int pages = 0;

    while (next != null) {
      if (++pages > MAX_PAGES) {
        throw new CatalogException(
            Reason.MALFORMED,
            String.format("Chapter listing for %s exceeded %d pages", workId, MAX_PAGES));
      }

      LOGGER.debug("Fetching chapter page {} for {}: {}", pages, workId, next);
      JsonNode page = getJson(next);

      JsonNode items = page.path("items");
      if (!items.isArray()) {
        throw new CatalogException(
            Reason.MALFORMED, "Chapter page for " + workId + " has no items array");
      }
      for (JsonNode item : items) {
        tracks.add(parseTrack(item, tracks.size()));
      }

      next = nextPage(next, page.path("next"));
    }

    LOGGER.info("Fetched {} tracks for {} in {} page(s)", tracks.size(), workId, pages);
    return tracks;
  }

  private WorkSummary parseWork(JsonNode item) {
    String id = item.path("id").asText("");
    if (id.isBlank()) {
      throw new CatalogException(Reason.MALFORMED, "Search result without an id");
    }

    List<String> authors = new ArrayList<>();
    for (JsonNode author : item.path("authors")) {
      String name = author.path("name").asText("");
      if (!name.isBlank()) {
        authors.add(name);
      }
    }

    return new WorkSummary(
        id, item.path("name").asText(""), authors, item.path("total_chapters").asInt(0));
  }

  private CatalogTrack parseTrack(JsonNode item, int index) {
    JsonNode duration = item.path("duration_ms");
    if (!duration.isIntegralNumber() || duration.asLong() < 0) {
      throw new CatalogException(
          Reason.MALFORMED,
          String.format("Chapter %d has an invalid duration_ms: %s", index, duration));
    }
    return new CatalogTrack(index, item.path("name").asText(""), duration.asLong());
  }

  private URI nextPage(URI current, JsonNode nextNode) {
    if (!nextNode.isTextual() || nextNode.asText().isBlank()) {
      return null;
    }
    return current.resolve(nextNode.asText());
  }

  /**
   * Perform a single authorized GET and parse the body.
   *
   * <p>Status mapping: 401/403 unauthorized, 404 not found, 429 and 5xx transient, any other
   * non-200 rejected.
   */
  private JsonNode getJson(URI uri) {
    String token = properties.accessToken();
    if (token == null || token.isBlank()) {
      throw new CatalogException(Reason.UNAUTHORIZED, "No catalog access token configured");
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", "Bearer " + token)
            .header("Accept", "application/json")
            .GET()
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new CatalogException(
          Reason.TRANSIENT, "Catalog request failed: " + uri.getPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CatalogException(
          Reason.TRANSIENT, "Catalog request interrupted: " + uri.getPath(), e);
    }

    int status = response.statusCode();
    if (status != 200) {
      throw new CatalogException(
          classify(status),
          String.format("Catalog returned status %d for %s: %s", status, uri.getPath(),
              abbreviate(response.body())));
    }

    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new CatalogException(
          Reason.MALFORMED, "Catalog returned invalid JSON for " + uri.getPath(), e);
    }
  }

  static Reason classify(int status) {
    if (status == 401 || status == 403) {
      return Reason.UNAUTHORIZED;
    }
    if (status == 404) {
      return Reason.NOT_FOUND;
    }
    if (status == 429 || status >= 500) {
      return Reason.TRANSIENT;
    }
    return Reason.REJECTED;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 200 ? body.substring(0, 200) + "..." : body;
  }
}
