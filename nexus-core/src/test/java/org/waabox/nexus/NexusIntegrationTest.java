package org.waabox.nexus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs a {@link Nexus} against an in-process HTTP server laid out like the
 * public competitor data source.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NexusIntegrationTest {

  private static final Map<String, String> FILES = Map.of(
      "/api/persons-page-1.json", "{\"items\":[{\"id\":\"2016PARK01\","
          + "\"name\":\"Max Park\",\"country\":\"US\","
          + "\"rank\":{\"singles\":[{\"eventId\":\"333\",\"best\":313,"
          + "\"rank\":{\"world\":1,\"continent\":1,\"country\":1}}]}}]}",
      "/api/persons-page-2.json", "[{\"id\":\"2021NOCO01\","
          + "\"name\":\"No Country\",\"rank\":{\"singles\":[{\"eventId\":"
          + "\"333\",\"best\":900,\"rank\":{\"world\":2}}]}}]",
      "/api/competitions-page-1.json", "[{\"id\":\"WC2023\",\"name\":"
          + "\"WCA World Championship 2023\",\"country\":\"KR\",\"date\":"
          + "{\"from\":\"2023-08-12\",\"till\":\"2023-08-15\"},"
          + "\"events\":[\"333\",\"222\"]}]",
      "/api/countries.json", "[{\"id\":\"USA\",\"iso2Code\":\"US\","
          + "\"continentId\":\"_North America\"},{\"id\":\"Spain\","
          + "\"iso2Code\":\"ES\",\"continentId\":\"_Europe\"}]");

  private HttpServer server;

  private Nexus nexus;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::serve);
    server.start();

    final NexusConfig config = NexusConfig
        .create("http://localhost:" + server.getAddress().getPort() + "/api")
        .withPages(2, 1)
        .withFetchTiming(Duration.ofSeconds(5),
            RetryPolicy.of(2, Duration.ZERO), Duration.ZERO)
        .withQueryWaitTimeout(Duration.ofSeconds(10));
    nexus = Nexus.builder().config(config).build();
  }

  @AfterEach
  void tearDown() {
    nexus.stop();
    server.stop(0);
  }

  private void serve(final HttpExchange exchange) throws IOException {
    final String body = FILES.get(exchange.getRequestURI().getPath());
    if (body == null) {
      exchange.sendResponseHeaders(404, -1);
      exchange.close();
      return;
    }
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(200, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  @Test
  void whenStarted_givenSourceOverHttp_shouldAnswerRankLookups() {
    nexus.start();

    final RankLookup world = nexus.lookupRank("world", "333", "singles", 1)
        .orElseThrow();
    assertEquals("2016PARK01", world.competitor().id());
    assertEquals(313, world.result());
    assertTrue(world.fallbackNote().isEmpty());

    final RankLookup continent = nexus.lookupRank("north_america", "333",
        "singles", 1).orElseThrow();
    assertEquals("Max Park", continent.competitor().name());
    assertTrue(continent.fallbackNote().isEmpty());

    assertTrue(nexus.lookupRank("europe", "333", "singles", 1).isEmpty());
    assertEquals("2021NOCO01", nexus.lookupRank("world", "333", "singles", 2)
        .orElseThrow().competitor().id());
    assertEquals("WC2023", nexus.findCompetitions(
        Set.of("222", "333"), false).get(0).id());
  }
}
