package com.gnovoa.liveops;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

/** Basic integration tests against the club-open fixture loaded on boot */
@ActiveProfiles("integrationTest")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveOpsApplicationTests {

  @Autowired private TestRestTemplate rest;

  @Test
  @DisplayName("Should verify health endpoint returns UP")
  void healthEndpointReturnsUp() {
    ResponseEntity<JsonNode> res = rest.getForEntity("/actuator/health", JsonNode.class);

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(res.getBody().path("status").asText()).isEqualTo("UP");
  }

  @Test
  @DisplayName("Should verify Swagger UI HTML page loads")
  void swaggerUiIsReachable() {
    ResponseEntity<String> res = rest.getForEntity("/swagger-ui/index.html", String.class);

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(res.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_HTML)).isTrue();
    assertThat(res.getBody()).containsIgnoringCase("swagger ui");
  }

  @Test
  @DisplayName("Should verify OpenAPI JSON and YAML specs are available")
  void openApiSpecShouldBeAvailable() {
    ResponseEntity<JsonNode> json = rest.getForEntity("/v3/api-docs", JsonNode.class);
    assertThat(json.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(json.getBody().has("openapi")).isTrue();
    assertThat(json.getBody().path("paths").has("/api/tournaments/{tournamentId}/reoptimize")).isTrue();

    ResponseEntity<String> yaml = rest.getForEntity("/v3/api-docs.yaml", String.class);
    assertThat(yaml.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(yaml.getBody()).contains("openapi: 3.").contains("paths:");
  }

  @Test
  @DisplayName("Should list and describe the tournament loaded on boot")
  void bootLoadedTournamentIsServed() {
    ResponseEntity<String[]> ids = rest.getForEntity("/api/tournaments", String[].class);
    assertThat(ids.getBody()).contains("club-open");

    ResponseEntity<JsonNode> status =
        rest.getForEntity("/api/tournaments/club-open/status", JsonNode.class);
    assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(status.getBody().path("status").path("total").asInt()).isEqualTo(3);
    assertThat(status.getBody().path("ws").path("tournament").asText())
        .isEqualTo("/ws/tournaments/club-open");
  }

  @Test
  @DisplayName("Should call a match and reject an illegal jump")
  void transitionsAreValidated() {
    ResponseEntity<JsonNode> called =
        rest.postForEntity(
            "/api/tournaments/club-open/matches/m2/transition",
            Map.of("status", "called"),
            JsonNode.class);
    assertThat(called.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(called.getBody().path("status").asText()).isEqualTo("called");

    ResponseEntity<JsonNode> rejected =
        rest.postForEntity(
            "/api/tournaments/club-open/matches/m3/transition",
            Map.of("status", "finished"),
            JsonNode.class);
    assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(rejected.getBody().path("code").asText()).isEqualTo("invalid_transition");
  }

  @Test
  @DisplayName("Should answer 404 for an unknown tournament")
  void unknownTournamentIsNotFound() {
    ResponseEntity<JsonNode> res =
        rest.getForEntity("/api/tournaments/nope/status", JsonNode.class);

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(res.getBody().path("code").asText()).isEqualTo("not_found");
  }

  @Test
  @DisplayName("Should export the whole tournament document")
  void exportReturnsDocument() {
    ResponseEntity<JsonNode> res =
        rest.getForEntity("/api/tournaments/club-open/export", JsonNode.class);

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(res.getBody().path("tournamentId").asText()).isEqualTo("club-open");
    assertThat(res.getBody().path("schedule").path("assignments").size()).isEqualTo(3);
    assertThat(res.getBody().path("config").path("dayStart").isTextual()).isTrue();
  }

  @Test
  @DisplayName("Should report an unreachable solver as a bad gateway")
  void unreachableSolverLeavesScheduleInPlace() {
    ResponseEntity<JsonNode> res =
        rest.postForEntity("/api/tournaments/club-open/reoptimize?wait=true", null, JsonNode.class);

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(res.getBody().path("code").asText()).isEqualTo("solver_failure");
  }
}
