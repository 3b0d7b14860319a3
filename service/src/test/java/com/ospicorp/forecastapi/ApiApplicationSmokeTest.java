package com.ospicorp.forecastapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ApiApplicationSmokeTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/ping",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody()).containsEntry("pong", true);
  }

  @Test
  void rootDescribesTheService() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("service", "forecast-service");
  }

  @Test
  void responsesCarryARequestId() {
    ResponseEntity<String> response = restTemplate.getForEntity("/v1/ping", String.class);

    assertThat(response.getHeaders().getFirst("X-Request-Id")).isNotBlank();
  }
}
