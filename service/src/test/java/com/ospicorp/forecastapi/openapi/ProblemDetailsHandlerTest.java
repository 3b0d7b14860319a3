package com.ospicorp.forecastapi.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ProblemDetailsHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void missingFilePartReturnsProblemDetail() {
    MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
    form.add("days", "5");
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.MULTIPART_FORM_DATA);

    ResponseEntity<Map<String, Object>> response = rest.exchange("/v1/forecast",
        HttpMethod.POST, new HttpEntity<>(form, headers),
        new ParameterizedTypeReference<Map<String, Object>>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
  }
}
