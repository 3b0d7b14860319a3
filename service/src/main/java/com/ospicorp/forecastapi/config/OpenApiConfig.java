package com.ospicorp.forecastapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Forecast Analysis API")
            .version("v1")
            .description("Upload a time series as CSV and get a forecast, flagged anomalies, "
                + "accuracy metrics and plain-language insights")
            .contact(new Contact().name("Time Series Platform Team").email("api-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
