package com.ospicorp.forecastapi.config;

import com.ospicorp.forecastapi.forecast.controller.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  // appended after the JSON converter so collections only go out as CSV when asked for
  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(new CsvHttpMessageConverter());
  }
}
