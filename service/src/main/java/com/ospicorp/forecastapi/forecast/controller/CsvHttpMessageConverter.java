package com.ospicorp.forecastapi.forecast.controller;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes forecast point collections as {@code ds,yhat,yhat_lower,yhat_upper} CSV.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  private final CsvMapper mapper = new CsvMapper();
  private final CsvSchema schema;

  public CsvHttpMessageConverter() {
    super(ForecastController.CSV_MEDIA_TYPE);
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    schema = mapper.schemaFor(ForecastPoint.class).withHeader();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> points, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object point : points) {
      if (!(point instanceof ForecastPoint)) {
        throw new HttpMessageNotWritableException(
            "Only forecast points can be written as CSV, got " + point);
      }
      writer.write(point);
    }
    writer.flush();
  }
}
