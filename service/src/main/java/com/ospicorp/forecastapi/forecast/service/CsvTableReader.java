package com.ospicorp.forecastapi.forecast.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.InputException;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes header-row CSV tables. Input is decoded as UTF-8, falling back to
 * ISO-8859-1 when the bytes are not valid UTF-8.
 */
@Component
public class CsvTableReader {
  private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

  private final CsvMapper mapper;

  public CsvTableReader() {
    this.mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  public DataTable read(byte[] content) {
    List<String[]> records;
    try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
        .readValues(decode(content))) {
      records = it.readAll();
    } catch (IOException ex) {
      throw new InputException(ErrorKind.UNREADABLE_TABLE,
          "Invalid CSV file. Could not parse.", ex);
    }
    if (records.isEmpty()) {
      throw new InputException(ErrorKind.UNREADABLE_TABLE, "No columns to parse from file.");
    }

    List<String> columns = headerNames(records.get(0));
    List<List<String>> rows = new ArrayList<>(records.size() - 1);
    for (int r = 1; r < records.size(); r++) {
      String[] record = records.get(r);
      if (record.length > columns.size()) {
        throw new InputException(ErrorKind.UNREADABLE_TABLE,
            "Invalid CSV file. Expected " + columns.size() + " fields in line " + (r + 1)
                + ", saw " + record.length + ".");
      }
      List<String> row = new ArrayList<>(columns.size());
      for (int c = 0; c < columns.size(); c++) {
        String cell = c < record.length ? record[c] : null;
        row.add(cell == null || cell.isEmpty() ? null : cell);
      }
      rows.add(row);
    }
    return new DataTable(columns, rows);
  }

  public DataTable read(Path path) {
    try {
      return read(Files.readAllBytes(path));
    } catch (NoSuchFileException ex) {
      throw new InputException(ErrorKind.MISSING_SOURCE, "Data file not found at " + path, ex);
    } catch (IOException ex) {
      throw new InputException(ErrorKind.UNREADABLE_TABLE,
          "Failed to read CSV: " + ex.getMessage(), ex);
    }
  }

  public void write(DataTable table, Writer out) throws IOException {
    CsvSchema.Builder schema = CsvSchema.builder();
    table.columns().forEach(schema::addColumn);
    try (var writer = mapper.writerFor(String[].class)
        .with(schema.setUseHeader(true).build())
        .writeValues(out)) {
      for (List<String> row : table.rows()) {
        writer.write(row.toArray(new String[0]));
      }
    }
  }

  static String decode(byte[] content) {
    int offset = hasUtf8Bom(content) ? 3 : 0;
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(content, offset, content.length - offset))
          .toString();
    } catch (CharacterCodingException ex) {
      log.debug("Upload is not valid UTF-8 ({}); decoding as ISO-8859-1", ex.getMessage());
      return new String(content, StandardCharsets.ISO_8859_1);
    }
  }

  private static boolean hasUtf8Bom(byte[] content) {
    return content.length >= 3
        && (content[0] & 0xFF) == 0xEF
        && (content[1] & 0xFF) == 0xBB
        && (content[2] & 0xFF) == 0xBF;
  }

  // Blank headers become "Unnamed: i"; repeated ones get ".1", ".2", ... suffixes
  static List<String> headerNames(String[] header) {
    List<String> names = new ArrayList<>(header.length);
    Map<String, Integer> counts = new HashMap<>();
    for (int i = 0; i < header.length; i++) {
      String name = header[i] == null || header[i].isBlank() ? "Unnamed: " + i : header[i];
      int n = counts.getOrDefault(name, 0);
      String candidate = name;
      while (names.contains(candidate)) {
        n++;
        candidate = name + "." + n;
      }
      counts.put(name, n);
      names.add(candidate);
    }
    return names;
  }
}
