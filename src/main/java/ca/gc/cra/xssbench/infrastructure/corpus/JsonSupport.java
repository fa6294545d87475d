package ca.gc.cra.xssbench.infrastructure.corpus;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams a JSON document into plain {@link Map}/{@link List} trees.
 *
 * <p>Duplicate object keys are rejected so a vector cannot silently carry two payloads.</p>
 */
final class JsonSupport {
  private final JsonFactory factory = JsonFactory.builder().build();

  /**
   * Parses a whole document.
   *
   * @param reader document source; not closed
   * @param source file name used in error messages
   * @return maps, lists, strings, numbers, booleans or {@code null}
   * @throws IOException when reading fails
   * @throws IllegalArgumentException when the text is not a single valid JSON value
   */
  Object parse(Reader reader, String source) throws IOException {
    Objects.requireNonNull(reader, "reader");
    try (JsonParser parser = factory.createParser(reader)) {
      parser.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException(source + ": empty JSON document");
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException(source + ": trailing content after JSON value");
      }
      return value;
    } catch (JsonParseException ex) {
      JsonLocation location = ex.getLocation();
      String where = location == null ? "" : " at line " + location.getLineNr() + ", column " + location.getColumnNr();
      throw new IllegalArgumentException(source + ": invalid JSON" + where + ": " + ex.getOriginalMessage(), ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    for (JsonToken token = parser.nextToken(); token != JsonToken.END_OBJECT; token = parser.nextToken()) {
      String field = parser.currentName();
      map.put(field, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    for (JsonToken token = parser.nextToken(); token != JsonToken.END_ARRAY; token = parser.nextToken()) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
