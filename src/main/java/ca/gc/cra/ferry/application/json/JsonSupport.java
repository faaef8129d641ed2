package ca.gc.cra.ferry.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper over the Jackson streaming API: parses documents into {@link Map}/{@link List} graphs and
 * writes such graphs back out.
 *
 * <p>Instances are thread-safe; the underlying {@link JsonFactory} is shared.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Returns the shared factory so adapters can open generators over their own streams.
   *
   * @return JSON factory
   */
  public JsonFactory factory() {
    return factory;
  }

  /**
   * Parses the supplied JSON string into an object graph of maps, lists and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty map for blank input
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    if (json.isBlank()) {
      return Map.of();
    }
    try (JsonParser parser = factory.createParser(json)) {
      Object root = readValue(parser, parser.nextToken());
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException(
            "Unexpected content after JSON document at offset " + parser.currentTokenLocation().getCharOffset());
      }
      return root;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Writes a value built from maps, iterables, arrays of objects, strings, numbers, booleans and {@code null}.
   * Other types are written through {@link Object#toString()}.
   *
   * @param gen open generator
   * @param value value to write
   * @throws IOException when the generator fails
   * @throws IllegalArgumentException if a floating point value is NaN or infinite
   */
  public void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Double || value instanceof Float) {
      double number = ((Number) value).doubleValue();
      if (Double.isNaN(number) || Double.isInfinite(number)) {
        throw new IllegalArgumentException(
            "Out of range float value " + number + " is not JSON compliant; replace NaN/Infinity before uploading");
      }
      gen.writeNumber(number);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.longValue());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> iterable) {
      gen.writeStartArray();
      for (Object element : iterable) {
        writeValue(gen, element);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] array) {
      gen.writeStartArray();
      for (Object element : array) {
        writeValue(gen, element);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IOException("Unexpected end of JSON input");
    }
    switch (token) {
      case START_OBJECT: {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String name = parser.nextFieldName(); name != null; name = parser.nextFieldName()) {
          fields.put(name, readValue(parser, parser.nextToken()));
        }
        return fields;
      }
      case START_ARRAY: {
        List<Object> elements = new ArrayList<>();
        for (JsonToken next = parser.nextToken(); next != JsonToken.END_ARRAY; next = parser.nextToken()) {
          elements.add(readValue(parser, next));
        }
        return elements;
      }
      case VALUE_STRING:
        return parser.getText();
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        return parser.getNumberValue();
      case VALUE_TRUE:
      case VALUE_FALSE:
        return parser.getBooleanValue();
      case VALUE_NULL:
        return null;
      default:
        throw new IOException("Unexpected JSON token " + token);
    }
  }
}
