package ca.gc.cra.ferry.infrastructure.http;

import ca.gc.cra.ferry.application.json.JsonSupport;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.util.Objects;

/**
 * Writes one item as a JSON value inside the request's {@code items} array.
 *
 * @param <T> raw item type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ItemJsonWriter<T> {

  /**
   * Writes {@code item} at the generator's current position.
   *
   * @param gen open generator
   * @param item item to write
   * @throws IOException when the generator fails
   */
  void write(JsonGenerator gen, T item) throws IOException;

  /**
   * Writer for items already shaped as maps, lists and primitives.
   *
   * @param json shared JSON helper
   * @param <T> raw item type
   * @return generic writer
   */
  static <T> ItemJsonWriter<T> generic(JsonSupport json) {
    Objects.requireNonNull(json, "json");
    return json::writeValue;
  }
}
