package io.eventsource.util;

import java.util.Map;

/**
 * Codec for the flat {@code Map<String, String>} event metadata column.
 *
 * <p>The default implementation has no dependencies and only understands flat
 * string-to-string objects. Event payloads are encoded by an
 * {@link io.eventsource.aggregate.EventCodec}, not by this interface.
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return FlatJsonCodec.INSTANCE;
  }

  /**
   * Encodes a map as a JSON object. Returns {@code null} for a null or empty map.
   */
  String toJson(Map<String, String> metadata);

  /**
   * Parses a JSON object into a map. Returns an empty map for {@code null}, blank or
   * {@code "null"} input; {@code null} values are dropped.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);
}
