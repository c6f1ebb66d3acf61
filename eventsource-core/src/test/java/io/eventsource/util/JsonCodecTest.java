package io.eventsource.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyMetadataEncodesToNull() {
    assertNull(codec.toJson(Map.of()));
    assertNull(codec.toJson(null));
  }

  @Test
  void escapesSpecialCharacters() {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("actor", "ops \"admin\"");
    metadata.put("note", "line1\nline2\t\\");

    String json = codec.toJson(metadata);

    assertEquals("{\"actor\":\"ops \\\"admin\\\"\",\"note\":\"line1\\nline2\\t\\\\\"}", json);
    assertEquals(metadata, codec.parseObject(json));
  }

  @Test
  void parsesWhitespaceUnicodeAndNullValues() {
    Map<String, String> parsed = codec.parseObject(" { \"a\" : \"\\u00e9\" , \"b\" : null } ");

    assertEquals(Map.of("a", "\u00e9"), parsed);
  }

  @Test
  void blankOrNullInputParsesToEmptyMap() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\"} x"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\q\"}"));
  }
}
