package io.eventsource.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string maps.
 */
final class FlatJsonCodec implements JsonCodec {
  static final FlatJsonCodec INSTANCE = new FlatJsonCodec();

  private FlatJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      quote(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        quote(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Reader(json).readObject();
  }

  private static void quote(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Reader {
    private final String input;
    private int pos;

    Reader(String input) {
      this.input = input;
    }

    Map<String, String> readObject() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        String key = readString();
        expect(':');
        skipWhitespace();
        if (input.startsWith("null", pos)) {
          pos += 4;
        } else {
          result.put(key, readString());
        }
        skipWhitespace();
        char next = next();
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at " + (pos - 1));
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON object");
      }
      return result;
    }

    private String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char escaped = next();
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
    }

    private void expect(char expected) {
      skipWhitespace();
      char actual = next();
      if (actual != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + (pos - 1));
      }
    }

    private char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    private char next() {
      char c = peek();
      pos++;
      return c;
    }

    private void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }
  }
}
