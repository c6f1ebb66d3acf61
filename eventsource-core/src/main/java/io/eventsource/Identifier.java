package io.eventsource;

/**
 * Strongly typed aggregate identifier. The string value doubles as the stream id.
 *
 * <pre>{@code
 * public record OrderId(String value) implements Identifier {
 *   public OrderId {
 *     Identifier.requireValid(value);
 *   }
 * }
 * }</pre>
 */
public interface Identifier {

  int MAX_LENGTH = 128;

  /**
   * Returns the identifier value, never null or blank.
   */
  String value();

  /**
   * Validates an identifier value for use as a stream id.
   *
   * @param value the candidate value
   * @return the value
   * @throws NullPointerException     if value is null
   * @throws IllegalArgumentException if value is blank or longer than {@value #MAX_LENGTH}
   */
  static String requireValid(String value) {
    if (value == null) {
      throw new NullPointerException("identifier value");
    }
    if (value.isBlank()) {
      throw new IllegalArgumentException("identifier value cannot be blank");
    }
    if (value.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("identifier value exceeds " + MAX_LENGTH + " characters");
    }
    return value;
  }
}
