package io.eventsource.jdbc;

import java.util.Objects;

/**
 * Default table names and the validation applied to configured ones. Names are
 * concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_EVENT_TABLE = "es_event";
  public static final String DEFAULT_SEQUENCE_TABLE = "es_sequence";
  public static final String DEFAULT_CHECKPOINT_TABLE = "es_projection_checkpoint";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final int MAX_LENGTH = 48;

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN) || tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
