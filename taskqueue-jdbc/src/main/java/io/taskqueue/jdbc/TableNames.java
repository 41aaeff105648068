package io.taskqueue.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Task table naming. Stores concatenate the name into SQL, so only plain unquoted
 * identifiers are accepted, capped at PostgreSQL's 63-character identifier limit.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "task_record";
  static final int MAX_LENGTH = 63;

  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private TableNames() {}

  /**
   * @return {@code tableName}, unchanged
   * @throws IllegalArgumentException if it is not a plain identifier of at most 63 characters
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Table name longer than " + MAX_LENGTH + " characters: " + tableName);
    }
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Whether {@code tableName} names the default task table, ignoring case as unquoted
   * identifiers do.
   */
  public static boolean isDefault(String tableName) {
    return DEFAULT_TABLE.equalsIgnoreCase(tableName);
  }
}
