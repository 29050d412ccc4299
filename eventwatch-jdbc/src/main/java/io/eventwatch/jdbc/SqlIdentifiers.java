package io.eventwatch.jdbc;

import java.util.Objects;

/**
 * Validation for identifiers interpolated into SQL: table names and channel names.
 */
public final class SqlIdentifiers {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final int MAX_LENGTH = 63;

  private SqlIdentifiers() {}

  /**
   * Returns {@code name} if it is a plain SQL identifier of at most 63 characters.
   *
   * @param name the identifier
   * @param kind what the identifier names, used in the error message
   * @return {@code name}
   * @throws NullPointerException     if {@code name} is null
   * @throws IllegalArgumentException if {@code name} is not a valid identifier
   */
  public static String validate(String name, String kind) {
    Objects.requireNonNull(name, kind);
    if (name.length() > MAX_LENGTH || !name.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid " + kind + ": " + name);
    }
    return name;
  }
}
