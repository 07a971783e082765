package io.intellixity.cursorpage.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Table plus optional per-field column mapping and type hints.\n
 *
 * A field without a mapping is the column of the same name; a mapped field is always selected as
 * {@code <expr> AS <field>} so rows carry it under the field name.\n
 *
 * A type hint ({@link #UUID}, {@link #TIMESTAMP}, ...) makes the dialect convert bound values for
 * that field, so a cursor value decoded as a string is bound with the column's type, and makes rows
 * read that column as the matching {@code java.time} / {@code java.util} type.
 */
public record TableRef(String name, Map<String, String> columns, Map<String, String> types) {
  public static final String UUID = "uuid";
  public static final String TIMESTAMP = "timestamp";
  public static final String TIMESTAMPTZ = "timestamptz";
  public static final String DATE = "date";
  public static final String TIME = "time";
  public static final String DECIMAL = "decimal";
  public static final String BIGINT = "bigint";

  public TableRef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    columns = (columns == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    types = (types == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(types));
  }

  public static TableRef of(String name) { return new TableRef(name, Map.of(), Map.of()); }

  public TableRef withColumn(String field, String sqlExpr) {
    Map<String, String> m = new LinkedHashMap<>(columns);
    m.put(field, sqlExpr);
    return new TableRef(name, m, types);
  }

  public TableRef withType(String field, String userTypeId) {
    Map<String, String> m = new LinkedHashMap<>(types);
    m.put(field, userTypeId);
    return new TableRef(name, columns, m);
  }

  /** Type hint of a field, null when none is declared. */
  public String typeOf(String field) { return types.get(field); }
}
