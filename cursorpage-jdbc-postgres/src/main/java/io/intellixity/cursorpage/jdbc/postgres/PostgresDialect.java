package io.intellixity.cursorpage.jdbc.postgres;

import io.intellixity.cursorpage.jdbc.dialect.AbstractSqlDialect;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyLimit(String sql, int limit) {
    return sql + " LIMIT " + limit;
  }
}
