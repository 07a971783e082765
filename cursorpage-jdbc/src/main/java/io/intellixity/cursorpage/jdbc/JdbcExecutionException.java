package io.intellixity.cursorpage.jdbc;

import java.sql.SQLException;

/** Unchecked carrier for a {@link SQLException} raised while fetching or counting. */
public final class JdbcExecutionException extends RuntimeException {
  public JdbcExecutionException(String message, SQLException cause) {
    super(message, cause);
  }

  @Override
  public synchronized SQLException getCause() {
    return (SQLException) super.getCause();
  }
}
