package io.intellixity.cursorpage.jdbc;

import java.util.List;

/** SQL with named placeholders ({@code :b1}, {@code :b2}, ...) and their binds in order. */
public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
  }
}
