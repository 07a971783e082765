package io.intellixity.cursorpage.jdbc.dialect;

import io.intellixity.cursorpage.jdbc.SqlStatement;
import io.intellixity.cursorpage.jdbc.TableRef;
import io.intellixity.cursorpage.query.QueryElement;
import io.intellixity.cursorpage.query.SortField;

import java.util.List;

public interface SqlDialect {
  String id();

  /** Filtered, ordered, limited select. An empty projection selects every column. */
  SqlStatement select(TableRef table, List<String> projection, QueryElement filter, List<SortField> sort, int limit);

  /** Row count under the filter. */
  SqlStatement count(TableRef table, QueryElement filter);
}
