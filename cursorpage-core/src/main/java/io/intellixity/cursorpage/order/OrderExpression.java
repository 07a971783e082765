package io.intellixity.cursorpage.order;

import io.intellixity.cursorpage.query.SortField;

import java.util.Objects;

/**
 * One element of a caller-supplied ordering, as reported by a page source.
 *
 * <p>The variants are closed: {@link OrderNormalizer} has one rule per variant and rejects
 * {@link Computed} outright.</p>
 */
public interface OrderExpression {

  /** Bare field name, ascending. */
  record Named(String field) implements OrderExpression {
    public Named {
      Objects.requireNonNull(field, "field");
    }
  }

  /** Field name with an explicit direction. */
  record Directed(String field, SortField.Direction direction) implements OrderExpression {
    public Directed {
      Objects.requireNonNull(field, "field");
      direction = (direction == null) ? SortField.Direction.ASC : direction;
    }
  }

  /** Structured reference. */
  record Sorted(SortField sortField) implements OrderExpression {
    public Sorted {
      Objects.requireNonNull(sortField, "sortField");
    }
  }

  /** Free text such as {@code "display_index desc, id"}. */
  record Text(String clause) implements OrderExpression {
    public Text {
      Objects.requireNonNull(clause, "clause");
    }
  }

  /** Function call or compound computation; never paginable. */
  record Computed(String expression) implements OrderExpression {
    public Computed {
      Objects.requireNonNull(expression, "expression");
    }
  }

  static OrderExpression field(String field) { return new Named(field); }
  static OrderExpression field(String field, SortField.Direction direction) { return new Directed(field, direction); }
  static OrderExpression asc(String field) { return new Directed(field, SortField.Direction.ASC); }
  static OrderExpression desc(String field) { return new Directed(field, SortField.Direction.DESC); }
  static OrderExpression of(SortField sortField) { return new Sorted(sortField); }
  static OrderExpression text(String clause) { return new Text(clause); }
  static OrderExpression computed(String expression) { return new Computed(expression); }
}
