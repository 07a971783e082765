package io.intellixity.cursorpage.order;

import io.intellixity.cursorpage.query.SortField;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a caller ordering into an {@link OrderSpec}.
 *
 * Rules:
 * - {@link OrderExpression.Named}: ascending.
 * - {@link OrderExpression.Directed} / {@link OrderExpression.Sorted}: as given.
 * - {@link OrderExpression.Text}: comma-separated {@code identifier [asc|desc]} clauses, case-insensitive.
 * - {@link OrderExpression.Computed}: rejected.
 *
 * The identifier field is appended ascending unless the ordering already ends with it. Fields
 * listed after the identifier are dropped since they can never affect the order. An empty
 * ordering becomes identifier ascending.
 */
public final class OrderNormalizer {
  private static final Pattern CLAUSE = Pattern.compile("\\A(\\w+)(?:\\s+(asc|desc))?\\z", Pattern.CASE_INSENSITIVE);
  private static final Pattern IDENT = Pattern.compile("\\w+");

  public OrderSpec normalize(List<OrderExpression> raw, String idField) {
    if (idField == null || !IDENT.matcher(idField).matches()) {
      throw new IllegalArgumentException("idField must be a plain identifier: " + idField);
    }

    List<SortField> fields = new ArrayList<>();
    if (raw != null) {
      for (OrderExpression e : raw) fields.addAll(expand(e));
    }

    List<SortField> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (SortField f : fields) {
      if (!seen.add(f.field())) throw new InvalidOrderException("duplicate order field: " + f.field());
      out.add(f);
      if (f.field().equals(idField)) break;
    }
    if (out.isEmpty() || !out.get(out.size() - 1).field().equals(idField)) {
      out.add(SortField.asc(idField));
    }
    return new OrderSpec(out);
  }

  private static List<SortField> expand(OrderExpression e) {
    if (e == null) throw new InvalidOrderException("null order expression");

    if (e instanceof OrderExpression.Named n) {
      return List.of(SortField.asc(requireIdent(n.field())));
    }
    if (e instanceof OrderExpression.Directed d) {
      return List.of(new SortField(requireIdent(d.field()), d.direction()));
    }
    if (e instanceof OrderExpression.Sorted s) {
      return List.of(new SortField(requireIdent(s.sortField().field()), s.sortField().direction()));
    }
    if (e instanceof OrderExpression.Text t) {
      return parseText(t.clause());
    }
    if (e instanceof OrderExpression.Computed c) {
      throw new InvalidOrderException("unsupported order expression: " + c.expression());
    }
    throw new InvalidOrderException("unsupported order expression: " + e.getClass().getName());
  }

  private static List<SortField> parseText(String clause) {
    List<SortField> out = new ArrayList<>();
    if (clause.isBlank()) return out;
    for (String part : clause.split(",")) {
      Matcher m = CLAUSE.matcher(part.strip());
      if (!m.matches()) throw new InvalidOrderException("unsupported order clause: '" + part.strip() + "'");
      String dir = m.group(2);
      SortField.Direction d = (dir == null)
          ? SortField.Direction.ASC
          : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
      out.add(new SortField(m.group(1), d));
    }
    return out;
  }

  private static String requireIdent(String field) {
    if (!IDENT.matcher(field).matches()) {
      throw new InvalidOrderException("order field is not a plain field reference: '" + field + "'");
    }
    return field;
  }
}
