package io.intellixity.cursorpage.query;

/** Node of a filter tree. Storage collaborators render it through a {@link QueryVisitor}. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
