package io.intellixity.cursorpage.source;

/** Reads a named value off a record. */
@FunctionalInterface
public interface FieldReader<T> {
  Object read(T record, String field);
}
