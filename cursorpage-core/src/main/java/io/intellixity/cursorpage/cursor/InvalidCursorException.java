package io.intellixity.cursorpage.cursor;

import io.intellixity.cursorpage.PaginationException;

/** Raised when a cursor token cannot be decoded or was produced under a different ordering. */
public final class InvalidCursorException extends PaginationException {
  public InvalidCursorException(String message) {
    super(message);
  }

  public InvalidCursorException(String message, Throwable cause) {
    super(message, cause);
  }
}
