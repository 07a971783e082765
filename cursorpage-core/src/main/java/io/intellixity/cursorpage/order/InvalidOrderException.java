package io.intellixity.cursorpage.order;

import io.intellixity.cursorpage.PaginationException;

/** Raised when a source ordering contains something other than a plain field reference. */
public final class InvalidOrderException extends PaginationException {
  public InvalidOrderException(String message) {
    super(message);
  }
}
