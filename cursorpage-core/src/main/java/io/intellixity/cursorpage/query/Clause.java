package io.intellixity.cursorpage.query;

public enum Clause { AND, OR }
