package com.scholary.livefeed.process;

/** Keeps the last {@code capacity} characters written by a subprocess. */
final class OutputTail {

  private final int capacity;
  private final StringBuilder buffer = new StringBuilder();

  OutputTail(int capacity) {
    this.capacity = capacity;
  }

  synchronized void append(String line) {
    buffer.append(line).append('\n');
    int overflow = buffer.length() - capacity;
    if (overflow > 0) {
      buffer.delete(0, overflow);
    }
  }

  synchronized String snapshot() {
    return buffer.toString();
  }
}
