package io.intellixity.sqlbridge.resource;

import io.intellixity.sqlbridge.error.NotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome of a describe: the normalized current row, or absence. */
public record DescribeResult(Map<String, Object> row) {
  private static final DescribeResult NOT_FOUND = new DescribeResult(null);

  public DescribeResult {
    row = row == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(row));
  }

  public static DescribeResult found(Map<String, Object> row) {
    if (row == null) throw new IllegalArgumentException("row");
    return new DescribeResult(row);
  }

  public static DescribeResult notFound() { return NOT_FOUND; }

  public boolean found() { return row != null; }

  public Map<String, Object> requireFound(String message) {
    if (row == null) throw new NotFoundException(message);
    return row;
  }
}
