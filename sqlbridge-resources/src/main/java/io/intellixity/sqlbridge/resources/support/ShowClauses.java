package io.intellixity.sqlbridge.resources.support;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.sql.SqlLiterals;

/** Listing filters shared by SHOW statements. Each clause ends with a space, or is empty. */
public final class ShowClauses {
  public static final String LIKE = "like";
  public static final String STARTS_WITH = "startsWith";
  public static final String SHOW_LIMIT = "showLimit";
  public static final String FROM_NAME = "fromName";

  private ShowClauses() {}

  public static String like(NormalizedRequest r) {
    return r.hasQueryParam(LIKE) ? "LIKE " + SqlLiterals.pattern(r.queryParam(LIKE)) + " " : "";
  }

  public static String startsWith(NormalizedRequest r) {
    return r.hasQueryParam(STARTS_WITH) ? "STARTS WITH " + SqlLiterals.pattern(r.queryParam(STARTS_WITH)) + " " : "";
  }

  public static String limit(NormalizedRequest r) {
    if (!r.hasQueryParam(SHOW_LIMIT)) return "";
    return "LIMIT " + positiveInt(SHOW_LIMIT, r.queryParam(SHOW_LIMIT)) + " ";
  }

  public static String from(NormalizedRequest r) {
    return r.hasQueryParam(FROM_NAME) ? "FROM " + SqlLiterals.pattern(r.queryParam(FROM_NAME)) : "";
  }

  /** STARTS WITH, LIMIT and FROM, in that order. */
  public static String paging(NormalizedRequest r) {
    return startsWith(r) + limit(r) + from(r);
  }

  static int positiveInt(String param, String raw) {
    try {
      int n = Integer.parseInt(raw.trim());
      if (n < 1) throw new BadRequestException(param + " must be a positive integer, got " + raw);
      return n;
    } catch (NumberFormatException e) {
      throw new BadRequestException(param + " must be a positive integer, got " + raw);
    }
  }
}
