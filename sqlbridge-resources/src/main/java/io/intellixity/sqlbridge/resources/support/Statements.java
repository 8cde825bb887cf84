package io.intellixity.sqlbridge.resources.support;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.sql.CreateMode;

import java.util.Locale;

/** Statement prefixes shared by every resource kind. */
public final class Statements {
  private Statements() {}

  /** {@code CREATE [OR REPLACE ]<objectType> [IF NOT EXISTS ]} */
  public static String create(CreateMode mode, String objectType) {
    return create(mode, null, objectType);
  }

  /** As {@link #create(CreateMode, String)} with an object modifier such as TRANSIENT. */
  public static String create(CreateMode mode, String modifier, String objectType) {
    String kind = modifier == null || modifier.isBlank() ? "" : modifier.toUpperCase(Locale.ROOT) + " ";
    return switch (mode) {
      case ERROR_IF_EXISTS -> "CREATE " + kind + objectType + " ";
      case OR_REPLACE -> "CREATE OR REPLACE " + kind + objectType + " ";
      case IF_NOT_EXISTS -> "CREATE " + kind + objectType + " IF NOT EXISTS ";
      case IF_EXISTS -> throw new BadRequestException("createMode ifExists is only valid when dropping");
    };
  }

  /** {@code "IF EXISTS "} when the request asks for a lenient drop. */
  public static String ifExists(NormalizedRequest r) {
    CreateMode mode = CreateMode.parse(r.queryParam(CreateMode.QUERY_PARAM), CreateMode.ERROR_IF_EXISTS);
    return mode == CreateMode.IF_EXISTS || r.flag("ifExists") ? "IF EXISTS " : "";
  }

  /** {@code KEY = value } for a present, non-null body value. */
  public static String assignment(String key, String rendered) {
    return key.toUpperCase(Locale.ROOT) + " = " + rendered + " ";
  }
}
