package io.intellixity.sqlbridge.resources.task;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.InternalServerErrorException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Task schedule objects.\n
 *
 * {"schedule_type":"MINUTES_TYPE","minutes":5} &lt;-&gt; '5 MINUTE'\n
 * {"schedule_type":"CRON_TYPE","cron_expr":"0 9 * * *","timezone":"UTC"} &lt;-&gt; 'USING CRON 0 9 * * * UTC'
 */
final class TaskSchedule {
  static final String MINUTES = "MINUTES_TYPE";
  static final String CRON = "CRON_TYPE";

  private TaskSchedule() {}

  /** Backend text to a schedule object; null or blank yields null. */
  static Map<String, Object> parse(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Map<?, ?> m) {
      @SuppressWarnings("unchecked")
      Map<String, Object> mm = (Map<String, Object>) m;
      return mm;
    }
    String s = String.valueOf(raw).trim();
    if (s.isEmpty() || s.equals("null")) return null;
    Map<String, Object> out = new LinkedHashMap<>();
    String upper = s.toUpperCase(Locale.ROOT);
    if (upper.startsWith("USING CRON ")) {
      String rest = s.substring("USING CRON ".length()).trim();
      int tz = rest.lastIndexOf(' ');
      if (tz < 0) throw new InternalServerErrorException("Invalid Value Generated for Schedule - " + s);
      out.put("cron_expr", rest.substring(0, tz).trim());
      out.put("timezone", rest.substring(tz + 1).trim());
      out.put("schedule_type", CRON);
      return out;
    }
    if (upper.contains("MINUTE")) {
      String minutes = s.split(" ", 2)[0];
      try {
        out.put("minutes", Integer.parseInt(minutes));
      } catch (NumberFormatException e) {
        throw new InternalServerErrorException("Invalid Value Generated for Schedule - " + s);
      }
      out.put("schedule_type", MINUTES);
      return out;
    }
    throw new InternalServerErrorException("Invalid Value Generated for Schedule - " + s);
  }

  /** Schedule object to its quoted SCHEDULE value. */
  static String render(Object schedule) {
    if (!(schedule instanceof Map<?, ?> m)) throw new BadRequestException("schedule must be an object");
    Object type = m.get("schedule_type");
    if (MINUTES.equals(type) || (type == null && m.containsKey("minutes"))) {
      Object minutes = m.get("minutes");
      if (minutes == null) throw new BadRequestException("schedule minutes is required");
      return "'" + minutes + " MINUTE'";
    }
    if (CRON.equals(type) || (type == null && m.containsKey("cron_expr"))) {
      Object expr = m.get("cron_expr");
      Object tz = m.get("timezone");
      if (expr == null || tz == null) throw new BadRequestException("schedule cron_expr and timezone are required");
      return "'USING CRON " + expr + " " + tz + "'";
    }
    throw new BadRequestException("Unsupported schedule_type " + type);
  }
}
