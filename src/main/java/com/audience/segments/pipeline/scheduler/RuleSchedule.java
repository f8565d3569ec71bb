package com.audience.segments.pipeline.scheduler;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import org.springframework.scheduling.support.CronExpression;

/**
 * A rule's refresh schedule. Accepts Spring cron expressions, the macros Spring
 * understands ({@code @daily}, ...) and the keywords {@code HOURLY}, {@code DAILY},
 * {@code WEEKLY}, {@code MONTHLY}. A blank schedule means manual triggering only.
 * Evaluated in UTC.
 */
public final class RuleSchedule {

  private static final RuleSchedule MANUAL = new RuleSchedule(null);

  private final CronExpression expression;

  private RuleSchedule(CronExpression expression) {
    this.expression = expression;
  }

  /**
   * @throws IllegalArgumentException if the schedule is not a valid cron expression
   */
  public static RuleSchedule parse(String schedule) {
    if (schedule == null || schedule.isBlank()) {
      return MANUAL;
    }
    String trimmed = schedule.trim();
    String macro = switch (trimmed.toUpperCase(Locale.ROOT)) {
      case "MANUAL" -> null;
      case "HOURLY" -> "@hourly";
      case "DAILY" -> "@daily";
      case "WEEKLY" -> "@weekly";
      case "MONTHLY" -> "@monthly";
      default -> trimmed;
    };
    return macro == null ? MANUAL : new RuleSchedule(CronExpression.parse(macro));
  }

  public static boolean isValid(String schedule) {
    try {
      parse(schedule);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  public boolean isManual() {
    return expression == null;
  }

  /** Next fire time strictly after {@code instant}; {@link Instant#MAX} when there is none. */
  public Instant nextAfter(Instant instant) {
    if (expression == null) {
      return Instant.MAX;
    }
    ZonedDateTime next = expression.next(instant.atZone(ZoneOffset.UTC));
    return next != null ? next.toInstant() : Instant.MAX;
  }
}
