package com.audience.segments.pipeline.scheduler;

import java.time.Instant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleScheduleTest {

  private static final Instant NOON = Instant.parse("2024-05-01T12:30:00Z");

  @Test
  void blankAndManualSchedulesNeverFire() {
    assertThat(RuleSchedule.parse(null).isManual()).isTrue();
    assertThat(RuleSchedule.parse("  ").isManual()).isTrue();
    assertThat(RuleSchedule.parse("manual").nextAfter(NOON)).isEqualTo(Instant.MAX);
  }

  @Test
  void keywordsMapToCalendarBoundariesInUtc() {
    assertThat(RuleSchedule.parse("HOURLY").nextAfter(NOON))
        .isEqualTo(Instant.parse("2024-05-01T13:00:00Z"));
    assertThat(RuleSchedule.parse("daily").nextAfter(NOON))
        .isEqualTo(Instant.parse("2024-05-02T00:00:00Z"));
    assertThat(RuleSchedule.parse("MONTHLY").nextAfter(NOON))
        .isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));
  }

  @Test
  void cronExpressionsAreAccepted() {
    RuleSchedule schedule = RuleSchedule.parse("0 15 6 * * *");

    assertThat(schedule.isManual()).isFalse();
    assertThat(schedule.nextAfter(NOON)).isEqualTo(Instant.parse("2024-05-02T06:15:00Z"));
  }

  @Test
  void invalidSchedulesAreRejected() {
    assertThat(RuleSchedule.isValid("every tuesday")).isFalse();
    assertThat(RuleSchedule.isValid("WEEKLY")).isTrue();
    assertThatThrownBy(() -> RuleSchedule.parse("0 0 25 * * *"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
