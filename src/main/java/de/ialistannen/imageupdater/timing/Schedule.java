package de.ialistannen.imageupdater.timing;

import com.cronutils.model.Cron;
import com.cronutils.model.time.ExecutionTime;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * When the next check happens.
 */
@FunctionalInterface
public interface Schedule {

  /**
   * @param now the current time
   * @return the time of the next check, strictly after {@code now}
   */
  Instant nextExecution(Instant now);

  static Schedule fixedInterval(Duration interval) {
    return now -> now.plus(interval);
  }

  static Schedule cron(Cron cron) {
    ExecutionTime executionTime = ExecutionTime.forCron(cron);
    return now -> executionTime.nextExecution(ZonedDateTime.ofInstant(now, ZoneId.systemDefault()))
      .orElseThrow(() -> new IllegalStateException("Cron schedule has no next execution"))
      .toInstant();
  }
}
