package de.ialistannen.imageupdater.timing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.imageupdater.kubernetes.PatchConflictException;
import de.ialistannen.imageupdater.kubernetes.PatchDocuments;
import de.ialistannen.imageupdater.kubernetes.WorkloadOperations;
import de.ialistannen.imageupdater.model.ReconcileDecision;
import de.ialistannen.imageupdater.model.ReconcileDecision.Restart;
import de.ialistannen.imageupdater.model.ReconcileDecision.RewriteState;
import de.ialistannen.imageupdater.model.WorkloadKind;
import de.ialistannen.imageupdater.model.WorkloadSnapshot;
import de.ialistannen.imageupdater.updates.ReconciliationEngine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically reconciles every enabled workload of every supported kind. Workloads are handled one after the other,
 * so a workload is never reconciled twice at the same time.
 */
public class ControlLoop {

  private static final Logger LOGGER = LoggerFactory.getLogger(ControlLoop.class);

  private final Map<WorkloadKind, WorkloadOperations> operations;
  private final ReconciliationEngine engine;
  private final PatchDocuments patchDocuments;
  private final Optional<String> namespace;
  private final Schedule schedule;
  private final Clock clock;

  public ControlLoop(
    Map<WorkloadKind, WorkloadOperations> operations,
    ReconciliationEngine engine,
    PatchDocuments patchDocuments,
    Optional<String> namespace,
    Schedule schedule,
    Clock clock
  ) {
    this.operations = Map.copyOf(operations);
    this.engine = engine;
    this.patchDocuments = patchDocuments;
    this.namespace = namespace;
    this.schedule = schedule;
    this.clock = clock;
  }

  /**
   * Runs a check right away and then on the schedule until eternity, or until the thread is interrupted.
   */
  public void runUntilSingularity() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        tick();
      } catch (RuntimeException e) {
        LOGGER.error("Check failed", e);
      }

      Instant nextExecution = schedule.nextExecution(clock.instant());
      LOGGER.info(
        "Sleeping until {} ({})",
        nextExecution,
        formatDurationHuman(Duration.between(clock.instant(), nextExecution))
      );

      try {
        sleepUntil(nextExecution);
      } catch (InterruptedException e) {
        LOGGER.info("Interrupted, stopping");
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Reconciles every enabled workload once. Errors are contained to the workload they happened in.
   *
   * @return what happened
   */
  public TickSummary tick() {
    LOGGER.info("Checking for updates...");
    int checked = 0;
    int restarted = 0;
    int rewritten = 0;
    int failed = 0;

    for (WorkloadKind kind : WorkloadKind.values()) {
      WorkloadOperations kindOperations = operations.get(kind);
      if (kindOperations == null) {
        continue;
      }

      List<WorkloadSnapshot> snapshots;
      try {
        snapshots = kindOperations.listEnabled(namespace);
      } catch (RuntimeException e) {
        LOGGER.error("Failed to list {}s", kind.displayName(), e);
        failed++;
        continue;
      }

      for (WorkloadSnapshot snapshot : snapshots) {
        checked++;
        try {
          ReconcileDecision decision = reconcileOne(kindOperations, snapshot);
          if (decision instanceof Restart) {
            restarted++;
          } else if (decision instanceof RewriteState) {
            rewritten++;
          }
        } catch (PatchConflictException e) {
          LOGGER.warn("{}: {}, retrying next time", snapshot.identity(), e.getMessage());
          failed++;
        } catch (RuntimeException e) {
          LOGGER.error("{}: reconciliation failed", snapshot.identity(), e);
          failed++;
        }
      }
    }

    TickSummary summary = new TickSummary(checked, restarted, rewritten, failed);
    LOGGER.info(
      "Checked {} workload(s): {} restarted, {} rewritten, {} failed",
      summary.checked(),
      summary.restarted(),
      summary.rewritten(),
      summary.failed()
    );
    return summary;
  }

  private ReconcileDecision reconcileOne(WorkloadOperations kindOperations, WorkloadSnapshot snapshot) {
    ReconcileDecision decision = engine.reconcile(snapshot);
    Optional<ObjectNode> patch = patchDocuments.forDecision(snapshot.identity(), decision);
    if (patch.isPresent()) {
      LOGGER.debug("{}: applying patch {}", snapshot.identity(), patch.get());
      kindOperations.patch(snapshot.identity(), patch.get());
      if (decision instanceof Restart) {
        LOGGER.info("{}: restarted", snapshot.identity());
      }
    }
    return decision;
  }

  private void sleepUntil(Instant nextExecution) throws InterruptedException {
    while (nextExecution.isAfter(clock.instant())) {
      Duration between = Duration.between(clock.instant(), nextExecution);
      Thread.sleep(Math.max(between.toMillis() / 4, 100));
    }
  }

  private static String formatDurationHuman(Duration duration) {
    String result = "";
    if (duration.toDaysPart() > 0) {
      result += duration.toDaysPart() + " days";
    }
    if (duration.toHoursPart() > 0) {
      result += ", " + duration.toHoursPart() + " hours";
    }
    if (duration.toMinutesPart() > 0) {
      result += ", " + duration.toMinutesPart() + " minutes";
    }
    if (duration.toSecondsPart() > 0) {
      result += ", " + duration.toSecondsPart() + " seconds";
    }

    return result.replaceFirst("^, ", "");
  }
}
