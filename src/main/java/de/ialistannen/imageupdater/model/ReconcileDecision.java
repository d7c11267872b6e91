package de.ialistannen.imageupdater.model;

import de.ialistannen.imageupdater.storage.DigestMap;

/**
 * The outcome of reconciling a single workload.
 */
public sealed interface ReconcileDecision {

  /**
   * Nothing is written.
   *
   * @param reason why nothing needs to happen, for logging
   */
  record NoAction(String reason) implements ReconcileDecision {

  }

  /**
   * Only the persisted digest annotation changes, the pods are left alone. Happens when migrating the legacy format or
   * dropping entries of containers that are no longer tracked.
   *
   * @param digests the digest map to persist
   */
  record RewriteState(DigestMap digests) implements ReconcileDecision {

  }

  /**
   * At least one tracked image changed, the workload is restarted.
   *
   * @param patch the patch to apply
   */
  record Restart(PatchDescriptor patch) implements ReconcileDecision {

  }
}
