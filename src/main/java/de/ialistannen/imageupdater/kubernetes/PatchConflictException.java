package de.ialistannen.imageupdater.kubernetes;

import de.ialistannen.imageupdater.model.WorkloadIdentity;

/**
 * The workload was modified between reading and patching it. The next check starts from a fresh read.
 */
public class PatchConflictException extends RuntimeException {

  public PatchConflictException(WorkloadIdentity identity, Throwable cause) {
    super("Workload " + identity + " was modified concurrently, patch rejected", cause);
  }
}
