package de.ialistannen.imageupdater.kubernetes;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.imageupdater.model.WorkloadIdentity;
import de.ialistannen.imageupdater.model.WorkloadKind;
import de.ialistannen.imageupdater.model.WorkloadSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * Reading and patching workloads of a single kind.
 */
public interface WorkloadOperations {

  WorkloadKind kind();

  /**
   * Lists all workloads carrying the enable annotation.
   *
   * @param namespace the namespace to look in, all if empty
   * @return freshly read snapshots of the enabled workloads
   */
  List<WorkloadSnapshot> listEnabled(Optional<String> namespace);

  /**
   * Applies a strategic merge patch in a single request.
   *
   * @param identity the workload to patch
   * @param patch the patch document
   * @throws PatchConflictException if the workload changed since it was read
   */
  void patch(WorkloadIdentity identity, ObjectNode patch);
}
