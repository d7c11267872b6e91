package de.ialistannen.imageupdater.model;

import de.ialistannen.imageupdater.storage.DigestMap;
import java.util.Set;

/**
 * Everything needed to restart a workload. The digest annotation and the restart trigger are always applied together.
 *
 * @param digests the digest map to persist
 * @param restartedAt the ISO-8601 restart timestamp written to the pod template
 * @param pullPolicyContainers containers whose {@code imagePullPolicy} is forced to {@code Always}
 */
public record PatchDescriptor(DigestMap digests, String restartedAt, Set<String> pullPolicyContainers) {

  public PatchDescriptor {
    pullPolicyContainers = Set.copyOf(pullPolicyContainers);
  }
}
