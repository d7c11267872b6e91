package de.ialistannen.imageupdater.model;

import java.util.Optional;

/**
 * Identifies a single workload object.
 *
 * @param kind the workload kind
 * @param namespace the namespace
 * @param name the object name
 * @param resourceVersion the resource version the snapshot was read at, used for optimistic locking
 */
public record WorkloadIdentity(
  WorkloadKind kind,
  String namespace,
  String name,
  Optional<String> resourceVersion
) {

  @Override
  public String toString() {
    return kind.displayName() + "/" + namespace + "/" + name;
  }
}
