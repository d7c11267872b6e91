package de.ialistannen.imageupdater.model;

/**
 * The workload types exposing a pod template that can be restarted.
 */
public enum WorkloadKind {
  DEPLOYMENT("deployment"),
  STATEFULSET("statefulset"),
  DAEMONSET("daemonset");

  private final String displayName;

  WorkloadKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
