package de.ialistannen.imageupdater.model;

import com.google.common.base.Splitter;
import de.ialistannen.imageupdater.config.Annotations;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which containers of a workload are watched for digest changes.
 *
 * @param include the containers to track exclusively, empty if unrestricted
 * @param exclude the containers to skip, only consulted when {@code include} is empty
 * @param trackInit whether init containers are tracked as well
 */
public record TrackingPolicy(Set<String> include, Set<String> exclude, boolean trackInit) {

  private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  public TrackingPolicy {
    include = Set.copyOf(include);
    exclude = Set.copyOf(exclude);
  }

  public static TrackingPolicy trackAll() {
    return new TrackingPolicy(Set.of(), Set.of(), false);
  }

  /**
   * Reads the policy from the user-owned workload annotations.
   *
   * @param annotations the workload's metadata annotations
   * @return the tracking policy
   */
  public static TrackingPolicy fromAnnotations(Map<String, String> annotations) {
    return new TrackingPolicy(
      names(annotations.get(Annotations.TRACK_CONTAINERS)),
      names(annotations.get(Annotations.IGNORE_CONTAINERS)),
      "true".equals(annotations.get(Annotations.TRACK_INIT_CONTAINERS))
    );
  }

  private static Set<String> names(String annotationValue) {
    if (annotationValue == null) {
      return Set.of();
    }
    return new LinkedHashSet<>(NAME_SPLITTER.splitToList(annotationValue));
  }
}
