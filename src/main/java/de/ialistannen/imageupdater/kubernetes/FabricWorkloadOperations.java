package de.ialistannen.imageupdater.kubernetes;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.imageupdater.model.WorkloadIdentity;
import de.ialistannen.imageupdater.model.WorkloadKind;
import de.ialistannen.imageupdater.model.WorkloadSnapshot;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WorkloadOperations} on top of a fabric8 resource operation.
 *
 * @param <T> the resource type
 * @param <L> the resource list type
 * @param <R> the single resource operation type
 */
class FabricWorkloadOperations<T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>>
  implements WorkloadOperations {

  private static final Logger LOGGER = LoggerFactory.getLogger(FabricWorkloadOperations.class);

  private final WorkloadKind kind;
  private final MixedOperation<T, L, R> operation;
  private final Function<T, PodTemplateSpec> templateOf;

  FabricWorkloadOperations(WorkloadKind kind, MixedOperation<T, L, R> operation, Function<T, PodTemplateSpec> templateOf) {
    this.kind = kind;
    this.operation = operation;
    this.templateOf = templateOf;
  }

  @Override
  public WorkloadKind kind() {
    return kind;
  }

  @Override
  public List<WorkloadSnapshot> listEnabled(Optional<String> namespace) {
    L list = namespace
      .map(ns -> operation.inNamespace(ns).list())
      .orElseGet(() -> operation.inAnyNamespace().list());

    List<WorkloadSnapshot> snapshots = list.getItems()
      .stream()
      .map(item -> WorkloadSnapshots.fromObject(kind, item.getMetadata(), templateOf.apply(item)))
      .filter(WorkloadSnapshot::isEnabled)
      .toList();

    LOGGER.debug("Found {} enabled {}(s) out of {}", snapshots.size(), kind.displayName(), list.getItems().size());
    return snapshots;
  }

  @Override
  public void patch(WorkloadIdentity identity, ObjectNode patch) {
    try {
      operation.inNamespace(identity.namespace())
        .withName(identity.name())
        .patch(PatchContext.of(PatchType.STRATEGIC_MERGE), patch.toString());
    } catch (KubernetesClientException e) {
      if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
        throw new PatchConflictException(identity, e);
      }
      throw e;
    }
  }
}
