package de.ialistannen.imageupdater.kubernetes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.imageupdater.config.Annotations;
import de.ialistannen.imageupdater.model.ContainerInfo;
import de.ialistannen.imageupdater.model.PatchDescriptor;
import de.ialistannen.imageupdater.model.ReconcileDecision;
import de.ialistannen.imageupdater.model.ReconcileDecision.NoAction;
import de.ialistannen.imageupdater.model.ReconcileDecision.Restart;
import de.ialistannen.imageupdater.model.ReconcileDecision.RewriteState;
import de.ialistannen.imageupdater.model.WorkloadIdentity;
import de.ialistannen.imageupdater.storage.DigestMap;
import de.ialistannen.imageupdater.storage.DigestStateCodec;
import java.util.Optional;

/**
 * Builds the strategic merge patches for reconcile decisions. The digest annotation and the restart trigger always end
 * up in the same document, so they are applied atomically.
 */
public class PatchDocuments {

  private final ObjectMapper objectMapper;
  private final DigestStateCodec stateCodec;

  public PatchDocuments(DigestStateCodec stateCodec) {
    this.stateCodec = stateCodec;
    this.objectMapper = new ObjectMapper();
  }

  /**
   * @param identity the workload, its resource version is used for optimistic locking
   * @param decision the decision to apply
   * @return the patch, empty if nothing needs to be written
   */
  public Optional<ObjectNode> forDecision(WorkloadIdentity identity, ReconcileDecision decision) {
    if (decision instanceof NoAction) {
      return Optional.empty();
    }
    if (decision instanceof RewriteState rewrite) {
      return Optional.of(stateOnly(identity, rewrite.digests()));
    }
    if (decision instanceof Restart restartDecision) {
      return Optional.of(restart(identity, restartDecision.patch()));
    }
    throw new IllegalArgumentException("Unknown decision " + decision);
  }

  private ObjectNode stateOnly(WorkloadIdentity identity, DigestMap digests) {
    ObjectNode root = objectMapper.createObjectNode();
    writeMetadata(root, identity, digests);
    return root;
  }

  private ObjectNode restart(WorkloadIdentity identity, PatchDescriptor patch) {
    ObjectNode root = objectMapper.createObjectNode();
    writeMetadata(root, identity, patch.digests());

    ObjectNode template = root.putObject("spec").putObject("template");
    template.putObject("metadata")
      .putObject("annotations")
      .put(Annotations.RESTARTED_AT, patch.restartedAt());

    if (!patch.pullPolicyContainers().isEmpty()) {
      ArrayNode containers = template.putObject("spec").putArray("containers");
      patch.pullPolicyContainers()
        .stream()
        .sorted()
        .forEach(name -> containers.addObject()
          .put("name", name)
          .put("imagePullPolicy", ContainerInfo.PULL_POLICY_ALWAYS));
    }

    return root;
  }

  private void writeMetadata(ObjectNode root, WorkloadIdentity identity, DigestMap digests) {
    ObjectNode metadata = root.putObject("metadata");
    identity.resourceVersion().ifPresent(version -> metadata.put("resourceVersion", version));
    metadata.putObject("annotations").put(Annotations.LAST_DIGEST, stateCodec.encode(digests));
  }
}
