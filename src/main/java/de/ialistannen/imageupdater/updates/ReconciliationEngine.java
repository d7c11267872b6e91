package de.ialistannen.imageupdater.updates;

import de.ialistannen.imageupdater.model.ContainerInfo;
import de.ialistannen.imageupdater.model.ImageReference;
import de.ialistannen.imageupdater.model.PatchDescriptor;
import de.ialistannen.imageupdater.model.ReconcileDecision;
import de.ialistannen.imageupdater.model.ReconcileDecision.NoAction;
import de.ialistannen.imageupdater.model.ReconcileDecision.Restart;
import de.ialistannen.imageupdater.model.ReconcileDecision.RewriteState;
import de.ialistannen.imageupdater.model.WorkloadIdentity;
import de.ialistannen.imageupdater.model.WorkloadSnapshot;
import de.ialistannen.imageupdater.registry.ImageReferenceParseException;
import de.ialistannen.imageupdater.registry.ImageReferenceParser;
import de.ialistannen.imageupdater.registry.RegistryDigestClient;
import de.ialistannen.imageupdater.registry.RegistryException;
import de.ialistannen.imageupdater.storage.DecodedDigestState;
import de.ialistannen.imageupdater.storage.DigestMap;
import de.ialistannen.imageupdater.storage.DigestStateCodec;
import de.ialistannen.imageupdater.storage.DigestStateFormat;
import de.ialistannen.imageupdater.updates.DigestFetchResult.Failed;
import de.ialistannen.imageupdater.updates.DigestFetchResult.Resolved;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a workload needs to be restarted because the digest behind one of its tracked images changed.
 * <p>
 * The engine is pure apart from the registry requests: it reads a snapshot and returns a decision, applying it is up to
 * the caller.
 */
public class ReconciliationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationEngine.class);

  private final ContainerSelector containerSelector;
  private final ImageReferenceParser referenceParser;
  private final RegistryDigestClient registryClient;
  private final DigestStateCodec stateCodec;
  private final Executor fetchExecutor;
  private final Clock clock;
  private final boolean forcePullPolicy;

  public ReconciliationEngine(
    ContainerSelector containerSelector,
    ImageReferenceParser referenceParser,
    RegistryDigestClient registryClient,
    DigestStateCodec stateCodec,
    Executor fetchExecutor,
    Clock clock,
    boolean forcePullPolicy
  ) {
    this.containerSelector = containerSelector;
    this.referenceParser = referenceParser;
    this.registryClient = registryClient;
    this.stateCodec = stateCodec;
    this.fetchExecutor = fetchExecutor;
    this.clock = clock;
    this.forcePullPolicy = forcePullPolicy;
  }

  /**
   * Reconciles a single workload. This will:
   * <ol>
   *   <li>skip workloads without the enable annotation</li>
   *   <li>select the tracked containers</li>
   *   <li>resolve the current digest of every tracked container, each independently</li>
   *   <li>compare the resolved digests with the stored ones</li>
   * </ol>
   * Containers whose digest could not be resolved keep their stored digest and take no part in the comparison.
   *
   * @param snapshot the freshly read workload
   * @return the decision
   */
  public ReconcileDecision reconcile(WorkloadSnapshot snapshot) {
    WorkloadIdentity identity = snapshot.identity();
    if (!snapshot.isEnabled()) {
      return new NoAction("not enabled");
    }

    List<ContainerInfo> tracked = containerSelector.select(
      snapshot.containers(),
      snapshot.initContainers(),
      snapshot.trackingPolicy()
    );
    if (tracked.isEmpty()) {
      LOGGER.info("{}: no containers tracked", identity);
      return new NoAction("no tracked containers");
    }

    List<DigestFetchResult> results = fetchDigests(identity, tracked);
    List<Resolved> resolved = results.stream()
      .filter(Resolved.class::isInstance)
      .map(Resolved.class::cast)
      .toList();

    if (resolved.isEmpty()) {
      LOGGER.warn("{}: all {} digest fetch(es) failed, leaving it alone this time", identity, results.size());
      return new NoAction("all digest fetches failed");
    }
    if (resolved.size() < results.size()) {
      LOGGER.info(
        "{}: continuing with {} of {} digests, keeping the stored ones for the rest",
        identity,
        resolved.size(),
        results.size()
      );
    }

    DecodedDigestState stored = stateCodec.decode(snapshot.storedDigests(), tracked.get(0).name());
    if (stored.format() == DigestStateFormat.LEGACY) {
      LOGGER.info("{}: migrating legacy digest format", identity);
    }

    Set<String> trackedNames = tracked.stream().map(ContainerInfo::name).collect(Collectors.toSet());
    DigestMap updated = stored.digests().retainOnly(trackedNames);
    List<String> changed = new ArrayList<>();

    for (Resolved result : resolved) {
      String name = result.container().name();
      Optional<String> previous = stored.digests().get(name);
      if (previous.isPresent() && previous.get().equals(result.digest())) {
        continue;
      }
      updated = updated.with(name, result.digest());

      if (result.pinned()) {
        // Changing a pinned digest already changes the pod template, no need for a second rollout
        LOGGER.debug("{}: pinned container '{}' now at '{}'", identity, name, result.digest());
        continue;
      }
      LOGGER.info(
        "{}: container '{}' changed from '{}' to '{}'",
        identity,
        name,
        previous.orElse("<unknown>"),
        result.digest()
      );
      changed.add(name);
    }

    if (!changed.isEmpty()) {
      LOGGER.info("{}: image(s) of {} changed, restarting", identity, changed);
      return new Restart(new PatchDescriptor(updated, restartTimestamp(), pullPolicyContainers(snapshot)));
    }

    // Canonical encoding is a fixed point, equal strings mean there is nothing to write
    String encoded = stateCodec.encode(updated);
    if (!encoded.equals(snapshot.storedDigests().orElse(""))) {
      LOGGER.info("{}: digests unchanged, rewriting stored state", identity);
      return new RewriteState(updated);
    }

    LOGGER.debug("{}: up to date", identity);
    return new NoAction("up to date");
  }

  private List<DigestFetchResult> fetchDigests(WorkloadIdentity identity, List<ContainerInfo> tracked) {
    List<CompletableFuture<DigestFetchResult>> futures = tracked.stream()
      .map(container -> CompletableFuture.supplyAsync(() -> fetchDigest(identity, container), fetchExecutor))
      .toList();

    return futures.stream().map(CompletableFuture::join).toList();
  }

  private DigestFetchResult fetchDigest(WorkloadIdentity identity, ContainerInfo container) {
    try {
      ImageReference reference = referenceParser.parse(container.image());
      if (reference.isPinned()) {
        return new Resolved(container, reference.pinnedDigest().get(), true);
      }
      return new Resolved(container, registryClient.getDigest(reference), false);
    } catch (ImageReferenceParseException | RegistryException e) {
      LOGGER.warn(
        "{}: failed to fetch digest for '{}' ({}): {}",
        identity,
        container.name(),
        container.image(),
        e.getMessage()
      );
      return new Failed(container, e);
    }
  }

  private String restartTimestamp() {
    return DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
  }

  private Set<String> pullPolicyContainers(WorkloadSnapshot snapshot) {
    if (!forcePullPolicy) {
      return Set.of();
    }
    return snapshot.containers()
      .stream()
      .filter(ContainerInfo::needsPullPolicyUpdate)
      .map(ContainerInfo::name)
      .collect(Collectors.toSet());
  }
}
