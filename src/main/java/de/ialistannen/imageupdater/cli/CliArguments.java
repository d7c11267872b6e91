package de.ialistannen.imageupdater.cli;

import java.util.List;
import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;

@Command(
  name = "kubernetes-image-updater",
  description = "Restarts Kubernetes workloads when the digest behind their image tags changes",
  publicParser = true
)
public interface CliArguments {

  @Option(
    names = "--check-interval",
    description = "Seconds between two checks. Default: $CHECK_INTERVAL or 300",
    paramLabel = "SECONDS"
  )
  Optional<Long> checkInterval();

  @Option(
    names = "--check-times",
    description = "Check times in cron syntax (https://crontab.guru). Overrides --check-interval",
    paramLabel = "CRONTAB"
  )
  Optional<String> checkTimes();

  @Option(names = "--namespace", description = "Only watch this namespace. Default: all", paramLabel = "NAMESPACE")
  Optional<String> namespace();

  @Option(
    names = "--force-pull-policy",
    description = "Set imagePullPolicy to Always when restarting. "
      + "Default: $AUTOMATICALLY_SET_IMAGE_PULL_POLICY_TO_ALWAYS or false"
  )
  boolean forcePullPolicy();

  @Option(
    names = "--docker-config",
    description = "Path to a docker config.json with registry credentials",
    paramLabel = "PATH"
  )
  Optional<String> dockerConfigPath();

  @Option(
    names = "--registry-timeout",
    description = "Timeout for a single registry request in seconds. Default: 10",
    paramLabel = "SECONDS"
  )
  Optional<Long> registryTimeout();

  @Option(
    names = "--plain-http-registry",
    description = "A registry host[:port] to contact via plain HTTP",
    paramLabel = "HOST"
  )
  List<String> plainHttpRegistries();

  @Option(
    names = "--default-registry",
    description = "Registry for images without a registry host. Default: 'registry-1.docker.io'",
    paramLabel = "HOST"
  )
  Optional<String> defaultRegistry();

  @Option(
    names = "--fetch-threads",
    description = "Number of concurrent registry requests. Default: 8",
    paramLabel = "COUNT"
  )
  Optional<Integer> fetchThreads();
}
