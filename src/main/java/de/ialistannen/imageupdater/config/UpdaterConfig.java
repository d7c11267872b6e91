package de.ialistannen.imageupdater.config;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import de.ialistannen.imageupdater.cli.CliArguments;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The resolved configuration of the updater. Command line options win over environment variables, which win over the
 * defaults.
 *
 * @param checkInterval the time between two checks, unless a cron schedule is given
 * @param checkTimes a cron schedule for checks
 * @param namespace the only namespace to watch, all if empty
 * @param forcePullPolicy whether restarted containers get their pull policy set to {@code Always}
 * @param dockerConfig the docker config to read registry credentials from
 * @param registryTimeout the timeout for a single registry request
 * @param plainHttpRegistries registries that are contacted without TLS
 * @param defaultRegistry the registry used for images without an explicit registry host
 * @param fetchThreads the number of concurrent registry requests
 */
public record UpdaterConfig(
  Duration checkInterval,
  Optional<Cron> checkTimes,
  Optional<String> namespace,
  boolean forcePullPolicy,
  Optional<Path> dockerConfig,
  Duration registryTimeout,
  Set<String> plainHttpRegistries,
  String defaultRegistry,
  int fetchThreads
) {

  public static final String CHECK_INTERVAL_ENV = "CHECK_INTERVAL";
  public static final String FORCE_PULL_POLICY_ENV = "AUTOMATICALLY_SET_IMAGE_PULL_POLICY_TO_ALWAYS";

  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(300);
  public static final Duration DEFAULT_REGISTRY_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_REGISTRY = "registry-1.docker.io";
  public static final int DEFAULT_FETCH_THREADS = 8;

  public UpdaterConfig {
    plainHttpRegistries = Set.copyOf(plainHttpRegistries);
    if (checkInterval.isZero() || checkInterval.isNegative()) {
      throw new ConfigurationException("Check interval must be positive, was " + checkInterval);
    }
    if (registryTimeout.isZero() || registryTimeout.isNegative()) {
      throw new ConfigurationException("Registry timeout must be positive, was " + registryTimeout);
    }
    if (fetchThreads <= 0) {
      throw new ConfigurationException("Fetch thread count must be positive, was " + fetchThreads);
    }
  }

  /**
   * Builds the configuration from parsed arguments and the environment.
   *
   * @param arguments the command line arguments
   * @param environment the process environment
   * @return the resolved configuration
   * @throws ConfigurationException if a value is invalid
   */
  public static UpdaterConfig resolve(CliArguments arguments, Map<String, String> environment) {
    Duration checkInterval = arguments.checkInterval()
      .map(Duration::ofSeconds)
      .or(() -> Optional.ofNullable(environment.get(CHECK_INTERVAL_ENV)).map(UpdaterConfig::parseSeconds))
      .orElse(DEFAULT_CHECK_INTERVAL);

    boolean forcePullPolicy = arguments.forcePullPolicy()
      || "true".equalsIgnoreCase(environment.getOrDefault(FORCE_PULL_POLICY_ENV, "false"));

    return new UpdaterConfig(
      checkInterval,
      arguments.checkTimes().map(UpdaterConfig::parseCron),
      arguments.namespace(),
      forcePullPolicy,
      arguments.dockerConfigPath().map(Path::of),
      arguments.registryTimeout().map(Duration::ofSeconds).orElse(DEFAULT_REGISTRY_TIMEOUT),
      Set.copyOf(arguments.plainHttpRegistries()),
      arguments.defaultRegistry().orElse(DEFAULT_REGISTRY),
      arguments.fetchThreads().orElse(DEFAULT_FETCH_THREADS)
    );
  }

  /**
   * @return a configuration with all defaults, watching all namespaces
   */
  public static UpdaterConfig defaults() {
    return new UpdaterConfig(
      DEFAULT_CHECK_INTERVAL,
      Optional.empty(),
      Optional.empty(),
      false,
      Optional.empty(),
      DEFAULT_REGISTRY_TIMEOUT,
      Set.of(),
      DEFAULT_REGISTRY,
      DEFAULT_FETCH_THREADS
    );
  }

  static Cron parseCron(String expression) {
    try {
      return new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX))
        .parse(expression)
        .validate();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid cron expression '" + expression + "'", e);
    }
  }

  private static Duration parseSeconds(String value) {
    try {
      return Duration.ofSeconds(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigurationException("'" + value + "' is not a number of seconds", e);
    }
  }

  /**
   * Convenience for listing the plain HTTP registries in log output.
   *
   * @return the sorted plain HTTP registries
   */
  public List<String> sortedPlainHttpRegistries() {
    return plainHttpRegistries.stream().sorted().toList();
  }
}
