package de.ialistannen.imageupdater;

import com.cronutils.model.Cron;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.ialistannen.imageupdater.auth.DockerConfigCredentialProvider;
import de.ialistannen.imageupdater.auth.RegistryCredentialProvider;
import de.ialistannen.imageupdater.cli.CliArguments;
import de.ialistannen.imageupdater.cli.CliArgumentsParser;
import de.ialistannen.imageupdater.config.ConfigurationException;
import de.ialistannen.imageupdater.config.UpdaterConfig;
import de.ialistannen.imageupdater.kubernetes.KubernetesWorkloads;
import de.ialistannen.imageupdater.kubernetes.PatchDocuments;
import de.ialistannen.imageupdater.registry.ImageReferenceParser;
import de.ialistannen.imageupdater.registry.RegistryDigestClient;
import de.ialistannen.imageupdater.storage.DigestStateCodec;
import de.ialistannen.imageupdater.timing.ControlLoop;
import de.ialistannen.imageupdater.timing.Schedule;
import de.ialistannen.imageupdater.updates.ContainerSelector;
import de.ialistannen.imageupdater.updates.ReconciliationEngine;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) {
    CliArguments arguments = new CliArgumentsParser().parseOrExit(args);
    UpdaterConfig config = resolveConfig(arguments);

    LOGGER.info(
      "kubernetes-image-updater started (namespace: {}, schedule: {}, force pull policy: {}, plain http: {})",
      config.namespace().orElse("<all>"),
      config.checkTimes().map(Cron::asString).orElse("every " + config.checkInterval().toSeconds() + "s"),
      config.forcePullPolicy(),
      config.sortedPlainHttpRegistries()
    );

    HttpClient httpClient = HttpClient.newBuilder()
      .connectTimeout(config.registryTimeout())
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();

    ExecutorService fetchExecutor = Executors.newFixedThreadPool(
      config.fetchThreads(),
      new ThreadFactoryBuilder().setNameFormat("digest-fetch-%d").setDaemon(true).build()
    );

    DigestStateCodec stateCodec = new DigestStateCodec();
    ReconciliationEngine engine = new ReconciliationEngine(
      new ContainerSelector(),
      new ImageReferenceParser(config.defaultRegistry()),
      new RegistryDigestClient(
        httpClient,
        credentialProvider(config),
        config.registryTimeout(),
        config.plainHttpRegistries()
      ),
      stateCodec,
      fetchExecutor,
      Clock.systemUTC(),
      config.forcePullPolicy()
    );

    Schedule schedule = config.checkTimes()
      .map(Schedule::cron)
      .orElseGet(() -> Schedule.fixedInterval(config.checkInterval()));

    try (KubernetesClient kubernetesClient = new KubernetesClientBuilder().build()) {
      new ControlLoop(
        KubernetesWorkloads.operations(kubernetesClient),
        engine,
        new PatchDocuments(stateCodec),
        config.namespace(),
        schedule,
        Clock.systemUTC()
      ).runUntilSingularity();
    } finally {
      fetchExecutor.shutdownNow();
    }
  }

  private static UpdaterConfig resolveConfig(CliArguments arguments) {
    try {
      return UpdaterConfig.resolve(arguments, System.getenv());
    } catch (ConfigurationException e) {
      LOGGER.error("Invalid configuration", e);
      throw die(e.getMessage());
    }
  }

  private static RegistryCredentialProvider credentialProvider(UpdaterConfig config) {
    Path pathToFile = Path.of(System.getProperty("user.home"), ".docker/config.json");

    if (config.dockerConfig().isEmpty()) {
      if (!Files.exists(pathToFile)) {
        LOGGER.info("No docker config found, using anonymous registry access");
        return RegistryCredentialProvider.anonymous();
      }
      LOGGER.info("Using default docker config path");
    } else {
      pathToFile = config.dockerConfig().get();
    }

    try {
      return DockerConfigCredentialProvider.fromFile(pathToFile, config.defaultRegistry());
    } catch (IOException e) {
      LOGGER.error("Failed to read docker config '{}'", pathToFile, e);
      throw die("Failed to read docker config");
    }
  }

  private static RuntimeException die(String msg) {
    LOGGER.error(msg);
    System.exit(1);

    return new RuntimeException(msg);
  }
}
