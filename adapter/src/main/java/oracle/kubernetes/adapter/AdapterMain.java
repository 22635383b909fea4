// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.function.IntConsumer;

import oracle.kubernetes.adapter.client.ClientConfig;
import oracle.kubernetes.adapter.client.ClientConfigLoader;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.options.ApplyException;
import oracle.kubernetes.adapter.options.FlagSet;
import oracle.kubernetes.adapter.options.ServerOptions;
import oracle.kubernetes.adapter.rest.AdapterServer;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;

/** Command-line entry point of the custom metrics adapter. */
public class AdapterMain {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final String KUBECONFIG_FLAG = "kubeconfig";
  static final String HELP_FLAG = "help";
  static final int EXIT_FAILURE = 1;

  @SuppressWarnings("FieldMayBeFinal") // stubbed in unit tests
  private static IntConsumer exitCall = System::exit;

  private final ServerOptions options = new ServerOptions();
  private final ServerConfig serverConfig = new ServerConfig();
  private final Semaphore shutdownSignal = new Semaphore(0);
  private String kubeconfigPath;
  private AdapterServer server;

  /**
   * Entry point.
   *
   * @param args the command-line flags
   */
  public static void main(String[] args) {
    AdapterMain main = new AdapterMain();
    int status = main.configure(args);
    if (status != 0) {
      exitCall.accept(status);
      return;
    }
    if (main.server == null) {
      return;
    }

    try {
      main.startServer();
      main.waitForDeath();
    } catch (AdapterStartupException e) {
      LOGGER.severe(MessageKeys.EXCEPTION, e.getCause());
      exitCall.accept(EXIT_FAILURE);
    } finally {
      main.stopServer();
      LOGGER.info(MessageKeys.ADAPTER_SHUTTING_DOWN);
    }
  }

  ServerOptions getOptions() {
    return options;
  }

  ServerConfig getServerConfig() {
    return serverConfig;
  }

  AdapterServer getServer() {
    return server;
  }

  FlagSet createFlagSet() {
    FlagSet flags = new FlagSet();
    options.addFlags(flags);
    flags.addStringFlag(KUBECONFIG_FLAG, "",
          "The path to the kubeconfig used to connect to the Kubernetes API server", p -> kubeconfigPath = p);
    flags.addBooleanFlag(HELP_FLAG, false, "Print the usage of this command and exit", b -> { });
    return flags;
  }

  /**
   * Parses and validates the command line, then builds the server configuration and the server.
   * @param args the command-line flags
   * @return zero if the adapter can be started or the usage was requested; otherwise the exit status
   */
  int configure(String... args) {
    FlagSet flags = createFlagSet();
    CommandLine cli;
    try {
      cli = flags.parse(args);
    } catch (ParseException e) {
      LOGGER.severe(MessageKeys.INVALID_OPTION, e.getMessage());
      return EXIT_FAILURE;
    }
    if (cli.hasOption(HELP_FLAG)) {
      System.out.println(getUsage(flags));
      return 0;
    }

    List<String> errors = options.validate();
    if (!errors.isEmpty()) {
      errors.forEach(e -> LOGGER.severe(MessageKeys.INVALID_OPTION, e));
      return EXIT_FAILURE;
    }

    ClientConfig clientConfig;
    try {
      clientConfig = ClientConfigLoader.load(kubeconfigPath);
    } catch (IOException e) {
      LOGGER.severe(MessageKeys.CLIENT_CONFIG_LOAD_FAILED, e.getMessage());
      return EXIT_FAILURE;
    }

    try {
      options.applyTo(serverConfig, clientConfig);
    } catch (ApplyException e) {
      LOGGER.severe(MessageKeys.APPLY_FAILED, e.getStep(), e.getMessage());
      return EXIT_FAILURE;
    }

    server = new AdapterServer(serverConfig);
    return 0;
  }

  static String getUsage(FlagSet flags) {
    StringWriter out = new StringWriter();
    new HelpFormatter().printHelp(new PrintWriter(out), HelpFormatter.DEFAULT_WIDTH, "adapter",
          null, flags.getOptions(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
    return out.toString();
  }

  void startServer() {
    try {
      server.start();
      LOGGER.info(MessageKeys.ADAPTER_STARTED);
    } catch (IOException | GeneralSecurityException e) {
      throw new AdapterStartupException(e);
    }
  }

  void stopServer() {
    if (server != null) {
      server.stop();
    }
  }

  void waitForDeath() {
    Runtime.getRuntime().addShutdownHook(new Thread(shutdownSignal::release));
    try {
      shutdownSignal.acquire();
    } catch (InterruptedException ignore) {
      Thread.currentThread().interrupt();
    }
  }

  static class AdapterStartupException extends RuntimeException {
    AdapterStartupException(Throwable cause) {
      super(cause);
    }
  }
}
