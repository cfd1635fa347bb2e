package com.social100.cipherrelay;

import com.social100.cipherrelay.config.RelayConfig;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: {@code CipherRelayLauncher [config-path] [--port N]}.
 */
public final class CipherRelayLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(CipherRelayLauncher.class);
  private static final String DEFAULT_CONFIG = "cipher-relay.yml";
  private static final long START_TIMEOUT_MS = 10_000;

  private CipherRelayLauncher() {
  }

  public static void main(String[] args) throws Exception {
    Path configPath = Paths.get(DEFAULT_CONFIG);
    Integer portOverride = null;
    for (int i = 0; i < args.length; i++) {
      if ("--port".equals(args[i]) && i + 1 < args.length) {
        portOverride = Integer.parseInt(args[++i]);
      } else {
        configPath = Paths.get(args[i]);
      }
    }

    RelayConfig config = RelayConfig.load(configPath);
    if (portOverride != null) {
      config.setPort(portOverride);
    }
    LOGGER.info("Loaded configuration from {}", configPath.toAbsolutePath());

    CipherRelay relay = new CipherRelay(config);
    Runtime.getRuntime().addShutdownHook(new Thread(relay::stop, "cipher-relay-shutdown"));
    relay.start(START_TIMEOUT_MS);
  }
}
