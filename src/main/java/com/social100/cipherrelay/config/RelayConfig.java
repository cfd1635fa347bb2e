package com.social100.cipherrelay.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Relay configuration, read from a YAML file.
 */
@Getter
@Setter
public class RelayConfig {

  private static final String[] PROPERTY_ORDER = {
      "bindAddress", "port", "websocketPath", "maxFrameChars",
      "heartbeatIntervalSeconds", "heartbeatTimeoutSeconds",
      "identityMaxAttempts",
      "auditEnabled", "redisHost", "redisPort", "auditStream", "auditStreamMaxLength"
  };

  // Network
  private String bindAddress = "0.0.0.0";
  private int port = 8765;
  // empty accepts every path
  private String websocketPath = "";
  private int maxFrameChars = 1 << 20;

  // Liveness
  private int heartbeatIntervalSeconds = 15;
  private int heartbeatTimeoutSeconds = 45;

  // Identities
  private int identityMaxAttempts = 64;

  // Audit (Redis stream)
  private boolean auditEnabled = false;
  private String redisHost = "localhost";
  private int redisPort = 6379;
  private String auditStream = "relay-audit";
  private long auditStreamMaxLength = 10_000;

  /**
   * Loads the file, or writes the defaults to it first if it does not exist yet.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public static RelayConfig load(Path path) throws IOException {
    if (!Files.exists(path)) {
      RelayConfig config = new RelayConfig();
      config.save(path);
      return config;
    }

    Yaml yaml = new Yaml(new Constructor(RelayConfig.class, new LoaderOptions()));
    RelayConfig config;
    try (InputStream is = Files.newInputStream(path)) {
      config = yaml.load(is);
    }
    if (config == null) {
      config = new RelayConfig();
    }
    config.validate();
    return config;
  }

  public void save(Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    DumperOptions dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    dumperOptions.setPrettyFlow(true);
    dumperOptions.setIndent(2);

    Representer representer = new Representer(dumperOptions) {
      @Override
      protected NodeTuple representJavaBeanProperty(Object javaBean, Property property,
                                                    Object propertyValue, Tag customTag) {
        if (propertyValue == null) {
          return null;
        }
        return super.representJavaBeanProperty(javaBean, property, propertyValue, customTag);
      }

      @Override
      protected Set<Property> getProperties(Class<?> type) {
        Set<Property> props = super.getProperties(type);
        if (type != RelayConfig.class) {
          return props;
        }
        Set<Property> ordered = new LinkedHashSet<>();
        for (String name : PROPERTY_ORDER) {
          for (Property p : props) {
            if (p.getName().equals(name)) {
              ordered.add(p);
              break;
            }
          }
        }
        ordered.addAll(props);
        return ordered;
      }
    };
    representer.addClassTag(RelayConfig.class, Tag.MAP);

    Yaml yaml = new Yaml(representer, dumperOptions);
    try (Writer writer = Files.newBufferedWriter(path)) {
      writer.write("# cipher-relay configuration\n\n");
      yaml.dump(this, writer);
    }
  }

  public void validate() {
    if (bindAddress == null || bindAddress.isBlank()) {
      throw new IllegalArgumentException("bindAddress must not be blank");
    }
    if (websocketPath == null) {
      websocketPath = "";
    }
    if (!websocketPath.isEmpty() && !websocketPath.startsWith("/")) {
      throw new IllegalArgumentException("websocketPath must be empty or start with '/', got '" + websocketPath + "'");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 0 and 65535, got " + port);
    }
    if (maxFrameChars <= 0) {
      throw new IllegalArgumentException("maxFrameChars must be positive, got " + maxFrameChars);
    }
    if (heartbeatIntervalSeconds <= 0) {
      throw new IllegalArgumentException("heartbeatIntervalSeconds must be positive, got " + heartbeatIntervalSeconds);
    }
    if (heartbeatTimeoutSeconds <= heartbeatIntervalSeconds) {
      throw new IllegalArgumentException("heartbeatTimeoutSeconds must be greater than heartbeatIntervalSeconds ("
          + heartbeatTimeoutSeconds + " <= " + heartbeatIntervalSeconds + ")");
    }
    if (identityMaxAttempts <= 0) {
      throw new IllegalArgumentException("identityMaxAttempts must be positive, got " + identityMaxAttempts);
    }
    if (auditEnabled && (redisPort <= 0 || redisPort > 65535)) {
      throw new IllegalArgumentException("redisPort must be between 1 and 65535, got " + redisPort);
    }
    if (auditStreamMaxLength <= 0) {
      throw new IllegalArgumentException("auditStreamMaxLength must be positive, got " + auditStreamMaxLength);
    }
  }
}
