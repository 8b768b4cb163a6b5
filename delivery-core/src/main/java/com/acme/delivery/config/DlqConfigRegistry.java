package com.acme.delivery.config;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-queue {@link DlqConfig} entries layered over a global default. Resolution order, highest
 * first: call-site overrides, the queue's registered config, the defaults.
 */
public class DlqConfigRegistry {

  private final DlqConfig defaults;
  private final Map<String, DlqConfig> configs = new ConcurrentHashMap<>();

  public DlqConfigRegistry() {
    this(DlqConfig.defaults());
  }

  public DlqConfigRegistry(DlqConfig defaults) {
    this.defaults = defaults;
  }

  /** Replaces the queue's config with {@code overrides} applied over the defaults. */
  public DlqConfig configure(String queue, DlqConfigOverrides overrides) {
    DlqConfig config = overrides.applyTo(defaults);
    configs.put(queue, config);
    return config;
  }

  public DlqConfig resolve(String queue) {
    return configs.getOrDefault(queue, defaults);
  }

  public DlqConfig resolve(String queue, DlqConfigOverrides overrides) {
    DlqConfig base = resolve(queue);
    return overrides == null ? base : overrides.applyTo(base);
  }

  public Optional<DlqConfig> registered(String queue) {
    return Optional.ofNullable(configs.get(queue));
  }

  public DlqConfig getDefaults() {
    return defaults;
  }
}
