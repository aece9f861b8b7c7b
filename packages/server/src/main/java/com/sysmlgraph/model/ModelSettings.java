package com.sysmlgraph.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Behavior switches of {@link ModelService}.
 *
 * @param strictKinds reject kinds that no viewpoint lists instead of only logging them
 * @param timestamps maintain {@code createdAt}/{@code updatedAt} on stored elements
 */
public record ModelSettings(boolean strictKinds, boolean timestamps) {

  public static final String STRICT_KINDS_KEY = "model.kinds.strict";
  public static final String TIMESTAMPS_KEY = "model.timestamps.enabled";

  public static final ModelSettings DEFAULTS = new ModelSettings(false, true);

  public static ModelSettings from(Configuration cfg) {
    if (cfg == null) return DEFAULTS;
    return new ModelSettings(
        cfg.getBoolean(STRICT_KINDS_KEY, DEFAULTS.strictKinds()),
        cfg.getBoolean(TIMESTAMPS_KEY, DEFAULTS.timestamps()));
  }
}
