// Copyright 2024 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.examples.neg.controller.config;

import com.google.examples.neg.controller.cloud.ResourceIds;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

/**
 * Reads NEG controller configuration from the environment and the classpath.
 *
 * <p>For simplified unit testing, create a subclass and override {@link #getenv(String)}.
 */
public class ControllerConfig {

  private static final Logger LOG = LoggerFactory.getLogger(ControllerConfig.class);

  /** The file that contains NEG feature toggles. */
  private static final String NEG_FEATURES_CONFIG_FILE = "config/neg_features.yaml";

  static final String ENV_PROJECT_ID = "GCE_PROJECT_ID";
  static final String ENV_NETWORK_URL = "NETWORK_URL";
  static final String ENV_SUBNETWORK_URL = "SUBNETWORK_URL";

  /** Returns the Google Cloud project ID that owns the NEGs. */
  @NotNull
  public String projectId() {
    return required(ENV_PROJECT_ID);
  }

  /**
   * Returns the partial URL of the VPC network of the cluster, e.g., <code>
   * projects/my-project/global/networks/default</code>. The <code>NETWORK_URL</code> environment
   * variable may contain a full URL, a partial URL, or a network name.
   */
  @NotNull
  public String networkUrl() {
    String network = required(ENV_NETWORK_URL);
    return ResourceIds.parse(network)
        .map(ResourceIds.ResourceId::relativeUrl)
        .orElseGet(() -> "projects/%s/global/networks/%s".formatted(projectId(), network));
  }

  /**
   * Returns the partial URL of the subnetwork of the cluster, or an empty string if hybrid NEGs are
   * enabled and <code>SUBNETWORK_URL</code> is not set. Subnetworks must be given as full or
   * partial URLs, as the name alone does not identify the region.
   */
  @NotNull
  public String subnetworkUrl() {
    String subnetwork = getenv(ENV_SUBNETWORK_URL);
    if ((subnetwork == null || subnetwork.isBlank()) && negFeatures().createHybridNeg()) {
      return "";
    }
    String value = required(ENV_SUBNETWORK_URL);
    return ResourceIds.parse(value)
        .map(ResourceIds.ResourceId::relativeUrl)
        .orElseThrow(
            () ->
                new ConfigException(
                    "Invalid value of " + ENV_SUBNETWORK_URL + " environment variable: " + value));
  }

  /** Reads NEG feature flags from a file on the classpath. Missing file means all flags off. */
  @SuppressWarnings("unchecked")
  @NotNull
  public NegFeatures negFeatures() {
    try (InputStream in = getClassLoader().getResourceAsStream(NEG_FEATURES_CONFIG_FILE)) {
      if (in == null) {
        LOG.info("No {} on the classpath, using default NEG features", NEG_FEATURES_CONFIG_FILE);
        return new NegFeatures(false);
      }
      var featureMap =
          (Map<String, Boolean>) new Load(LoadSettings.builder().build()).loadFromInputStream(in);
      var negFeatures = new NegFeatures(featureMap == null ? Map.of() : featureMap);
      LOG.debug("NEG features: {}", negFeatures);
      return negFeatures;
    } catch (IOException e) {
      throw new ConfigException("Could not read " + NEG_FEATURES_CONFIG_FILE, e);
    }
  }

  @Nullable
  String getenv(@NotNull String name) {
    return System.getenv(name);
  }

  @NotNull
  private String required(@NotNull String name) {
    String value = getenv(name);
    if (value == null || value.isBlank()) {
      throw new ConfigException("Missing value of " + name + " environment variable");
    }
    return value.trim();
  }

  @NotNull
  ClassLoader getClassLoader() {
    try {
      var contextClassLoader = Thread.currentThread().getContextClassLoader();
      if (contextClassLoader != null) {
        return contextClassLoader;
      }
    } catch (SecurityException e) {
      LOG.warn("Could not get current thread context class loader.", e);
    }
    var classLoader = this.getClass().getClassLoader();
    if (classLoader != null) {
      return classLoader;
    }
    var systemClassLoader = ClassLoader.getSystemClassLoader();
    if (systemClassLoader == null) {
      throw new ConfigException("Could not find class loader to load controller configuration.");
    }
    return systemClassLoader;
  }
}
