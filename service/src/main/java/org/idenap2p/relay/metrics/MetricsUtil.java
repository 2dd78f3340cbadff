/*
 * Copyright 2021 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.metrics;

import io.dropwizard.core.setup.Environment;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.FileDescriptorMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.dropwizard.DropwizardConfig;
import io.micrometer.core.instrument.dropwizard.DropwizardMeterRegistry;
import io.micrometer.core.instrument.util.HierarchicalNameMapper;

public class MetricsUtil {

  public static final String PREFIX = "relay";

  /**
   * Returns a dot-separated ('.') name for the given class and name parts
   */
  public static String name(Class<?> clazz, String... parts) {
    return name(clazz.getSimpleName(), parts);
  }

  private static String name(String name, String... parts) {
    final StringBuilder sb = new StringBuilder(PREFIX);
    sb.append(".").append(name);
    for (String part : parts) {
      sb.append(".").append(part);
    }
    return sb.toString();
  }

  /**
   * Bridges Micrometer's global registry into the environment's Dropwizard metric registry, so meters are served by
   * the admin {@code /metrics} endpoint.
   */
  public static void configureRegistries(final Environment environment) {
    final DropwizardConfig dropwizardConfig = new DropwizardConfig() {
      @Override
      public String prefix() {
        return "dropwizard";
      }

      @Override
      public String get(final String key) {
        return null;
      }
    };

    Metrics.addRegistry(new DropwizardMeterRegistry(dropwizardConfig, environment.metrics(),
        HierarchicalNameMapper.DEFAULT, Clock.SYSTEM) {

      @Override
      protected Double nullGaugeValue() {
        return Double.NaN;
      }
    });

    registerSystemResourceMetrics();
  }

  static void registerSystemResourceMetrics() {
    new ProcessorMetrics().bindTo(Metrics.globalRegistry);
    new FileDescriptorMetrics().bindTo(Metrics.globalRegistry);

    new JvmMemoryMetrics().bindTo(Metrics.globalRegistry);
    new JvmThreadMetrics().bindTo(Metrics.globalRegistry);
  }
}
