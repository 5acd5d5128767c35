/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle.metrics;

import io.micrometer.core.instrument.Meter.Id;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.inject.Singleton;

/**
 * Publishes percentile histograms for the timers and distribution summaries registered by the Merkle tree service.
 * Meters registered by other components keep their own configuration.
 */
@Singleton
class DistributionStatisticsConfigMeterFilter implements MeterFilter {

  private static final DistributionStatisticConfig merkleDistributionStatisticConfig = DistributionStatisticConfig.builder()
      .percentilesHistogram(true)
      .percentiles(0.5, 0.99)
      .build();

  @Override
  public DistributionStatisticConfig configure(final Id id, final DistributionStatisticConfig config) {
    if (!id.getName().startsWith(MetricsUtil.PREFIX + ".")) {
      return config;
    }

    return merkleDistributionStatisticConfig.merge(config);
  }
}
