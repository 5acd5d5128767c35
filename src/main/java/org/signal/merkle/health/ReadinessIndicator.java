/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle.health;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import io.micronaut.management.health.indicator.annotation.Readiness;
import jakarta.inject.Singleton;
import java.util.HexFormat;
import java.util.Map;
import org.reactivestreams.Publisher;
import org.signal.merkle.MerkleTreeService;

/**
 * Reports the service as ready once its tree holds at least one record, and therefore has a root hash.
 */
@Singleton
@Readiness
public class ReadinessIndicator implements HealthIndicator {

  private final MerkleTreeService merkleTreeService;

  ReadinessIndicator(final MerkleTreeService merkleTreeService) {
    this.merkleTreeService = merkleTreeService;
  }

  @Override
  public Publisher<HealthResult> getResult() {
    final HealthResult.Builder builder = merkleTreeService.getRootHash()
        .map(rootHash -> HealthResult.builder("MerkleTreeBuilt", HealthStatus.UP)
            .details(Map.of(
                "records", merkleTreeService.size(),
                "rootHash", HexFormat.of().formatHex(rootHash))))
        .orElseGet(() -> HealthResult.builder("MerkleTreeBuilt", HealthStatus.DOWN)
            .details(Map.of("records", 0)));

    return Publishers.just(builder.build());
  }
}
