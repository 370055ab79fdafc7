/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.placement.service.aggregate;

import static ai.floedb.placement.service.error.impl.PlacementErrors.params;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Names;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.concurrency.GenerationGuard;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jboss.logging.Logger;

@ApplicationScoped
public class AggregateService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(AggregateService.class);

  @Inject
  public AggregateService(TopologyStore store) {
    super(store, LOG);
  }

  public ProviderAggregates get(String providerUuid) {
    return inRead(
        "getProviderAggregates",
        tx -> {
          ResourceProvider rp =
              tx.provider(providerUuid)
                  .orElseThrow(() -> PlacementErrors.providerNotFound(providerUuid));
          return new ProviderAggregates(
              providerUuid, rp.generation(), tx.aggregatesOf(providerUuid));
        });
  }

  /**
   * Replaces the provider's aggregate membership. The list must hold distinct, well-formed uuids;
   * the comparison is case-insensitive.
   */
  public ProviderAggregates set(
      String providerUuid, ExpectedGeneration expected, List<String> aggregates) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String agg : aggregates) {
      if (!Names.isUuid(agg)) {
        throw PlacementErrors.invalid("aggregate_uuid", params("field", "aggregates", "id", agg));
      }
      if (!normalized.add(agg.toLowerCase(Locale.ROOT))) {
        throw PlacementErrors.invalid("duplicate_aggregate", params("field", "aggregates"));
      }
    }
    return inWrite(
        "setProviderAggregates",
        tx -> {
          ResourceProvider current = GenerationGuard.checkProvider(tx, providerUuid, expected);
          tx.replaceAggregates(providerUuid, normalized);
          ResourceProvider bumped = GenerationGuard.bumpProvider(tx, current, current);
          LOG.debugf("provider=%s aggregates=%s", providerUuid, normalized);
          return new ProviderAggregates(
              providerUuid, bumped.generation(), tx.aggregatesOf(providerUuid));
        });
  }
}
