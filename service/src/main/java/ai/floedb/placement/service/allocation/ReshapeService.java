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

package ai.floedb.placement.service.allocation;

import static ai.floedb.placement.service.error.impl.PlacementErrors.params;

import ai.floedb.placement.model.Allocation;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.concurrency.GenerationGuard;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.service.inventory.InventoryReplacer;
import ai.floedb.placement.storage.spi.TopologyStore;
import ai.floedb.placement.storage.spi.TopologyWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Moves capacity and the claims on it in one transaction.
 *
 * <p>Inventories are replaced first with allocation checks deferred, then the consumer batch is
 * applied, then every reshaped provider is verified: no allocation may point at an inventory that
 * no longer exists and no inventory may end up below its usage.
 */
@ApplicationScoped
public class ReshapeService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(ReshapeService.class);

  @Inject
  public ReshapeService(TopologyStore store) {
    super(store, LOG);
  }

  public ReshapeResult reshape(ReshapeRequest request) {
    return inWrite(
        "reshape",
        tx -> {
          for (Map.Entry<String, ReshapeRequest.InventoryReplacement> e :
              request.inventories().entrySet()) {
            String providerUuid = e.getKey();
            ReshapeRequest.InventoryReplacement replacement = e.getValue();
            ResourceProvider current =
                GenerationGuard.checkProvider(tx, providerUuid, replacement.expected());
            Map<String, Inventory> next =
                InventoryReplacer.index(providerUuid, replacement.inventories());
            InventoryReplacer.replace(tx, providerUuid, next, true);
            GenerationGuard.bumpProvider(tx, current, current);
          }

          List<AllocationResult> results =
              AllocationWriter.applyBatch(tx, request.allocations());

          for (String providerUuid : request.inventories().keySet()) {
            verifyProvider(tx, providerUuid);
          }
          LOG.debugf(
              "reshaped providers=%d consumers=%d",
              request.inventories().size(), request.allocations().size());
          return new ReshapeResult(providerGenerations(tx, request), results);
        });
  }

  private static void verifyProvider(TopologyWriter tx, String providerUuid) {
    for (Allocation a : tx.allocationsAgainst(providerUuid)) {
      if (tx.inventory(providerUuid, a.resourceClass()).isEmpty()) {
        throw PlacementErrors.inUse(
            "inventory",
            params(
                "resource", "inventory", "id", providerUuid, "resource_class", a.resourceClass()));
      }
    }
    for (Inventory inv : tx.inventories(providerUuid).values()) {
      InventoryReplacer.requireCapacityCoversUsage(tx, inv);
    }
  }

  private static Map<String, Long> providerGenerations(TopologyWriter tx, ReshapeRequest request) {
    Map<String, Long> out = new LinkedHashMap<>();
    for (String providerUuid : request.inventories().keySet()) {
      out.put(providerUuid, tx.provider(providerUuid).orElseThrow().generation());
    }
    return out;
  }
}
