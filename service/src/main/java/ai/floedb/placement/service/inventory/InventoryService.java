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

package ai.floedb.placement.service.inventory;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.concurrency.GenerationGuard;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyStore;
import ai.floedb.placement.storage.spi.TopologyWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

@ApplicationScoped
public class InventoryService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(InventoryService.class);

  @Inject
  public InventoryService(TopologyStore store) {
    super(store, LOG);
  }

  public InventorySet list(String providerUuid) {
    return inRead(
        "listInventories",
        tx -> {
          ResourceProvider rp =
              tx.provider(providerUuid)
                  .orElseThrow(() -> PlacementErrors.providerNotFound(providerUuid));
          return new InventorySet(providerUuid, rp.generation(), tx.inventories(providerUuid));
        });
  }

  public Inventory get(String providerUuid, String resourceClass) {
    return inRead(
        "getInventory",
        tx -> {
          if (tx.provider(providerUuid).isEmpty()) {
            throw PlacementErrors.providerNotFound(providerUuid);
          }
          return tx.inventory(providerUuid, resourceClass)
              .orElseThrow(() -> PlacementErrors.inventoryNotFound(providerUuid, resourceClass));
        });
  }

  /** Replaces the whole inventory set; classes left out are deleted. */
  public InventorySet replaceAll(
      String providerUuid, ExpectedGeneration expected, Collection<Inventory> inventories) {
    return inWrite(
        "replaceInventories",
        tx -> {
          Map<String, Inventory> next = InventoryReplacer.index(providerUuid, inventories);
          return apply(tx, providerUuid, expected, next);
        });
  }

  /** Creates or updates the inventory of one class, keeping the others. */
  public InventorySet put(String providerUuid, ExpectedGeneration expected, Inventory inventory) {
    return inWrite(
        "putInventory",
        tx -> {
          Map<String, Inventory> next = new LinkedHashMap<>(tx.inventories(providerUuid));
          Inventory own = inventory.forProvider(providerUuid);
          next.put(own.resourceClass(), own);
          return apply(tx, providerUuid, expected, next);
        });
  }

  public InventorySet delete(
      String providerUuid, String resourceClass, ExpectedGeneration expected) {
    return inWrite(
        "deleteInventory",
        tx -> {
          Map<String, Inventory> next = new LinkedHashMap<>(tx.inventories(providerUuid));
          if (tx.provider(providerUuid).isPresent() && next.remove(resourceClass) == null) {
            throw PlacementErrors.inventoryNotFound(providerUuid, resourceClass);
          }
          return apply(tx, providerUuid, expected, next);
        });
  }

  public InventorySet deleteAll(String providerUuid, ExpectedGeneration expected) {
    return replaceAll(providerUuid, expected, List.of());
  }

  private static InventorySet apply(
      TopologyWriter tx,
      String providerUuid,
      ExpectedGeneration expected,
      Map<String, Inventory> next) {
    ResourceProvider current = GenerationGuard.checkProvider(tx, providerUuid, expected);
    InventoryReplacer.replace(tx, providerUuid, next, false);
    ResourceProvider bumped = GenerationGuard.bumpProvider(tx, current, current);
    return new InventorySet(providerUuid, bumped.generation(), tx.inventories(providerUuid));
  }
}
