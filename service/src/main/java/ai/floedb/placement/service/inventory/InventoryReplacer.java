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

import static ai.floedb.placement.service.error.impl.PlacementErrors.params;

import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyWriter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Replaces a provider's inventory set inside an open write transaction.
 *
 * <p>Does not touch the provider generation; callers run it between the generation check and the
 * bump. With {@code deferAllocationChecks} the in-use and below-usage checks are skipped so that a
 * reshape can move allocations in the same transaction and verify at the end.
 */
public final class InventoryReplacer {
  private static final Logger LOG = Logger.getLogger(InventoryReplacer.class);

  private InventoryReplacer() {}

  public static Map<String, Inventory> index(String providerUuid, Collection<Inventory> next) {
    Map<String, Inventory> byClass = new LinkedHashMap<>();
    for (Inventory inv : next) {
      if (byClass.put(inv.resourceClass(), inv.forProvider(providerUuid)) != null) {
        throw PlacementErrors.invalid(
            "field",
            params(
                "field",
                "inventories",
                "detail",
                "Duplicate inventory for resource class " + inv.resourceClass() + "."));
      }
    }
    return byClass;
  }

  public static void replace(
      TopologyWriter tx,
      String providerUuid,
      Map<String, Inventory> next,
      boolean deferAllocationChecks) {
    for (String rc : next.keySet()) {
      requireKnownClass(tx, rc);
    }
    Map<String, Inventory> current = tx.inventories(providerUuid);
    for (String rc : current.keySet()) {
      if (!next.containsKey(rc)) {
        if (!deferAllocationChecks) {
          requireUnallocated(tx, providerUuid, rc);
        }
        tx.deleteInventory(providerUuid, rc);
      }
    }
    for (Inventory inv : next.values()) {
      if (!deferAllocationChecks) {
        requireCapacityCoversUsage(tx, inv);
      }
      tx.putInventory(inv);
    }
    LOG.debugf(
        "replaced inventories provider=%s before=%s after=%s",
        providerUuid, current.keySet(), next.keySet());
  }

  public static void requireKnownClass(TopologyWriter tx, String resourceClass) {
    if (tx.resourceClass(resourceClass).isEmpty()) {
      throw PlacementErrors.invalid(
          "unknown_resource_class", params("field", "resource_class", "id", resourceClass));
    }
  }

  public static void requireUnallocated(TopologyWriter tx, String providerUuid, String rc) {
    if (tx.usage(providerUuid, rc) > 0) {
      throw PlacementErrors.inUse(
          "inventory",
          params("resource", "inventory", "id", providerUuid, "resource_class", rc));
    }
  }

  public static void requireCapacityCoversUsage(TopologyWriter tx, Inventory inv) {
    long used = tx.usage(inv.providerUuid(), inv.resourceClass());
    if (used > inv.capacity()) {
      throw PlacementErrors.inUse(
          "capacity_below_usage",
          params(
              "resource",
              "inventory",
              "id",
              inv.providerUuid(),
              "resource_class",
              inv.resourceClass(),
              "capacity",
              Long.toString(inv.capacity()),
              "used",
              Long.toString(used)));
    }
  }
}
