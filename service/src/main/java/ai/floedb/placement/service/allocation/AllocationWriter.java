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
import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.InventoryRef;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.concurrency.GenerationGuard;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyStore;
import ai.floedb.placement.storage.spi.TopologyWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * All-or-nothing writer of consumer allocation sets.
 *
 * <p>Per consumer, inside the batch transaction:
 *
 * <ol>
 *   <li>check the expected generation; an absent expectation creates the consumer
 *   <li>resolve every (provider, class) to an existing inventory and check quantization
 *   <li>replace the full allocation set; an empty set deletes the consumer without a bump
 *   <li>otherwise bump the consumer generation
 * </ol>
 *
 * <p>After the whole batch is applied, every inventory whose usage grew must still fit its
 * capacity. Any failure discards the transaction, including consumers created earlier in it.
 */
@ApplicationScoped
public class AllocationWriter extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(AllocationWriter.class);

  @Inject
  public AllocationWriter(TopologyStore store) {
    super(store, LOG);
  }

  public AllocationResult write(ConsumerAllocations request) {
    return writeBatch(List.of(request)).get(0);
  }

  public List<AllocationResult> writeBatch(List<ConsumerAllocations> batch) {
    return inWrite("writeAllocations", tx -> applyBatch(tx, batch));
  }

  /** Applies a batch inside a transaction the caller owns. */
  static List<AllocationResult> applyBatch(TopologyWriter tx, List<ConsumerAllocations> batch) {
    Set<String> seen = new HashSet<>();
    for (ConsumerAllocations request : batch) {
      if (!seen.add(request.consumerUuid())) {
        throw PlacementErrors.invalid(
            "field",
            params(
                "field",
                "consumer_uuid",
                "detail",
                "Consumer " + request.consumerUuid() + " appears more than once in the batch."));
      }
    }

    Map<InventoryRef, Long> deltas = new LinkedHashMap<>();
    List<AllocationResult> results = new ArrayList<>(batch.size());
    for (ConsumerAllocations request : batch) {
      results.add(applyOne(tx, request, deltas));
    }
    for (Map.Entry<InventoryRef, Long> delta : deltas.entrySet()) {
      if (delta.getValue() > 0) {
        requireWithinCapacity(tx, delta.getKey(), delta.getValue());
      }
    }
    return results;
  }

  private static AllocationResult applyOne(
      TopologyWriter tx, ConsumerAllocations request, Map<InventoryRef, Long> deltas) {
    String uuid = request.consumerUuid();
    Optional<Consumer> current = GenerationGuard.checkConsumer(tx, uuid, request.expected());

    for (Allocation previous : tx.allocationsOf(uuid)) {
      deltas.merge(previous.inventoryRef(), -previous.used(), Long::sum);
    }
    List<Allocation> next = resolve(tx, request);
    for (Allocation allocation : next) {
      deltas.merge(allocation.inventoryRef(), allocation.used(), Long::sum);
    }

    if (next.isEmpty()) {
      if (current.isPresent()) {
        tx.deleteConsumer(uuid);
        LOG.debugf("consumer=%s removed with its allocations", uuid);
      }
      return new AllocationResult(uuid, null);
    }

    Consumer base;
    if (current.isPresent()) {
      base =
          current
              .get()
              .mergeMetadata(request.consumerType(), request.projectId(), request.userId());
    } else {
      base =
          Consumer.create(uuid, request.consumerType(), request.projectId(), request.userId());
      tx.insertConsumer(base);
    }
    tx.replaceAllocations(uuid, next);
    Consumer bumped = GenerationGuard.bumpConsumer(tx, base);
    LOG.debugf(
        "consumer=%s allocations=%d generation=%d", uuid, next.size(), bumped.generation());
    return new AllocationResult(uuid, bumped.generation());
  }

  private static List<Allocation> resolve(TopologyWriter tx, ConsumerAllocations request) {
    List<Allocation> out = new ArrayList<>();
    for (Map.Entry<String, Map<String, Long>> byProvider : request.allocations().entrySet()) {
      String providerUuid = byProvider.getKey();
      if (tx.provider(providerUuid).isEmpty()) {
        throw PlacementErrors.providerNotFound(providerUuid);
      }
      for (Map.Entry<String, Long> byClass : byProvider.getValue().entrySet()) {
        String rc = byClass.getKey();
        long amount = byClass.getValue();
        Inventory inv =
            tx.inventory(providerUuid, rc)
                .orElseThrow(() -> PlacementErrors.inventoryNotFound(providerUuid, rc));
        if (!inv.acceptsAmount(amount)) {
          throw PlacementErrors.invalid(
              "quantization",
              params(
                  "field",
                  "allocations",
                  "id",
                  providerUuid,
                  "resource_class",
                  rc,
                  "amount",
                  Long.toString(amount),
                  "min_unit",
                  Long.toString(inv.minUnit()),
                  "max_unit",
                  Long.toString(inv.maxUnit()),
                  "step_size",
                  Long.toString(inv.stepSize())));
        }
        out.add(new Allocation(request.consumerUuid(), providerUuid, rc, amount));
      }
    }
    return out;
  }

  private static void requireWithinCapacity(TopologyWriter tx, InventoryRef ref, long growth) {
    Optional<Inventory> inv = tx.inventory(ref.providerUuid(), ref.resourceClass());
    if (inv.isEmpty()) {
      throw PlacementErrors.inventoryNotFound(ref.providerUuid(), ref.resourceClass());
    }
    long used = tx.usage(ref.providerUuid(), ref.resourceClass());
    long capacity = inv.get().capacity();
    if (used > capacity) {
      throw PlacementErrors.capacityExceeded(
          ref.providerUuid(), ref.resourceClass(), growth, used - growth, capacity);
    }
  }
}
