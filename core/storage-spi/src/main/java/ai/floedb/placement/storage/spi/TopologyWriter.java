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

package ai.floedb.placement.storage.spi;

import ai.floedb.placement.model.Allocation;
import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.ResourceClass;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.model.Trait;
import java.util.List;
import java.util.Set;

/**
 * Write side of one store transaction.
 *
 * <p>Writes are unconditional: generation checks belong to the caller and happen through the
 * reader view of the same transaction. The store only enforces key uniqueness and referential
 * existence, raising {@link TopologyStoreException.DuplicateKeyException} or {@link
 * TopologyStoreException.MissingEntityException}. Any exception escaping the transaction body
 * discards every write made in it.
 */
public interface TopologyWriter extends TopologyReader {

  void insertProvider(ResourceProvider provider);

  void updateProvider(ResourceProvider provider);

  /** Removes the provider together with its inventories, traits and aggregate memberships. */
  void deleteProvider(String uuid);

  void putInventory(Inventory inventory);

  void deleteInventory(String providerUuid, String resourceClass);

  void insertResourceClass(ResourceClass resourceClass);

  void deleteResourceClass(String name);

  void insertTrait(Trait trait);

  void deleteTrait(String name);

  void replaceTraits(String providerUuid, Set<String> traits);

  void replaceAggregates(String providerUuid, Set<String> aggregateUuids);

  void insertConsumer(Consumer consumer);

  void updateConsumer(Consumer consumer);

  /** Removes the consumer and every allocation it holds. */
  void deleteConsumer(String uuid);

  void replaceAllocations(String consumerUuid, List<Allocation> allocations);
}
