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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of one store transaction.
 *
 * <p>All views are snapshots taken within the enclosing transaction; inside a write transaction
 * they reflect the transaction's own writes. Collections are returned in a stable iteration order
 * (provider insertion order) so that callers can truncate deterministically.
 */
public interface TopologyReader {

  // Providers and tree traversal
  Optional<ResourceProvider> provider(String uuid);

  Optional<ResourceProvider> providerByName(String name);

  List<ResourceProvider> providers();

  List<ResourceProvider> roots();

  List<ResourceProvider> children(String uuid);

  /** Ancestors of {@code uuid}, nearest first, excluding the provider itself. */
  List<String> ancestors(String uuid);

  /** Root of the tree containing {@code uuid}; the provider itself when it has no parent. */
  String rootOf(String uuid);

  /** Every provider of the tree rooted at {@code rootUuid}, breadth first, root first. */
  List<ResourceProvider> providersInTree(String rootUuid);

  // Inventory and usage
  Map<String, Inventory> inventories(String providerUuid);

  Optional<Inventory> inventory(String providerUuid, String resourceClass);

  /** Inventories of one class keyed by provider uuid. */
  Map<String, Inventory> inventoriesOfClass(String resourceClass);

  /** Sum of {@code used} over every allocation against the inventory. */
  long usage(String providerUuid, String resourceClass);

  /** Usage per resource class of the provider; classes without allocations report zero. */
  Map<String, Long> usages(String providerUuid);

  // Traits and aggregates
  Set<String> traitsOf(String providerUuid);

  Set<String> aggregatesOf(String providerUuid);

  Set<String> providersInAggregates(Collection<String> aggregateUuids);

  Set<String> providersWithTrait(String trait);

  // Catalog
  Optional<ResourceClass> resourceClass(String name);

  List<ResourceClass> resourceClasses();

  Optional<Trait> trait(String name);

  List<Trait> traits();

  // Consumers and allocations
  Optional<Consumer> consumer(String uuid);

  List<Consumer> consumers();

  List<Allocation> allocationsOf(String consumerUuid);

  List<Allocation> allocationsAgainst(String providerUuid);
}
