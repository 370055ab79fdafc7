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

package ai.floedb.placement.storage.memory;

import ai.floedb.placement.model.Allocation;
import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.ResourceClass;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.model.StandardResourceClasses;
import ai.floedb.placement.model.StandardTraits;
import ai.floedb.placement.model.Trait;
import ai.floedb.placement.storage.spi.TopologyReader;
import ai.floedb.placement.storage.spi.TopologyStore;
import ai.floedb.placement.storage.spi.TopologyStoreException.DuplicateKeyException;
import ai.floedb.placement.storage.spi.TopologyStoreException.MissingEntityException;
import ai.floedb.placement.storage.spi.TopologyWriter;
import jakarta.inject.Singleton;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Copy-on-write topology store.
 *
 * <p>Published states are never mutated. A write transaction works on a private copy of the
 * current state and swaps it in only when the transaction body returns; concurrent writers are
 * serialized on the store monitor. Readers take whatever state is published when they start.
 */
@Singleton
public class InMemoryTopologyStore implements TopologyStore {
  private static final Logger LOG = Logger.getLogger(InMemoryTopologyStore.class);

  private final Object writeLock = new Object();
  private volatile State state;
  private long commits;

  public InMemoryTopologyStore() {
    State seeded = new State();
    for (String name : StandardResourceClasses.ALL) {
      seeded.resourceClasses.put(name, ResourceClass.standard(name));
    }
    for (String name : StandardTraits.ALL) {
      seeded.traits.put(name, Trait.standard(name));
    }
    this.state = seeded;
  }

  @Override
  public <T> T read(Function<TopologyReader, T> work) {
    return work.apply(new Tx(state, true));
  }

  @Override
  public <T> T write(Function<TopologyWriter, T> work) {
    synchronized (writeLock) {
      State working = state.copy();
      T result = work.apply(new Tx(working, false));
      state = working;
      commits++;
      LOG.debugf(
          "commit=%d providers=%d consumers=%d",
          commits, working.providers.size(), working.consumers.size());
      return result;
    }
  }

  private static final class State {
    final Map<String, ResourceProvider> providers = new LinkedHashMap<>();
    final Map<String, String> providerNames = new LinkedHashMap<>();
    final Map<String, Map<String, Inventory>> inventories = new LinkedHashMap<>();
    final Map<String, ResourceClass> resourceClasses = new LinkedHashMap<>();
    final Map<String, Trait> traits = new LinkedHashMap<>();
    final Map<String, Set<String>> providerTraits = new LinkedHashMap<>();
    final Map<String, Set<String>> providerAggregates = new LinkedHashMap<>();
    final Map<String, Consumer> consumers = new LinkedHashMap<>();
    final Map<String, List<Allocation>> allocations = new LinkedHashMap<>();

    State copy() {
      State next = new State();
      next.providers.putAll(providers);
      next.providerNames.putAll(providerNames);
      inventories.forEach((k, v) -> next.inventories.put(k, new LinkedHashMap<>(v)));
      next.resourceClasses.putAll(resourceClasses);
      next.traits.putAll(traits);
      // sets and lists below are immutable once stored
      next.providerTraits.putAll(providerTraits);
      next.providerAggregates.putAll(providerAggregates);
      next.consumers.putAll(consumers);
      next.allocations.putAll(allocations);
      return next;
    }
  }

  private static final class Tx implements TopologyWriter {
    private final State s;
    private final boolean readOnly;

    Tx(State s, boolean readOnly) {
      this.s = s;
      this.readOnly = readOnly;
    }

    private void checkWritable() {
      if (readOnly) {
        throw new IllegalStateException("write attempted in a read transaction");
      }
    }

    private ResourceProvider requireProvider(String uuid) {
      ResourceProvider p = s.providers.get(uuid);
      if (p == null) {
        throw new MissingEntityException("resource provider", uuid);
      }
      return p;
    }

    @Override
    public Optional<ResourceProvider> provider(String uuid) {
      return Optional.ofNullable(s.providers.get(uuid));
    }

    @Override
    public Optional<ResourceProvider> providerByName(String name) {
      String uuid = s.providerNames.get(name);
      return uuid == null ? Optional.empty() : Optional.ofNullable(s.providers.get(uuid));
    }

    @Override
    public List<ResourceProvider> providers() {
      return List.copyOf(s.providers.values());
    }

    @Override
    public List<ResourceProvider> roots() {
      List<ResourceProvider> out = new ArrayList<>();
      for (ResourceProvider p : s.providers.values()) {
        if (p.isRoot()) {
          out.add(p);
        }
      }
      return out;
    }

    @Override
    public List<ResourceProvider> children(String uuid) {
      List<ResourceProvider> out = new ArrayList<>();
      for (ResourceProvider p : s.providers.values()) {
        if (uuid.equals(p.parentUuid())) {
          out.add(p);
        }
      }
      return out;
    }

    @Override
    public List<String> ancestors(String uuid) {
      List<String> out = new ArrayList<>();
      ResourceProvider cur = requireProvider(uuid);
      while (cur.parentUuid() != null) {
        out.add(cur.parentUuid());
        cur = requireProvider(cur.parentUuid());
      }
      return out;
    }

    @Override
    public String rootOf(String uuid) {
      List<String> ancestors = ancestors(uuid);
      return ancestors.isEmpty() ? uuid : ancestors.get(ancestors.size() - 1);
    }

    @Override
    public List<ResourceProvider> providersInTree(String rootUuid) {
      List<ResourceProvider> out = new ArrayList<>();
      Deque<ResourceProvider> queue = new ArrayDeque<>();
      queue.add(requireProvider(rootUuid));
      while (!queue.isEmpty()) {
        ResourceProvider next = queue.poll();
        out.add(next);
        queue.addAll(children(next.uuid()));
      }
      return out;
    }

    @Override
    public Map<String, Inventory> inventories(String providerUuid) {
      Map<String, Inventory> inv = s.inventories.get(providerUuid);
      return inv == null ? Map.of() : new LinkedHashMap<>(inv);
    }

    @Override
    public Optional<Inventory> inventory(String providerUuid, String resourceClass) {
      Map<String, Inventory> inv = s.inventories.get(providerUuid);
      return inv == null ? Optional.empty() : Optional.ofNullable(inv.get(resourceClass));
    }

    @Override
    public Map<String, Inventory> inventoriesOfClass(String resourceClass) {
      Map<String, Inventory> out = new LinkedHashMap<>();
      for (String uuid : s.providers.keySet()) {
        Map<String, Inventory> inv = s.inventories.get(uuid);
        if (inv != null && inv.containsKey(resourceClass)) {
          out.put(uuid, inv.get(resourceClass));
        }
      }
      return out;
    }

    @Override
    public long usage(String providerUuid, String resourceClass) {
      long used = 0L;
      for (List<Allocation> allocs : s.allocations.values()) {
        for (Allocation a : allocs) {
          if (a.providerUuid().equals(providerUuid) && a.resourceClass().equals(resourceClass)) {
            used += a.used();
          }
        }
      }
      return used;
    }

    @Override
    public Map<String, Long> usages(String providerUuid) {
      Map<String, Long> out = new LinkedHashMap<>();
      for (String rc : inventories(providerUuid).keySet()) {
        out.put(rc, 0L);
      }
      for (Allocation a : allocationsAgainst(providerUuid)) {
        out.merge(a.resourceClass(), a.used(), Long::sum);
      }
      return out;
    }

    @Override
    public Set<String> traitsOf(String providerUuid) {
      return s.providerTraits.getOrDefault(providerUuid, Set.of());
    }

    @Override
    public Set<String> aggregatesOf(String providerUuid) {
      return s.providerAggregates.getOrDefault(providerUuid, Set.of());
    }

    @Override
    public Set<String> providersInAggregates(Collection<String> aggregateUuids) {
      Set<String> out = new LinkedHashSet<>();
      for (Map.Entry<String, Set<String>> e : s.providerAggregates.entrySet()) {
        for (String agg : aggregateUuids) {
          if (e.getValue().contains(agg)) {
            out.add(e.getKey());
            break;
          }
        }
      }
      return out;
    }

    @Override
    public Set<String> providersWithTrait(String trait) {
      Set<String> out = new LinkedHashSet<>();
      s.providerTraits.forEach(
          (uuid, traits) -> {
            if (traits.contains(trait)) {
              out.add(uuid);
            }
          });
      return out;
    }

    @Override
    public Optional<ResourceClass> resourceClass(String name) {
      return Optional.ofNullable(s.resourceClasses.get(name));
    }

    @Override
    public List<ResourceClass> resourceClasses() {
      return List.copyOf(s.resourceClasses.values());
    }

    @Override
    public Optional<Trait> trait(String name) {
      return Optional.ofNullable(s.traits.get(name));
    }

    @Override
    public List<Trait> traits() {
      return List.copyOf(s.traits.values());
    }

    @Override
    public Optional<Consumer> consumer(String uuid) {
      return Optional.ofNullable(s.consumers.get(uuid));
    }

    @Override
    public List<Consumer> consumers() {
      return List.copyOf(s.consumers.values());
    }

    @Override
    public List<Allocation> allocationsOf(String consumerUuid) {
      return s.allocations.getOrDefault(consumerUuid, List.of());
    }

    @Override
    public List<Allocation> allocationsAgainst(String providerUuid) {
      List<Allocation> out = new ArrayList<>();
      for (List<Allocation> allocs : s.allocations.values()) {
        for (Allocation a : allocs) {
          if (a.providerUuid().equals(providerUuid)) {
            out.add(a);
          }
        }
      }
      return out;
    }

    @Override
    public void insertProvider(ResourceProvider provider) {
      checkWritable();
      if (s.providers.containsKey(provider.uuid())) {
        throw new DuplicateKeyException("resource provider", provider.uuid());
      }
      if (s.providerNames.containsKey(provider.name())) {
        throw new DuplicateKeyException("resource provider name", provider.name());
      }
      if (provider.parentUuid() != null) {
        requireProvider(provider.parentUuid());
      }
      s.providers.put(provider.uuid(), provider);
      s.providerNames.put(provider.name(), provider.uuid());
    }

    @Override
    public void updateProvider(ResourceProvider provider) {
      checkWritable();
      ResourceProvider cur = requireProvider(provider.uuid());
      if (!cur.name().equals(provider.name())) {
        if (s.providerNames.containsKey(provider.name())) {
          throw new DuplicateKeyException("resource provider name", provider.name());
        }
        s.providerNames.remove(cur.name());
        s.providerNames.put(provider.name(), provider.uuid());
      }
      if (provider.parentUuid() != null) {
        requireProvider(provider.parentUuid());
      }
      s.providers.put(provider.uuid(), provider);
    }

    @Override
    public void deleteProvider(String uuid) {
      checkWritable();
      ResourceProvider cur = requireProvider(uuid);
      s.providers.remove(uuid);
      s.providerNames.remove(cur.name());
      s.inventories.remove(uuid);
      s.providerTraits.remove(uuid);
      s.providerAggregates.remove(uuid);
    }

    @Override
    public void putInventory(Inventory inventory) {
      checkWritable();
      requireProvider(inventory.providerUuid());
      if (!s.resourceClasses.containsKey(inventory.resourceClass())) {
        throw new MissingEntityException("resource class", inventory.resourceClass());
      }
      s.inventories
          .computeIfAbsent(inventory.providerUuid(), k -> new LinkedHashMap<>())
          .put(inventory.resourceClass(), inventory);
    }

    @Override
    public void deleteInventory(String providerUuid, String resourceClass) {
      checkWritable();
      Map<String, Inventory> inv = s.inventories.get(providerUuid);
      if (inv == null || inv.remove(resourceClass) == null) {
        throw new MissingEntityException("inventory", providerUuid + "/" + resourceClass);
      }
    }

    @Override
    public void insertResourceClass(ResourceClass resourceClass) {
      checkWritable();
      if (s.resourceClasses.putIfAbsent(resourceClass.name(), resourceClass) != null) {
        throw new DuplicateKeyException("resource class", resourceClass.name());
      }
    }

    @Override
    public void deleteResourceClass(String name) {
      checkWritable();
      if (s.resourceClasses.remove(name) == null) {
        throw new MissingEntityException("resource class", name);
      }
    }

    @Override
    public void insertTrait(Trait trait) {
      checkWritable();
      if (s.traits.putIfAbsent(trait.name(), trait) != null) {
        throw new DuplicateKeyException("trait", trait.name());
      }
    }

    @Override
    public void deleteTrait(String name) {
      checkWritable();
      if (s.traits.remove(name) == null) {
        throw new MissingEntityException("trait", name);
      }
    }

    @Override
    public void replaceTraits(String providerUuid, Set<String> traits) {
      checkWritable();
      requireProvider(providerUuid);
      for (String t : traits) {
        if (!s.traits.containsKey(t)) {
          throw new MissingEntityException("trait", t);
        }
      }
      s.providerTraits.put(providerUuid, Set.copyOf(traits));
    }

    @Override
    public void replaceAggregates(String providerUuid, Set<String> aggregateUuids) {
      checkWritable();
      requireProvider(providerUuid);
      s.providerAggregates.put(providerUuid, Set.copyOf(aggregateUuids));
    }

    @Override
    public void insertConsumer(Consumer consumer) {
      checkWritable();
      if (s.consumers.putIfAbsent(consumer.uuid(), consumer) != null) {
        throw new DuplicateKeyException("consumer", consumer.uuid());
      }
    }

    @Override
    public void updateConsumer(Consumer consumer) {
      checkWritable();
      if (!s.consumers.containsKey(consumer.uuid())) {
        throw new MissingEntityException("consumer", consumer.uuid());
      }
      s.consumers.put(consumer.uuid(), consumer);
    }

    @Override
    public void deleteConsumer(String uuid) {
      checkWritable();
      if (s.consumers.remove(uuid) == null) {
        throw new MissingEntityException("consumer", uuid);
      }
      s.allocations.remove(uuid);
    }

    @Override
    public void replaceAllocations(String consumerUuid, List<Allocation> allocations) {
      checkWritable();
      if (!s.consumers.containsKey(consumerUuid)) {
        throw new MissingEntityException("consumer", consumerUuid);
      }
      for (Allocation a : allocations) {
        if (!a.consumerUuid().equals(consumerUuid)) {
          throw new IllegalArgumentException(
              "allocation for " + a.consumerUuid() + " written under " + consumerUuid);
        }
        requireProvider(a.providerUuid());
      }
      if (allocations.isEmpty()) {
        s.allocations.remove(consumerUuid);
      } else {
        s.allocations.put(consumerUuid, List.copyOf(allocations));
      }
    }
  }
}
