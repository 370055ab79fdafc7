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

package ai.floedb.placement.service.candidates.impl;

import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.candidates.CandidateRequest;
import ai.floedb.placement.service.candidates.RequestGroup;
import ai.floedb.placement.storage.spi.TopologyReader;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-search view over one read transaction. Memoizes roots, traits, aggregates and usage so the
 * resolvers can ask the same question many times while walking trees.
 */
public final class SearchContext {
  private final TopologyReader tx;
  private final CandidateRequest request;
  private final Map<String, String> roots = new HashMap<>();
  private final Map<String, Long> usage = new HashMap<>();
  private final Map<String, List<ResourceProvider>> trees = new HashMap<>();

  public SearchContext(TopologyReader tx, CandidateRequest request) {
    this.tx = tx;
    this.request = request;
  }

  public TopologyReader tx() {
    return tx;
  }

  public CandidateRequest request() {
    return request;
  }

  public String rootOf(String providerUuid) {
    return roots.computeIfAbsent(providerUuid, tx::rootOf);
  }

  public List<ResourceProvider> tree(String rootUuid) {
    return trees.computeIfAbsent(rootUuid, tx::providersInTree);
  }

  public Set<String> traitsOf(String providerUuid) {
    return tx.traitsOf(providerUuid);
  }

  public Set<String> aggregatesOf(String providerUuid) {
    return tx.aggregatesOf(providerUuid);
  }

  public boolean isEnabled(String providerUuid) {
    return tx.provider(providerUuid).map(rp -> !rp.disabled()).orElse(false);
  }

  public long used(String providerUuid, String resourceClass) {
    return usage.computeIfAbsent(
        providerUuid + "/" + resourceClass, k -> tx.usage(providerUuid, resourceClass));
  }

  /** Quantization plus available capacity for a single allocation of {@code amount}. */
  public boolean canServe(String providerUuid, String resourceClass, long amount) {
    Optional<Inventory> inv = tx.inventory(providerUuid, resourceClass);
    return inv.isPresent() && inv.get().canAllocate(amount, used(providerUuid, resourceClass));
  }

  public boolean canServeAll(String providerUuid, Map<String, Long> resources) {
    for (Map.Entry<String, Long> e : resources.entrySet()) {
      if (!canServe(providerUuid, e.getKey(), e.getValue())) {
        return false;
      }
    }
    return true;
  }

  /** Required, forbidden and any-of trait checks against a trait set. */
  public static boolean traitsSatisfy(Set<String> traits, RequestGroup group) {
    if (!traits.containsAll(group.requiredTraits())) {
      return false;
    }
    return hasNoForbidden(traits, group) && anyOfSatisfied(traits, group.anyOfTraits());
  }

  public static boolean hasNoForbidden(Set<String> traits, RequestGroup group) {
    return !intersects(traits, group.forbiddenTraits());
  }

  public static boolean anyOfSatisfied(Set<String> traits, List<Set<String>> anyOf) {
    for (Set<String> oneOf : anyOf) {
      if (!intersects(traits, oneOf)) {
        return false;
      }
    }
    return true;
  }

  /** AND-of-OR membership plus forbidden aggregates. */
  public static boolean aggregatesSatisfy(Set<String> aggregates, RequestGroup group) {
    for (Set<String> oneOf : group.memberOf()) {
      if (!intersects(aggregates, oneOf)) {
        return false;
      }
    }
    return !intersects(aggregates, group.forbiddenAggregates());
  }

  public boolean inRequiredTree(String providerUuid, RequestGroup group) {
    return group.inTree() == null || rootOf(group.inTree()).equals(rootOf(providerUuid));
  }

  public boolean rootTraitsSatisfied(String rootUuid) {
    Set<String> traits = traitsOf(rootUuid);
    return traits.containsAll(request.rootRequiredTraits())
        && !intersects(traits, request.rootForbiddenTraits());
  }

  /** Every per-provider filter of the group except capacity. */
  public boolean passesFilters(String providerUuid, RequestGroup group) {
    return isEnabled(providerUuid)
        && traitsSatisfy(traitsOf(providerUuid), group)
        && aggregatesSatisfy(aggregatesOf(providerUuid), group)
        && inRequiredTree(providerUuid, group)
        && rootTraitsSatisfied(rootOf(providerUuid));
  }

  /** True when {@code ancestor} is {@code providerUuid} or one of its ancestors. */
  public boolean isAncestorOrSelf(String ancestor, String providerUuid) {
    return ancestor.equals(providerUuid) || tx.ancestors(providerUuid).contains(ancestor);
  }

  static boolean intersects(Collection<String> a, Collection<String> b) {
    for (String x : b) {
      if (a.contains(x)) {
        return true;
      }
    }
    return false;
  }
}
