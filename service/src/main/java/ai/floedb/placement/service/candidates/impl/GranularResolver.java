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
import ai.floedb.placement.service.candidates.AllocationRequest;
import ai.floedb.placement.service.candidates.CandidateRequest;
import ai.floedb.placement.service.candidates.GroupPolicy;
import ai.floedb.placement.service.candidates.RequestGroup;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Multi-group resolution, one candidate per tree at most.
 *
 * <p>For each root passing the root-trait constraints, every group gets the ordered list of
 * in-tree providers that pass its filters and capacity on their own. A tree where some group has
 * no provider is dropped. Otherwise the per-group lists are walked as a cross-product in
 * odometer order, last group fastest, and the first combination that satisfies isolation,
 * same-subtree and the summed capacity of groups sharing a provider becomes the tree's candidate.
 * At most {@code maxCombinations} combinations are tried per tree.
 */
public final class GranularResolver {
  private static final Logger LOG = Logger.getLogger(GranularResolver.class);

  private final int maxCombinations;

  public GranularResolver(int maxCombinations) {
    this.maxCombinations = maxCombinations;
  }

  public List<AllocationRequest> resolve(SearchContext ctx) {
    CandidateRequest request = ctx.request();
    List<String> keys = new ArrayList<>(request.groups().keySet());
    List<AllocationRequest> out = new ArrayList<>();

    for (ResourceProvider root : ctx.tx().roots()) {
      if (!ctx.rootTraitsSatisfied(root.uuid())) {
        continue;
      }
      List<List<String>> perGroup = new ArrayList<>(keys.size());
      boolean complete = true;
      for (String key : keys) {
        List<String> qualifying = qualifying(ctx, root.uuid(), request.groups().get(key));
        if (qualifying.isEmpty()) {
          LOG.debugf("tree=%s group='%s' has no qualifying provider", root.uuid(), key);
          complete = false;
          break;
        }
        perGroup.add(qualifying);
      }
      if (!complete) {
        continue;
      }
      Optional<Map<String, String>> chosen = firstValidCombination(ctx, keys, perGroup);
      chosen.ifPresent(choice -> out.add(toAllocationRequest(request, keys, choice)));
    }
    return out;
  }

  private static List<String> qualifying(SearchContext ctx, String rootUuid, RequestGroup group) {
    List<String> out = new ArrayList<>();
    for (ResourceProvider rp : ctx.tree(rootUuid)) {
      if (ctx.passesFilters(rp.uuid(), group) && ctx.canServeAll(rp.uuid(), group.resources())) {
        out.add(rp.uuid());
      }
    }
    return out;
  }

  private Optional<Map<String, String>> firstValidCombination(
      SearchContext ctx, List<String> keys, List<List<String>> perGroup) {
    int[] index = new int[keys.size()];
    int tried = 0;
    while (tried < maxCombinations) {
      tried++;
      Map<String, String> choice = new LinkedHashMap<>();
      for (int i = 0; i < keys.size(); i++) {
        choice.put(keys.get(i), perGroup.get(i).get(index[i]));
      }
      if (isolated(ctx.request(), choice)
          && sameSubtree(ctx, choice)
          && consolidatedCapacityFits(ctx, choice)) {
        return Optional.of(choice);
      }
      if (!advance(index, perGroup)) {
        return Optional.empty();
      }
    }
    LOG.warnf("stopped after %d combinations without a valid one", tried);
    return Optional.empty();
  }

  private static boolean advance(int[] index, List<List<String>> perGroup) {
    for (int i = index.length - 1; i >= 0; i--) {
      index[i]++;
      if (index[i] < perGroup.get(i).size()) {
        return true;
      }
      index[i] = 0;
    }
    return false;
  }

  private static boolean isolated(CandidateRequest request, Map<String, String> choice) {
    if (request.groupPolicy() != GroupPolicy.ISOLATE) {
      return true;
    }
    Set<String> used = new HashSet<>();
    for (Map.Entry<String, String> e : choice.entrySet()) {
      if (CandidateRequest.isNamed(e.getKey()) && !used.add(e.getValue())) {
        return false;
      }
    }
    return true;
  }

  /** One of the chosen providers of each set must be an ancestor-or-self of all the others. */
  private static boolean sameSubtree(SearchContext ctx, Map<String, String> choice) {
    for (Set<String> groupKeys : ctx.request().sameSubtree()) {
      Set<String> providers = new HashSet<>();
      for (String key : groupKeys) {
        providers.add(choice.get(key));
      }
      boolean anchored = false;
      for (String anchor : providers) {
        boolean coversAll = true;
        for (String other : providers) {
          if (!ctx.isAncestorOrSelf(anchor, other)) {
            coversAll = false;
            break;
          }
        }
        if (coversAll) {
          anchored = true;
          break;
        }
      }
      if (!anchored) {
        return false;
      }
    }
    return true;
  }

  private static boolean consolidatedCapacityFits(SearchContext ctx, Map<String, String> choice) {
    Map<String, Map<String, Long>> merged = consolidate(ctx.request(), choice);
    for (Map.Entry<String, Map<String, Long>> byProvider : merged.entrySet()) {
      for (Map.Entry<String, Long> byClass : byProvider.getValue().entrySet()) {
        Optional<Inventory> inv = ctx.tx().inventory(byProvider.getKey(), byClass.getKey());
        long used = ctx.used(byProvider.getKey(), byClass.getKey());
        if (inv.isEmpty() || !inv.get().canAllocate(byClass.getValue(), used)) {
          return false;
        }
      }
    }
    return true;
  }

  private static Map<String, Map<String, Long>> consolidate(
      CandidateRequest request, Map<String, String> choice) {
    Map<String, Map<String, Long>> merged = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : choice.entrySet()) {
      RequestGroup group = request.groups().get(e.getKey());
      for (Map.Entry<String, Long> want : group.resources().entrySet()) {
        merged
            .computeIfAbsent(e.getValue(), k -> new LinkedHashMap<>())
            .merge(want.getKey(), want.getValue(), Long::sum);
      }
    }
    return merged;
  }

  private static AllocationRequest toAllocationRequest(
      CandidateRequest request, List<String> keys, Map<String, String> choice) {
    Map<String, List<String>> mappings = new LinkedHashMap<>();
    for (String key : keys) {
      mappings.put(key, List.of(choice.get(key)));
    }
    return new AllocationRequest(consolidate(request, choice), mappings);
  }
}
