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

import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.candidates.AllocationRequest;
import ai.floedb.placement.service.candidates.RequestGroup;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Tree plus sharing provider composition.
 *
 * <p>Per tree root, each requested class goes to an in-tree provider able to serve it. Classes no
 * tree provider can serve must all fit on one sharing provider: a provider outside the tree that
 * carries the sharing trait, is a member of an aggregate some tree provider belongs to and passes
 * the group's aggregate filters. Contributing providers must be enabled and free of forbidden
 * traits; required and any-of traits are checked on the union of their traits, so the possible
 * server choices are walked in odometer order, last class fastest and the sharing provider last,
 * until one satisfies them. At most {@code maxCombinations} choices are tried per tree. Aggregate
 * and tree filters also apply to the root.
 */
public final class SharingComposer {
  private static final Logger LOG = Logger.getLogger(SharingComposer.class);

  private final String sharingTrait;
  private final int maxCombinations;

  public SharingComposer(String sharingTrait, int maxCombinations) {
    this.sharingTrait = sharingTrait;
    this.maxCombinations = maxCombinations;
  }

  public List<AllocationRequest> compose(SearchContext ctx, String groupKey, RequestGroup group) {
    List<AllocationRequest> out = new ArrayList<>();
    for (ResourceProvider root : ctx.tx().roots()) {
      AllocationRequest composed = composeTree(ctx, groupKey, group, root.uuid());
      if (composed != null) {
        out.add(composed);
      }
    }
    return out;
  }

  private AllocationRequest composeTree(
      SearchContext ctx, String groupKey, RequestGroup group, String rootUuid) {
    if (!ctx.rootTraitsSatisfied(rootUuid)
        || !ctx.inRequiredTree(rootUuid, group)
        || !SearchContext.aggregatesSatisfy(ctx.aggregatesOf(rootUuid), group)) {
      return null;
    }

    List<ResourceProvider> tree = ctx.tree(rootUuid);
    Set<String> treeUuids = new HashSet<>();
    Set<String> treeAggregates = new HashSet<>();
    for (ResourceProvider rp : tree) {
      treeUuids.add(rp.uuid());
      treeAggregates.addAll(ctx.aggregatesOf(rp.uuid()));
    }

    List<String> served = new ArrayList<>();
    List<List<String>> servers = new ArrayList<>();
    Map<String, Long> unmet = new LinkedHashMap<>();
    for (Map.Entry<String, Long> want : group.resources().entrySet()) {
      List<String> able = treeServers(ctx, group, tree, want.getKey(), want.getValue());
      if (able.isEmpty()) {
        unmet.put(want.getKey(), want.getValue());
      } else {
        served.add(want.getKey());
        servers.add(able);
      }
    }
    if (served.isEmpty()) {
      return null;
    }

    List<List<String>> dimensions = new ArrayList<>(servers);
    if (!unmet.isEmpty()) {
      List<String> sharing = sharingProviders(ctx, group, treeUuids, treeAggregates, unmet);
      if (sharing.isEmpty()) {
        LOG.debugf("tree=%s unmet=%s and no sharing provider", rootUuid, unmet.keySet());
        return null;
      }
      dimensions.add(sharing);
    }

    List<String> choice = firstTraitComplete(ctx, group, dimensions);
    if (choice == null) {
      LOG.debugf("tree=%s has no composition carrying the requested traits", rootUuid);
      return null;
    }

    Map<String, String> assigned = new LinkedHashMap<>();
    for (int i = 0; i < served.size(); i++) {
      assigned.put(served.get(i), choice.get(i));
    }
    String sharingUuid = unmet.isEmpty() ? null : choice.get(served.size());
    for (String rc : unmet.keySet()) {
      assigned.put(rc, sharingUuid);
    }

    Map<String, Map<String, Long>> allocations = new LinkedHashMap<>();
    for (Map.Entry<String, String> a : assigned.entrySet()) {
      allocations
          .computeIfAbsent(a.getValue(), k -> new LinkedHashMap<>())
          .put(a.getKey(), group.resources().get(a.getKey()));
    }
    Set<String> contributors = new LinkedHashSet<>(assigned.values());
    LOG.debugf("tree=%s composed providers=%s sharing=%s", rootUuid, contributors, sharingUuid);
    return new AllocationRequest(allocations, Map.of(groupKey, List.copyOf(contributors)));
  }

  private static List<String> treeServers(
      SearchContext ctx, RequestGroup group, List<ResourceProvider> tree, String rc, long amount) {
    List<String> out = new ArrayList<>();
    for (ResourceProvider rp : tree) {
      if (!rp.disabled()
          && SearchContext.hasNoForbidden(ctx.traitsOf(rp.uuid()), group)
          && ctx.canServe(rp.uuid(), rc, amount)) {
        out.add(rp.uuid());
      }
    }
    return out;
  }

  private List<String> sharingProviders(
      SearchContext ctx,
      RequestGroup group,
      Set<String> treeUuids,
      Set<String> treeAggregates,
      Map<String, Long> unmet) {
    List<String> out = new ArrayList<>();
    if (treeAggregates.isEmpty()) {
      return out;
    }
    for (String candidate : ctx.tx().providersWithTrait(sharingTrait)) {
      if (treeUuids.contains(candidate) || !ctx.isEnabled(candidate)) {
        continue;
      }
      Set<String> aggregates = ctx.aggregatesOf(candidate);
      if (!SearchContext.intersects(aggregates, treeAggregates)
          || !SearchContext.aggregatesSatisfy(aggregates, group)) {
        continue;
      }
      if (!SearchContext.hasNoForbidden(ctx.traitsOf(candidate), group)) {
        continue;
      }
      if (ctx.canServeAll(candidate, unmet)) {
        out.add(candidate);
      }
    }
    return out;
  }

  /** First server choice, one entry per dimension, whose union of traits satisfies the group. */
  private List<String> firstTraitComplete(
      SearchContext ctx, RequestGroup group, List<List<String>> dimensions) {
    int[] index = new int[dimensions.size()];
    int tried = 0;
    while (tried < maxCombinations) {
      tried++;
      List<String> choice = new ArrayList<>(dimensions.size());
      Set<String> unionTraits = new HashSet<>();
      for (int i = 0; i < index.length; i++) {
        String uuid = dimensions.get(i).get(index[i]);
        choice.add(uuid);
        unionTraits.addAll(ctx.traitsOf(uuid));
      }
      if (unionTraits.containsAll(group.requiredTraits())
          && SearchContext.anyOfSatisfied(unionTraits, group.anyOfTraits())) {
        return choice;
      }
      if (!advance(index, dimensions)) {
        return null;
      }
    }
    LOG.warnf("stopped after %d compositions without the requested traits", tried);
    return null;
  }

  private static boolean advance(int[] index, List<List<String>> dimensions) {
    for (int i = index.length - 1; i >= 0; i--) {
      index[i]++;
      if (index[i] < dimensions.get(i).size()) {
        return true;
      }
      index[i] = 0;
    }
    return false;
  }
}
