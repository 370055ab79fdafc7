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
import ai.floedb.placement.service.candidates.ProviderSummary;
import ai.floedb.placement.service.candidates.ResourceUsage;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Builds provider summaries for the providers a set of candidates references. */
public final class SummaryBuilder {

  private SummaryBuilder() {}

  public static Map<String, ProviderSummary> summarize(
      SearchContext ctx, List<AllocationRequest> candidates) {
    Set<String> referenced = new LinkedHashSet<>();
    for (AllocationRequest ar : candidates) {
      referenced.addAll(ar.allocations().keySet());
      ar.mappings().values().forEach(referenced::addAll);
    }
    if (ctx.request().expandTrees()) {
      Set<String> roots = new LinkedHashSet<>();
      for (String uuid : referenced) {
        roots.add(ctx.rootOf(uuid));
      }
      for (String root : roots) {
        for (ResourceProvider rp : ctx.tree(root)) {
          referenced.add(rp.uuid());
        }
      }
    }

    Map<String, ProviderSummary> out = new LinkedHashMap<>();
    for (String uuid : referenced) {
      ctx.tx().provider(uuid).ifPresent(rp -> out.put(uuid, summarize(ctx, rp)));
    }
    return out;
  }

  private static ProviderSummary summarize(SearchContext ctx, ResourceProvider rp) {
    Map<String, ResourceUsage> resources = new LinkedHashMap<>();
    for (Inventory inv : ctx.tx().inventories(rp.uuid()).values()) {
      String rc = inv.resourceClass();
      resources.put(rc, new ResourceUsage(inv.capacity(), ctx.used(rp.uuid(), rc)));
    }
    return new ProviderSummary(
        rp.uuid(),
        rp.generation(),
        rp.parentUuid(),
        ctx.rootOf(rp.uuid()),
        ctx.traitsOf(rp.uuid()),
        resources);
  }
}
