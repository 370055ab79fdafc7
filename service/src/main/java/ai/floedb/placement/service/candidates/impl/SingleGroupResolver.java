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

import ai.floedb.placement.service.candidates.AllocationRequest;
import ai.floedb.placement.service.candidates.RequestGroup;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Fast path for a request with one group: providers that can serve every requested class on
 * their own, filtered by traits, aggregates, tree and root traits. Falls back to {@link
 * SharingComposer} when no single provider qualifies.
 */
public final class SingleGroupResolver {
  private static final Logger LOG = Logger.getLogger(SingleGroupResolver.class);

  private final SharingComposer sharing;

  public SingleGroupResolver(SharingComposer sharing) {
    this.sharing = sharing;
  }

  public List<AllocationRequest> resolve(SearchContext ctx, String groupKey, RequestGroup group) {
    Set<String> candidates = null;
    for (Map.Entry<String, Long> want : group.resources().entrySet()) {
      Set<String> serving = new LinkedHashSet<>();
      for (String providerUuid : ctx.tx().inventoriesOfClass(want.getKey()).keySet()) {
        if (ctx.canServe(providerUuid, want.getKey(), want.getValue())) {
          serving.add(providerUuid);
        }
      }
      if (candidates == null) {
        candidates = serving;
      } else {
        candidates.retainAll(serving);
      }
      LOG.debugf(
          "class=%s amount=%d serving=%d remaining=%d",
          want.getKey(), want.getValue(), serving.size(), candidates.size());
      if (candidates.isEmpty()) {
        break;
      }
    }

    List<AllocationRequest> out = new ArrayList<>();
    if (candidates != null) {
      for (String providerUuid : candidates) {
        if (ctx.passesFilters(providerUuid, group)) {
          out.add(
              new AllocationRequest(
                  Map.of(providerUuid, group.resources()),
                  Map.of(groupKey, List.of(providerUuid))));
        }
      }
    }
    if (!out.isEmpty()) {
      return out;
    }
    LOG.debugf("no single provider fits group '%s', trying sharing providers", groupKey);
    return sharing.compose(ctx, groupKey, group);
  }
}
