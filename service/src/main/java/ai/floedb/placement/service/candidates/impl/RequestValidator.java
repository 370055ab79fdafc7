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

import static ai.floedb.placement.service.error.impl.PlacementErrors.params;

import ai.floedb.placement.model.Names;
import ai.floedb.placement.service.candidates.CandidateRequest;
import ai.floedb.placement.service.candidates.RequestGroup;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyReader;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Structural and catalog checks run before any search work. */
public final class RequestValidator {

  private RequestValidator() {}

  public static void validate(TopologyReader tx, CandidateRequest request) {
    if (request.limit() != null && request.limit() < 1) {
      throw PlacementErrors.invalid(
          "limit", params("field", "limit", "limit", request.limit().toString()));
    }

    Set<String> unknownTraits = new TreeSet<>();
    collectUnknownTraits(tx, request.rootRequiredTraits(), unknownTraits);
    collectUnknownTraits(tx, request.rootForbiddenTraits(), unknownTraits);

    boolean anyResources = false;
    for (Map.Entry<String, RequestGroup> e : request.groups().entrySet()) {
      String key = e.getKey();
      RequestGroup group = e.getValue();
      for (Map.Entry<String, Long> want : group.resources().entrySet()) {
        if (tx.resourceClass(want.getKey()).isEmpty()) {
          throw PlacementErrors.invalid(
              "unknown_resource_class", params("field", "resources", "id", want.getKey()));
        }
        if (want.getValue() == null || want.getValue() < 1) {
          throw PlacementErrors.invalid(
              "amount",
              params(
                  "field",
                  "resources",
                  "group",
                  key,
                  "resource_class",
                  want.getKey(),
                  "amount",
                  String.valueOf(want.getValue())));
        }
        anyResources = true;
      }
      collectUnknownTraits(tx, group.mentionedTraits(), unknownTraits);

      Set<String> conflicting = new TreeSet<>(group.requiredTraits());
      conflicting.retainAll(group.forbiddenTraits());
      if (!conflicting.isEmpty()) {
        throw PlacementErrors.invalid(
            "conflicting_traits",
            params("field", "required", "group", key, "id", String.join(", ", conflicting)));
      }

      for (String agg : group.mentionedAggregates()) {
        if (!Names.isUuid(agg)) {
          throw PlacementErrors.invalid("aggregate_uuid", params("field", "member_of", "id", agg));
        }
      }

      if (group.inTree() != null && tx.provider(group.inTree()).isEmpty()) {
        throw PlacementErrors.invalid(
            "field",
            params(
                "field",
                "in_tree",
                "detail",
                "No resource provider with uuid " + group.inTree() + " found for in_tree."));
      }
    }

    if (!unknownTraits.isEmpty()) {
      throw PlacementErrors.invalid(
          "unknown_trait", params("field", "required", "id", String.join(", ", unknownTraits)));
    }
    if (!anyResources) {
      throw PlacementErrors.invalid("no_resources", params("field", "resources"));
    }

    long named = request.groups().keySet().stream().filter(CandidateRequest::isNamed).count();
    if (named > 1 && request.groupPolicy() == null) {
      throw PlacementErrors.invalid("group_policy_required", params("field", "group_policy"));
    }

    Set<String> inSubtree = new HashSet<>();
    for (Set<String> keys : request.sameSubtree()) {
      for (String key : keys) {
        if (!request.groups().containsKey(key)) {
          throw PlacementErrors.invalid(
              "same_subtree_unknown_group", params("field", "same_subtree", "group", key));
        }
      }
      inSubtree.addAll(keys);
    }
    for (Map.Entry<String, RequestGroup> e : request.groups().entrySet()) {
      if (e.getValue().isResourceless() && !inSubtree.contains(e.getKey())) {
        throw PlacementErrors.invalid(
            "resourceless_group", params("field", "resources", "group", e.getKey()));
      }
    }
  }

  private static void collectUnknownTraits(
      TopologyReader tx, Set<String> traits, Set<String> unknown) {
    for (String t : new LinkedHashSet<>(traits)) {
      if (tx.trait(t).isEmpty()) {
        unknown.add(t);
      }
    }
  }
}
