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

package ai.floedb.placement.service.candidates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured allocation-candidate query.
 *
 * <p>{@code groups} is keyed by group key, {@link #DEFAULT_GROUP} being the unnumbered group.
 * {@code limit} null means no request-level cap. {@code sameSubtree} lists sets of group keys
 * whose providers must sit in one subtree. Root traits constrain the root of every candidate
 * tree. {@code expandTrees} adds every provider of a candidate's trees to the summaries.
 */
public record CandidateRequest(
    Map<String, RequestGroup> groups,
    Integer limit,
    GroupPolicy groupPolicy,
    List<Set<String>> sameSubtree,
    Set<String> rootRequiredTraits,
    Set<String> rootForbiddenTraits,
    boolean expandTrees) {

  public static final String DEFAULT_GROUP = "";

  public CandidateRequest {
    groups =
        groups == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    List<Set<String>> subtrees = new ArrayList<>();
    if (sameSubtree != null) {
      sameSubtree.forEach(s -> subtrees.add(Collections.unmodifiableSet(new LinkedHashSet<>(s))));
    }
    sameSubtree = Collections.unmodifiableList(subtrees);
    rootRequiredTraits = rootRequiredTraits == null ? Set.of() : Set.copyOf(rootRequiredTraits);
    rootForbiddenTraits = rootForbiddenTraits == null ? Set.of() : Set.copyOf(rootForbiddenTraits);
  }

  public static boolean isNamed(String groupKey) {
    return !DEFAULT_GROUP.equals(groupKey);
  }

  /**
   * Requested amount per class summed over every group, the flat view used by callers that
   * predate request groups.
   */
  public Map<String, Long> totalResources() {
    Map<String, Long> out = new LinkedHashMap<>();
    for (RequestGroup g : groups.values()) {
      g.resources().forEach((rc, amount) -> out.merge(rc, amount, Long::sum));
    }
    return out;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, RequestGroup> groups = new LinkedHashMap<>();
    private final List<Set<String>> sameSubtree = new ArrayList<>();
    private final Set<String> rootRequired = new LinkedHashSet<>();
    private final Set<String> rootForbidden = new LinkedHashSet<>();
    private Integer limit;
    private GroupPolicy groupPolicy;
    private boolean expandTrees;

    private Builder() {}

    public Builder defaultGroup(RequestGroup group) {
      return group(DEFAULT_GROUP, group);
    }

    public Builder group(String key, RequestGroup group) {
      groups.put(key, group);
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public Builder groupPolicy(GroupPolicy groupPolicy) {
      this.groupPolicy = groupPolicy;
      return this;
    }

    public Builder sameSubtree(String... groupKeys) {
      sameSubtree.add(new LinkedHashSet<>(List.of(groupKeys)));
      return this;
    }

    public Builder rootRequired(String... traits) {
      Collections.addAll(rootRequired, traits);
      return this;
    }

    public Builder rootForbidden(String... traits) {
      Collections.addAll(rootForbidden, traits);
      return this;
    }

    public Builder expandTrees(boolean expandTrees) {
      this.expandTrees = expandTrees;
      return this;
    }

    public CandidateRequest build() {
      return new CandidateRequest(
          groups, limit, groupPolicy, sameSubtree, rootRequired, rootForbidden, expandTrees);
    }
  }
}
