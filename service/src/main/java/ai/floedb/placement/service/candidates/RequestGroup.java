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
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One request group: what a single provider (or, for the default group, a tree plus a sharing
 * provider) must offer.
 *
 * <ul>
 *   <li>{@code resources}: class to requested amount; empty for a resourceless group
 *   <li>{@code anyOfTraits}: the provider needs at least one trait out of each set
 *   <li>{@code memberOf}: the provider needs membership in at least one aggregate of each set
 *   <li>{@code inTree}: the provider must share a root with this provider
 * </ul>
 */
public record RequestGroup(
    Map<String, Long> resources,
    Set<String> requiredTraits,
    Set<String> forbiddenTraits,
    List<Set<String>> anyOfTraits,
    List<Set<String>> memberOf,
    Set<String> forbiddenAggregates,
    String inTree) {

  public RequestGroup {
    resources =
        resources == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    requiredTraits = copy(requiredTraits, false);
    forbiddenTraits = copy(forbiddenTraits, false);
    anyOfTraits = copyAll(anyOfTraits, false);
    memberOf = copyAll(memberOf, true);
    forbiddenAggregates = copy(forbiddenAggregates, true);
  }

  // aggregate uuids are stored lower case
  private static Set<String> copy(Set<String> in, boolean lowerCase) {
    if (in == null) {
      return Set.of();
    }
    Set<String> out = new LinkedHashSet<>();
    for (String s : in) {
      out.add(lowerCase ? s.toLowerCase(Locale.ROOT) : s);
    }
    return Collections.unmodifiableSet(out);
  }

  private static List<Set<String>> copyAll(List<Set<String>> in, boolean lowerCase) {
    if (in == null) {
      return List.of();
    }
    List<Set<String>> out = new ArrayList<>(in.size());
    for (Set<String> s : in) {
      out.add(copy(s, lowerCase));
    }
    return Collections.unmodifiableList(out);
  }

  public boolean isResourceless() {
    return resources.isEmpty();
  }

  /** Every trait name the group mentions, for catalog validation. */
  public Set<String> mentionedTraits() {
    Set<String> out = new LinkedHashSet<>(requiredTraits);
    out.addAll(forbiddenTraits);
    anyOfTraits.forEach(out::addAll);
    return out;
  }

  public Set<String> mentionedAggregates() {
    Set<String> out = new LinkedHashSet<>(forbiddenAggregates);
    memberOf.forEach(out::addAll);
    return out;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Long> resources = new LinkedHashMap<>();
    private final Set<String> required = new LinkedHashSet<>();
    private final Set<String> forbidden = new LinkedHashSet<>();
    private final List<Set<String>> anyOf = new ArrayList<>();
    private final List<Set<String>> memberOf = new ArrayList<>();
    private final Set<String> forbiddenAggregates = new LinkedHashSet<>();
    private String inTree;

    private Builder() {}

    public Builder resource(String resourceClass, long amount) {
      resources.put(resourceClass, amount);
      return this;
    }

    public Builder required(String... traits) {
      Collections.addAll(required, traits);
      return this;
    }

    public Builder forbidden(String... traits) {
      Collections.addAll(forbidden, traits);
      return this;
    }

    public Builder anyOf(String... traits) {
      anyOf.add(new LinkedHashSet<>(List.of(traits)));
      return this;
    }

    public Builder memberOf(String... aggregates) {
      memberOf.add(new LinkedHashSet<>(List.of(aggregates)));
      return this;
    }

    public Builder notMemberOf(String... aggregates) {
      Collections.addAll(forbiddenAggregates, aggregates);
      return this;
    }

    public Builder inTree(String providerUuid) {
      this.inTree = providerUuid;
      return this;
    }

    public RequestGroup build() {
      return new RequestGroup(
          resources, required, forbidden, anyOf, memberOf, forbiddenAggregates, inTree);
    }
  }
}
