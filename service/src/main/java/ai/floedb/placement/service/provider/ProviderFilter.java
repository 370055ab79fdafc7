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

package ai.floedb.placement.service.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Listing filter for providers. Every populated criterion must hold.
 *
 * <ul>
 *   <li>{@code name} and {@code uuid} are exact matches
 *   <li>{@code inTree} keeps providers sharing a root with the given provider
 *   <li>{@code memberOf} keeps members of at least one of the aggregates
 *   <li>{@code resources} keeps providers able to take each amount right now
 * </ul>
 */
public record ProviderFilter(
    String name,
    String uuid,
    String inTree,
    Set<String> memberOf,
    Set<String> requiredTraits,
    Set<String> forbiddenTraits,
    Map<String, Long> resources) {

  public ProviderFilter {
    memberOf = memberOf == null ? Set.of() : Set.copyOf(memberOf);
    requiredTraits = requiredTraits == null ? Set.of() : Set.copyOf(requiredTraits);
    forbiddenTraits = forbiddenTraits == null ? Set.of() : Set.copyOf(forbiddenTraits);
    resources = resources == null ? Map.of() : Map.copyOf(resources);
  }

  public static ProviderFilter all() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String uuid;
    private String inTree;
    private final Set<String> memberOf = new LinkedHashSet<>();
    private final Set<String> requiredTraits = new LinkedHashSet<>();
    private final Set<String> forbiddenTraits = new LinkedHashSet<>();
    private final Map<String, Long> resources = new LinkedHashMap<>();

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder uuid(String uuid) {
      this.uuid = uuid;
      return this;
    }

    public Builder inTree(String inTree) {
      this.inTree = inTree;
      return this;
    }

    public Builder memberOf(String... aggregates) {
      Collections.addAll(this.memberOf, aggregates);
      return this;
    }

    public Builder required(String... traits) {
      Collections.addAll(this.requiredTraits, traits);
      return this;
    }

    public Builder forbidden(String... traits) {
      Collections.addAll(this.forbiddenTraits, traits);
      return this;
    }

    public Builder resource(String resourceClass, long amount) {
      this.resources.put(resourceClass, amount);
      return this;
    }

    public ProviderFilter build() {
      return new ProviderFilter(
          name, uuid, inTree, memberOf, requiredTraits, forbiddenTraits, resources);
    }
  }
}
