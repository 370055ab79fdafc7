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

import java.util.Map;
import java.util.Set;

/** Capacity, traits and position of a provider referenced by the candidates. */
public record ProviderSummary(
    String uuid,
    long generation,
    String parentUuid,
    String rootUuid,
    Set<String> traits,
    Map<String, ResourceUsage> resources) {

  public ProviderSummary {
    traits = Set.copyOf(traits);
    resources = Map.copyOf(resources);
  }
}
