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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One feasible proposal: provider uuid to class to amount, and the providers each request group
 * resolved to.
 */
public record AllocationRequest(
    Map<String, Map<String, Long>> allocations, Map<String, List<String>> mappings) {

  public AllocationRequest {
    Map<String, Map<String, Long>> a = new LinkedHashMap<>();
    allocations.forEach(
        (rp, byClass) -> a.put(rp, Collections.unmodifiableMap(new LinkedHashMap<>(byClass))));
    allocations = Collections.unmodifiableMap(a);
    Map<String, List<String>> m = new LinkedHashMap<>();
    mappings.forEach((group, providers) -> m.put(group, List.copyOf(providers)));
    mappings = Collections.unmodifiableMap(m);
  }

  /** Amount per class summed over providers. */
  public Map<String, Long> resourcesByClass() {
    Map<String, Long> out = new LinkedHashMap<>();
    for (Map<String, Long> byClass : allocations.values()) {
      byClass.forEach((rc, n) -> out.merge(rc, n, Long::sum));
    }
    return out;
  }
}
