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

public record AllocationCandidates(
    List<AllocationRequest> allocationRequests, Map<String, ProviderSummary> providerSummaries) {

  public AllocationCandidates {
    allocationRequests = List.copyOf(allocationRequests);
    providerSummaries = Collections.unmodifiableMap(new LinkedHashMap<>(providerSummaries));
  }

  public static AllocationCandidates empty() {
    return new AllocationCandidates(List.of(), Map.of());
  }

  public boolean isEmpty() {
    return allocationRequests.isEmpty();
  }
}
