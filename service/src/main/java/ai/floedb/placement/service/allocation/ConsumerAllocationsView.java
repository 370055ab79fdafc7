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

package ai.floedb.placement.service.allocation;

import java.util.Map;

/**
 * Stored allocations of a consumer, provider uuid to class to amount. A consumer that does not
 * exist reads as an empty view with a null generation.
 */
public record ConsumerAllocationsView(
    String consumerUuid,
    Long generation,
    String consumerType,
    String projectId,
    String userId,
    Map<String, Map<String, Long>> allocations) {

  public boolean exists() {
    return generation != null;
  }
}
