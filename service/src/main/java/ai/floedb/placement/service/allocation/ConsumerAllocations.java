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

import ai.floedb.placement.model.ExpectedGeneration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Desired final allocation set of one consumer.
 *
 * <p>{@code allocations} maps provider uuid to resource class to amount. An empty map removes
 * the consumer. {@code consumerType}, {@code projectId} and {@code userId} are kept from the
 * stored consumer when null.
 */
public record ConsumerAllocations(
    String consumerUuid,
    ExpectedGeneration expected,
    Map<String, Map<String, Long>> allocations,
    String projectId,
    String userId,
    String consumerType) {

  public ConsumerAllocations {
    Objects.requireNonNull(consumerUuid, "consumerUuid");
    Objects.requireNonNull(expected, "expected");
    Map<String, Map<String, Long>> copy = new LinkedHashMap<>();
    if (allocations != null) {
      allocations.forEach((rp, byClass) -> copy.put(rp, Map.copyOf(byClass)));
    }
    allocations = Collections.unmodifiableMap(copy);
  }

  public static Builder builder(String consumerUuid, ExpectedGeneration expected) {
    return new Builder(consumerUuid, expected);
  }

  public static final class Builder {
    private final String consumerUuid;
    private final ExpectedGeneration expected;
    private final Map<String, Map<String, Long>> allocations = new LinkedHashMap<>();
    private String projectId;
    private String userId;
    private String consumerType;

    private Builder(String consumerUuid, ExpectedGeneration expected) {
      this.consumerUuid = consumerUuid;
      this.expected = expected;
    }

    public Builder allocate(String providerUuid, String resourceClass, long amount) {
      allocations
          .computeIfAbsent(providerUuid, k -> new LinkedHashMap<>())
          .put(resourceClass, amount);
      return this;
    }

    public Builder project(String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder user(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder type(String consumerType) {
      this.consumerType = consumerType;
      return this;
    }

    public ConsumerAllocations build() {
      return new ConsumerAllocations(
          consumerUuid, expected, allocations, projectId, userId, consumerType);
    }
  }
}
