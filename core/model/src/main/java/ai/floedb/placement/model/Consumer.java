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

package ai.floedb.placement.model;

/**
 * An entity holding allocations. Project and user are external ids; type is an upper-snake label
 * such as {@code INSTANCE} or {@code MIGRATION}.
 */
public record Consumer(
    String uuid, long generation, String consumerType, String projectId, String userId) {

  public Consumer {
    Names.requireNonBlank("consumer_uuid", uuid);
    if (generation < 0) {
      throw new ModelValidationException("consumer_generation", "generation must be >= 0");
    }
    if (consumerType != null && !Names.isUpperSnake(consumerType)) {
      throw new ModelValidationException(
          "consumer_type", "consumer_type '" + consumerType + "' must match [A-Z0-9_]+");
    }
  }

  public static Consumer create(
      String uuid, String consumerType, String projectId, String userId) {
    return new Consumer(uuid, 0L, consumerType, projectId, userId);
  }

  public Consumer nextGeneration() {
    return new Consumer(uuid, generation + 1L, consumerType, projectId, userId);
  }

  /** Keeps current values where the incoming metadata is absent. */
  public Consumer mergeMetadata(String newType, String newProjectId, String newUserId) {
    return new Consumer(
        uuid,
        generation,
        newType != null ? newType : consumerType,
        newProjectId != null ? newProjectId : projectId,
        newUserId != null ? newUserId : userId);
  }
}
