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

import java.util.Objects;

/**
 * A node of the provider forest.
 *
 * <p>{@code parentUuid} is null for a root provider. The root of any provider is derived by
 * walking parents, it is never stored on the record.
 */
public record ResourceProvider(
    String uuid, String name, long generation, String parentUuid, boolean disabled) {

  public ResourceProvider {
    Names.requireNonBlank("uuid", uuid);
    Names.requireNonBlank("name", name);
    if (name.length() > Names.MAX_PROVIDER_NAME_LENGTH) {
      throw new ModelValidationException(
          "name",
          "name must be at most " + Names.MAX_PROVIDER_NAME_LENGTH + " characters");
    }
    if (generation < 0) {
      throw new ModelValidationException("generation", "generation must be >= 0");
    }
    if (uuid.equals(parentUuid)) {
      throw new ModelValidationException(
          "parent_provider_uuid", "provider cannot be its own parent");
    }
  }

  public static ResourceProvider create(String uuid, String name, String parentUuid) {
    return new ResourceProvider(uuid, name, 0L, parentUuid, false);
  }

  public boolean isRoot() {
    return parentUuid == null;
  }

  public ResourceProvider withName(String newName) {
    return new ResourceProvider(uuid, newName, generation, parentUuid, disabled);
  }

  public ResourceProvider withParent(String newParentUuid) {
    return new ResourceProvider(uuid, name, generation, newParentUuid, disabled);
  }

  public ResourceProvider withDisabled(boolean newDisabled) {
    return new ResourceProvider(uuid, name, generation, parentUuid, newDisabled);
  }

  public ResourceProvider nextGeneration() {
    return new ResourceProvider(uuid, name, generation + 1L, parentUuid, disabled);
  }

  public boolean sameParent(String otherParentUuid) {
    return Objects.equals(parentUuid, otherParentUuid);
  }
}
