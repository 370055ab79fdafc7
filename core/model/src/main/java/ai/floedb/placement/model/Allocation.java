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

/** Claim of {@code used} units of one provider inventory by one consumer. */
public record Allocation(
    String consumerUuid, String providerUuid, String resourceClass, long used) {

  public Allocation {
    Names.requireNonBlank("consumer_uuid", consumerUuid);
    Names.requireNonBlank("resource_provider_uuid", providerUuid);
    Names.requireNonBlank("resource_class", resourceClass);
    if (used < 1) {
      throw new ModelValidationException(
          "used", "allocation of " + resourceClass + " must be >= 1, got " + used);
    }
  }

  public InventoryRef inventoryRef() {
    return new InventoryRef(providerUuid, resourceClass);
  }
}
