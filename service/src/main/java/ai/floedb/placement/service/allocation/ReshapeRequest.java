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
import ai.floedb.placement.model.Inventory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inventory replacements for some providers and allocation replacements for some consumers,
 * committed together.
 */
public record ReshapeRequest(
    Map<String, InventoryReplacement> inventories, List<ConsumerAllocations> allocations) {

  public ReshapeRequest {
    inventories =
        inventories == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(inventories));
    allocations = allocations == null ? List.of() : List.copyOf(allocations);
  }

  /** Full inventory set for one provider, valid only at {@code expected}. */
  public record InventoryReplacement(ExpectedGeneration expected, List<Inventory> inventories) {

    public InventoryReplacement {
      Objects.requireNonNull(expected, "expected");
      inventories = inventories == null ? List.of() : List.copyOf(inventories);
    }
  }
}
