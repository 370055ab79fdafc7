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

package ai.floedb.placement.service.inventory;

import ai.floedb.placement.model.Inventory;
import java.util.Map;

/** All inventories of a provider, with the provider generation they were read at. */
public record InventorySet(
    String providerUuid, long generation, Map<String, Inventory> inventories) {

  public InventorySet {
    inventories = Map.copyOf(inventories);
  }
}
