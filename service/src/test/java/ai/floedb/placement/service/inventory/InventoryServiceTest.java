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

import static ai.floedb.placement.model.StandardResourceClasses.DISK_GB;
import static ai.floedb.placement.model.StandardResourceClasses.MEMORY_MB;
import static ai.floedb.placement.model.StandardResourceClasses.VCPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.GenerationConflictException;
import ai.floedb.placement.service.error.InUseException;
import ai.floedb.placement.service.error.InvalidRequestException;
import ai.floedb.placement.service.error.NotFoundException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InventoryServiceTest {

  private TopologyFixture fx;
  private InventoryService inventories;
  private String host;

  @BeforeEach
  void setUp() {
    fx = new TopologyFixture();
    inventories = fx.inventories;
    host = fx.root("host-1");
  }

  @Test
  void replaceAllSetsExactlyTheGivenClasses() {
    InventorySet first =
        inventories.replaceAll(
            host,
            ExpectedGeneration.of(0),
            List.of(
                Inventory.withTotal(host, VCPU, 16), Inventory.withTotal(host, MEMORY_MB, 4096)));
    InventorySet second =
        inventories.replaceAll(
            host, ExpectedGeneration.of(1), List.of(Inventory.withTotal(host, DISK_GB, 500)));

    assertThat(first.generation()).isEqualTo(1L);
    assertThat(second.generation()).isEqualTo(2L);
    assertThat(second.inventories()).containsOnlyKeys(DISK_GB);
    assertThat(inventories.get(host, DISK_GB).total()).isEqualTo(500L);
  }

  @Test
  void staleGenerationIsAConflict() {
    inventories.put(host, ExpectedGeneration.of(0), Inventory.withTotal(host, VCPU, 16));

    assertThatThrownBy(
            () ->
                inventories.put(
                    host, ExpectedGeneration.of(0), Inventory.withTotal(host, VCPU, 32)))
        .isInstanceOf(GenerationConflictException.class);
    assertThat(inventories.get(host, VCPU).total()).isEqualTo(16L);
  }

  @Test
  void putKeepsOtherClasses() {
    inventories.put(host, ExpectedGeneration.of(0), Inventory.withTotal(host, VCPU, 16));
    InventorySet set =
        inventories.put(host, ExpectedGeneration.of(1), Inventory.withTotal(host, MEMORY_MB, 64));

    assertThat(set.inventories()).containsOnlyKeys(VCPU, MEMORY_MB);
  }

  @Test
  void unknownClassAndDuplicatesAreInvalid() {
    assertThatThrownBy(
            () ->
                inventories.put(
                    host, ExpectedGeneration.of(0), Inventory.withTotal(host, "CUSTOM_NOPE", 1)))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            e -> assertThat(e.messageKey()).isEqualTo("unknown_resource_class"));
    assertThatThrownBy(
            () ->
                inventories.replaceAll(
                    host,
                    ExpectedGeneration.of(0),
                    List.of(
                        Inventory.withTotal(host, VCPU, 1), Inventory.withTotal(host, VCPU, 2))))
        .isInstanceOf(InvalidRequestException.class);
    assertThat(fx.generation(host)).isZero();
  }

  @Test
  void shrinkingBelowUsageIsInUse() {
    fx.inventory(host, VCPU, 8);
    fx.consume(host, VCPU, 6);
    long gen = fx.generation(host);

    assertThatThrownBy(
            () ->
                inventories.put(
                    host, ExpectedGeneration.of(gen), Inventory.withTotal(host, VCPU, 4)))
        .isInstanceOfSatisfying(
            InUseException.class,
            e -> assertThat(e.messageKey()).isEqualTo("capacity_below_usage"));

    InventorySet grown =
        inventories.put(host, ExpectedGeneration.of(gen), Inventory.withTotal(host, VCPU, 6));
    assertThat(grown.inventories().get(VCPU).capacity()).isEqualTo(6L);
  }

  @Test
  void deletingAnAllocatedClassIsInUse() {
    fx.inventory(host, VCPU, 8);
    fx.inventory(host, MEMORY_MB, 1024);
    fx.consume(host, VCPU, 1);
    long gen = fx.generation(host);

    assertThatThrownBy(() -> inventories.delete(host, VCPU, ExpectedGeneration.of(gen)))
        .isInstanceOf(InUseException.class);
    assertThatThrownBy(() -> inventories.deleteAll(host, ExpectedGeneration.of(gen)))
        .isInstanceOf(InUseException.class);

    InventorySet after = inventories.delete(host, MEMORY_MB, ExpectedGeneration.of(gen));
    assertThat(after.inventories()).containsOnlyKeys(VCPU);
  }

  @Test
  void missingProviderOrClassIsNotFound() {
    assertThatThrownBy(() -> inventories.get(host, VCPU)).isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> inventories.delete(host, VCPU, ExpectedGeneration.of(0)))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> inventories.list("no-such-provider"))
        .isInstanceOf(NotFoundException.class);
  }
}
