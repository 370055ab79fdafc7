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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class InventoryTest {

  private static Inventory inventory(
      long total, long reserved, long minUnit, long maxUnit, long step, double ratio) {
    return new Inventory("rp-1", "VCPU", total, reserved, minUnit, maxUnit, step, ratio);
  }

  @Test
  void capacity_applies_reserved_and_ratio() {
    Inventory inv = inventory(100, 20, 1, 1000, 1, 2.0);

    assertThat(inv.capacity()).isEqualTo(160);
    assertThat(inv.available(10)).isEqualTo(150);
    assertThat(inv.canAllocate(150, 10)).isTrue();
    assertThat(inv.canAllocate(151, 10)).isFalse();
  }

  @Test
  void capacity_rounds_down_fractional_ratio() {
    assertThat(inventory(3, 0, 1, 10, 1, 1.5).capacity()).isEqualTo(4);
  }

  @Test
  void quantization_honours_min_max_and_step() {
    Inventory inv = inventory(100, 0, 4, 20, 4, 1.0);

    assertThat(inv.acceptsAmount(10)).isFalse();
    assertThat(inv.acceptsAmount(12)).isTrue();
    assertThat(inv.acceptsAmount(4)).isTrue();
    assertThat(inv.acceptsAmount(2)).isFalse();
    assertThat(inv.acceptsAmount(24)).isFalse();
  }

  @Test
  void withTotal_uses_defaults() {
    Inventory inv = Inventory.withTotal("rp-1", "DISK_GB", 500);

    assertThat(inv.reserved()).isZero();
    assertThat(inv.minUnit()).isEqualTo(1);
    assertThat(inv.maxUnit()).isEqualTo(Integer.MAX_VALUE);
    assertThat(inv.stepSize()).isEqualTo(1);
    assertThat(inv.allocationRatio()).isEqualTo(1.0);
  }

  @Test
  void rejects_reserved_above_total() {
    assertThatThrownBy(() -> inventory(10, 11, 1, 10, 1, 1.0))
        .isInstanceOf(ModelValidationException.class)
        .extracting(e -> ((ModelValidationException) e).field())
        .isEqualTo("reserved");
  }

  @Test
  void rejects_bad_units_and_ratio() {
    assertThatThrownBy(() -> inventory(10, 0, 0, 10, 1, 1.0))
        .isInstanceOf(ModelValidationException.class);
    assertThatThrownBy(() -> inventory(10, 0, 5, 4, 1, 1.0))
        .isInstanceOf(ModelValidationException.class);
    assertThatThrownBy(() -> inventory(10, 0, 1, 10, 0, 1.0))
        .isInstanceOf(ModelValidationException.class);
    assertThatThrownBy(() -> inventory(10, 0, 1, 10, 1, 0.0))
        .isInstanceOf(ModelValidationException.class);
  }
}
