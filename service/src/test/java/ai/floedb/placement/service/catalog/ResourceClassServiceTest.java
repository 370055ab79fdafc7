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

package ai.floedb.placement.service.catalog;

import static ai.floedb.placement.model.StandardResourceClasses.VCPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.ResourceClass;
import ai.floedb.placement.model.StandardResourceClasses;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.AlreadyExistsException;
import ai.floedb.placement.service.error.InUseException;
import ai.floedb.placement.service.error.InvalidRequestException;
import ai.floedb.placement.service.error.NotFoundException;
import org.junit.jupiter.api.Test;

class ResourceClassServiceTest {

  private final TopologyFixture fx = new TopologyFixture();
  private final ResourceClassService classes = fx.resourceClasses;

  @Test
  void standardClassesAreSeeded() {
    assertThat(classes.list())
        .extracting(ResourceClass::name)
        .containsAll(StandardResourceClasses.ALL);
    assertThat(classes.get(VCPU).standard()).isTrue();
  }

  @Test
  void customClassLifecycle() {
    ResourceClass created = classes.create("CUSTOM_FPGA_SLOT");

    assertThat(created.standard()).isFalse();
    assertThatThrownBy(() -> classes.create("CUSTOM_FPGA_SLOT"))
        .isInstanceOf(AlreadyExistsException.class);
    assertThat(classes.ensure("CUSTOM_FPGA_SLOT")).isFalse();

    String host = fx.root("host");
    fx.inventory(host, "CUSTOM_FPGA_SLOT", 2);
    assertThatThrownBy(() -> classes.delete("CUSTOM_FPGA_SLOT"))
        .isInstanceOf(InUseException.class);
  }

  @Test
  void namesAndStandardClassesAreProtected() {
    assertThatThrownBy(() -> classes.create("FPGA_SLOT"))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> classes.delete(VCPU)).isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> classes.delete("CUSTOM_MISSING"))
        .isInstanceOf(NotFoundException.class);
    assertThat(classes.ensure(VCPU)).isFalse();
    assertThat(classes.ensure("CUSTOM_NEW")).isTrue();
  }
}
