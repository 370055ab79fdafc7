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

package ai.floedb.placement.service.usage;

import static ai.floedb.placement.model.StandardResourceClasses.MEMORY_MB;
import static ai.floedb.placement.model.StandardResourceClasses.VCPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Names;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.allocation.ConsumerAllocations;
import ai.floedb.placement.service.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UsageServiceTest {

  private TopologyFixture fx;
  private String host;

  @BeforeEach
  void setUp() {
    fx = new TopologyFixture();
    host = fx.root("host");
    fx.inventory(host, VCPU, 32);
    fx.inventory(host, MEMORY_MB, 8192);
  }

  private void allocate(String project, String user, long vcpu, long memory) {
    fx.writer.write(
        ConsumerAllocations.builder(Names.newUuid(), ExpectedGeneration.absent())
            .allocate(host, VCPU, vcpu)
            .allocate(host, MEMORY_MB, memory)
            .project(project)
            .user(user)
            .type("INSTANCE")
            .build());
  }

  @Test
  void providerUsageReportsEveryInventoriedClass() {
    allocate("p1", "u1", 2, 512);

    assertThat(fx.usages.forProvider(host))
        .containsEntry(VCPU, 2L)
        .containsEntry(MEMORY_MB, 512L);
    assertThatThrownBy(() -> fx.usages.forProvider(Names.newUuid()))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void projectUsageSumsConsumersAndNarrowsByUser() {
    allocate("p1", "u1", 2, 512);
    allocate("p1", "u2", 4, 1024);
    allocate("p2", "u1", 8, 2048);

    ProjectUsage project = fx.usages.forProject("p1", null, null);
    assertThat(project.consumerCount()).isEqualTo(2);
    assertThat(project.usages()).containsEntry(VCPU, 6L).containsEntry(MEMORY_MB, 1536L);

    ProjectUsage user = fx.usages.forProject("p1", "u2", "INSTANCE");
    assertThat(user.consumerCount()).isEqualTo(1);
    assertThat(user.usages()).containsEntry(VCPU, 4L);

    assertThat(fx.usages.forProject("p1", null, "MIGRATION").usages()).isEmpty();
  }
}
