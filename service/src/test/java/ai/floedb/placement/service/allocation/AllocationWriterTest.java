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

import static ai.floedb.placement.model.StandardResourceClasses.DISK_GB;
import static ai.floedb.placement.model.StandardResourceClasses.MEMORY_MB;
import static ai.floedb.placement.model.StandardResourceClasses.VCPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.Names;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.CapacityExceededException;
import ai.floedb.placement.service.error.GenerationConflictException;
import ai.floedb.placement.service.error.InvalidRequestException;
import ai.floedb.placement.service.error.NotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AllocationWriterTest {

  private TopologyFixture fx;
  private String host;

  @BeforeEach
  void setUp() {
    fx = new TopologyFixture();
    host = fx.root("host-1");
  }

  private static ConsumerAllocations.Builder consumer(String uuid, ExpectedGeneration expected) {
    return ConsumerAllocations.builder(uuid, expected).project("p1").user("u1");
  }

  @Test
  void newConsumerStartsAtGenerationOneAndEachWriteBumps() {
    fx.inventory(host, VCPU, 16);
    String c = Names.newUuid();

    AllocationResult first =
        fx.writer.write(consumer(c, ExpectedGeneration.absent()).allocate(host, VCPU, 2).build());
    AllocationResult second =
        fx.writer.write(consumer(c, ExpectedGeneration.of(1)).allocate(host, VCPU, 4).build());
    AllocationResult third =
        fx.writer.write(consumer(c, ExpectedGeneration.of(2)).allocate(host, VCPU, 1).build());

    assertThat(first.generation()).isEqualTo(1L);
    assertThat(second.generation()).isEqualTo(2L);
    assertThat(third.generation()).isEqualTo(3L);
    assertThat(fx.allocations.forConsumer(c).allocations()).containsEntry(host, Map.of(VCPU, 1L));
    assertThat(fx.usages.forProvider(host)).containsEntry(VCPU, 1L);
  }

  @Test
  void capacityHonoursReservedAndRatio() {
    fx.inventory(new Inventory(host, VCPU, 100, 20, 1, Integer.MAX_VALUE, 1, 2.0d));
    fx.consume(host, VCPU, 10);

    assertThatThrownBy(
            () ->
                fx.writer.write(
                    consumer(Names.newUuid(), ExpectedGeneration.absent())
                        .allocate(host, VCPU, 151)
                        .build()))
        .isInstanceOf(CapacityExceededException.class)
        .hasMessageContaining("151");

    AllocationResult ok =
        fx.writer.write(
            consumer(Names.newUuid(), ExpectedGeneration.absent())
                .allocate(host, VCPU, 150)
                .build());
    assertThat(ok.generation()).isEqualTo(1L);
    assertThat(fx.usages.forProvider(host)).containsEntry(VCPU, 160L);
  }

  @Test
  void quantizationIsCheckedPerAllocation() {
    fx.inventory(new Inventory(host, MEMORY_MB, 100, 0, 4, 20, 4, 1.0d));

    assertThatThrownBy(
            () ->
                fx.writer.write(
                    consumer(Names.newUuid(), ExpectedGeneration.absent())
                        .allocate(host, MEMORY_MB, 10)
                        .build()))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            e -> assertThat(e.messageKey()).isEqualTo("quantization"));

    AllocationResult ok =
        fx.writer.write(
            consumer(Names.newUuid(), ExpectedGeneration.absent())
                .allocate(host, MEMORY_MB, 12)
                .build());
    assertThat(ok.deleted()).isFalse();
  }

  @Test
  void missingInventoryIsNotFound() {
    fx.inventory(host, VCPU, 8);

    assertThatThrownBy(
            () ->
                fx.writer.write(
                    consumer(Names.newUuid(), ExpectedGeneration.absent())
                        .allocate(host, DISK_GB, 1)
                        .build()))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining(DISK_GB);
  }

  @Test
  void failedBatchLeavesNoConsumerBehind() {
    fx.inventory(host, VCPU, 16);
    String y = Names.newUuid();
    fx.writer.write(consumer(y, ExpectedGeneration.absent()).allocate(host, VCPU, 1).build());
    fx.writer.write(consumer(y, ExpectedGeneration.of(1)).allocate(host, VCPU, 2).build());
    String x = Names.newUuid();

    assertThatThrownBy(
            () ->
                fx.writer.writeBatch(
                    List.of(
                        consumer(x, ExpectedGeneration.absent()).allocate(host, VCPU, 1).build(),
                        consumer(y, ExpectedGeneration.of(3)).allocate(host, VCPU, 1).build())))
        .isInstanceOfSatisfying(
            GenerationConflictException.class,
            e -> {
              assertThat(e.id()).isEqualTo(y);
              assertThat(e.expected()).isEqualTo("3");
              assertThat(e.actual()).isEqualTo("2");
              assertThat(e.retryable()).isTrue();
            });

    assertThat(fx.allocations.forConsumer(x).exists()).isFalse();
    assertThat(fx.allocations.forConsumer(y).generation()).isEqualTo(2L);
    assertThat(fx.usages.forProvider(host)).containsEntry(VCPU, 2L);
  }

  @Test
  void duplicateConsumerInBatchIsRejected() {
    fx.inventory(host, VCPU, 16);
    String c = Names.newUuid();

    assertThatThrownBy(
            () ->
                fx.writer.writeBatch(
                    List.of(
                        consumer(c, ExpectedGeneration.absent()).allocate(host, VCPU, 1).build(),
                        consumer(c, ExpectedGeneration.absent()).allocate(host, VCPU, 1).build())))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void batchCapacityCountsEveryConsumer() {
    fx.inventory(host, VCPU, 10);

    assertThatThrownBy(
            () ->
                fx.writer.writeBatch(
                    List.of(
                        consumer(Names.newUuid(), ExpectedGeneration.absent())
                            .allocate(host, VCPU, 6)
                            .build(),
                        consumer(Names.newUuid(), ExpectedGeneration.absent())
                            .allocate(host, VCPU, 6)
                            .build())))
        .isInstanceOf(CapacityExceededException.class);
    assertThat(fx.usages.forProvider(host)).containsEntry(VCPU, 0L);
  }

  @Test
  void movingAllocationsWithinAFullInventoryIsAllowed() {
    fx.inventory(host, VCPU, 4);
    String c = fx.consume(host, VCPU, 4);

    AllocationResult r =
        fx.writer.write(consumer(c, ExpectedGeneration.of(1)).allocate(host, VCPU, 4).build());

    assertThat(r.generation()).isEqualTo(2L);
  }

  @Test
  void emptyAllocationSetRemovesTheConsumer() {
    fx.inventory(host, VCPU, 8);
    String c = fx.consume(host, VCPU, 2);

    AllocationResult r = fx.writer.write(consumer(c, ExpectedGeneration.of(1)).build());

    assertThat(r.deleted()).isTrue();
    assertThat(fx.allocations.forConsumer(c).exists()).isFalse();
    Optional<Consumer> stored = fx.store.read(tx -> tx.consumer(c));
    assertThat(stored).isEmpty();
    assertThat(fx.usages.forProvider(host)).containsEntry(VCPU, 0L);
  }

  @Test
  void missingConsumerWithExpectedGenerationConflicts() {
    fx.inventory(host, VCPU, 8);

    assertThatThrownBy(
            () ->
                fx.writer.write(
                    consumer(Names.newUuid(), ExpectedGeneration.of(1))
                        .allocate(host, VCPU, 1)
                        .build()))
        .isInstanceOfSatisfying(
            GenerationConflictException.class, e -> assertThat(e.actual()).isEqualTo("none"));
  }

  @Test
  void concurrentCreatorsOfOneConsumerHaveExactlyOneWinner() throws Exception {
    fx.inventory(host, VCPU, 64);
    String c = Names.newUuid();
    int writers = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    try {
      List<Future<Boolean>> futures = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        Callable<Boolean> attempt =
            () -> {
              start.await();
              try {
                fx.writer.write(
                    consumer(c, ExpectedGeneration.absent()).allocate(host, VCPU, 2).build());
                return true;
              } catch (GenerationConflictException e) {
                return false;
              }
            };
        futures.add(pool.submit(attempt));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> f : futures) {
        if (f.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
    assertThat(fx.usages.forProvider(host)).containsEntry(VCPU, 2L);
    assertThat(fx.allocations.forConsumer(c).generation()).isEqualTo(1L);
  }
}
