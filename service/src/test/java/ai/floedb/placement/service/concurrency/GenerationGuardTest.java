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

package ai.floedb.placement.service.concurrency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.GenerationConflictException;
import ai.floedb.placement.service.error.NotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class GenerationGuardTest {

  private final TopologyFixture fx = new TopologyFixture();

  @Test
  void mutateChecksThenBumps() {
    String uuid = fx.root("cn1");

    ResourceProvider renamed =
        fx.store.write(
            tx ->
                GenerationGuard.mutateProvider(
                    tx, uuid, ExpectedGeneration.of(0), rp -> rp.withName("cn1-b")));

    assertThat(renamed.generation()).isEqualTo(1L);
    assertThat(fx.providers.get(uuid).provider().name()).isEqualTo("cn1-b");
  }

  @Test
  void mismatchLeavesTheProviderUntouched() {
    String uuid = fx.root("cn1");

    assertThatThrownBy(
            () ->
                fx.store.write(
                    tx ->
                        GenerationGuard.mutateProvider(
                            tx, uuid, ExpectedGeneration.of(7), rp -> rp.withName("nope"))))
        .isInstanceOfSatisfying(
            GenerationConflictException.class,
            e -> {
              assertThat(e.kind()).isEqualTo(GenerationGuard.PROVIDER);
              assertThat(e.expected()).isEqualTo("7");
              assertThat(e.actual()).isEqualTo("0");
            });
    assertThat(fx.providers.get(uuid).provider().name()).isEqualTo("cn1");
  }

  @Test
  void absentExpectationOnAnExistingProviderConflicts() {
    String uuid = fx.root("cn1");

    assertThatThrownBy(
            () ->
                fx.store.read(
                    tx -> GenerationGuard.checkProvider(tx, uuid, ExpectedGeneration.absent())))
        .isInstanceOf(GenerationConflictException.class);
    assertThatThrownBy(
            () ->
                fx.store.read(
                    tx -> GenerationGuard.checkProvider(tx, "missing", ExpectedGeneration.of(0))))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void racingWritersWithTheSameExpectationHaveOneWinner() throws Exception {
    String uuid = fx.root("cn1");
    int writers = 6;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    List<Future<Boolean>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < writers; i++) {
        String trait = i % 2 == 0 ? "HW_CPU_X86_AVX" : "HW_CPU_X86_SSE42";
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  try {
                    fx.traits.setProviderTraits(uuid, ExpectedGeneration.of(0), List.of(trait));
                    return true;
                  } catch (GenerationConflictException e) {
                    return false;
                  }
                }));
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
    assertThat(fx.generation(uuid)).isEqualTo(1L);
    assertThat(fx.traits.providerTraits(uuid).traits()).hasSize(1);
  }
}
