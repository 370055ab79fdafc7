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

package ai.floedb.placement.service.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Names;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.GenerationConflictException;
import ai.floedb.placement.service.error.InvalidRequestException;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class AggregateServiceTest {

  private final TopologyFixture fx = new TopologyFixture();
  private final AggregateService aggregates = fx.aggregates;

  @Test
  void membershipIsReplacedAndNormalized() {
    String host = fx.root("host");
    String agg = Names.newUuid();

    ProviderAggregates set =
        aggregates.set(
            host, ExpectedGeneration.of(0), List.of(agg.toUpperCase(Locale.ROOT)));

    assertThat(set.generation()).isEqualTo(1L);
    assertThat(aggregates.get(host).aggregates()).containsExactly(agg);
    assertThat(aggregates.set(host, ExpectedGeneration.of(1), List.of()).aggregates()).isEmpty();
  }

  @Test
  void malformedOrRepeatedUuidsAreInvalid() {
    String host = fx.root("host");
    String agg = Names.newUuid();

    assertThatThrownBy(() -> aggregates.set(host, ExpectedGeneration.of(0), List.of("rack-1")))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            e -> assertThat(e.messageKey()).isEqualTo("aggregate_uuid"));
    assertThatThrownBy(
            () ->
                aggregates.set(
                    host,
                    ExpectedGeneration.of(0),
                    List.of(agg, agg.toUpperCase(Locale.ROOT))))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            e -> assertThat(e.messageKey()).isEqualTo("duplicate_aggregate"));
  }

  @Test
  void staleGenerationIsAConflict() {
    String host = fx.root("host");

    assertThatThrownBy(
            () -> aggregates.set(host, ExpectedGeneration.of(4), List.of(Names.newUuid())))
        .isInstanceOf(GenerationConflictException.class);
  }
}
