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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.StandardTraits;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.GenerationConflictException;
import ai.floedb.placement.service.error.InUseException;
import ai.floedb.placement.service.error.InvalidRequestException;
import ai.floedb.placement.service.error.NotFoundException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TraitServiceTest {

  private TopologyFixture fx;
  private TraitService traits;
  private String host;

  @BeforeEach
  void setUp() {
    fx = new TopologyFixture();
    traits = fx.traits;
    host = fx.root("host-1");
  }

  @Test
  void traitSetRoundTripsRegardlessOfOrder() {
    traits.ensure("CUSTOM_A");
    traits.ensure("CUSTOM_B");
    traits.ensure("CUSTOM_C");

    ProviderTraits written =
        traits.setProviderTraits(
            host, ExpectedGeneration.of(0), List.of("CUSTOM_C", "CUSTOM_A", "CUSTOM_B"));

    assertThat(written.generation()).isEqualTo(1L);
    assertThat(traits.providerTraits(host).traits())
        .containsExactlyInAnyOrder("CUSTOM_A", "CUSTOM_B", "CUSTOM_C");
  }

  @Test
  void unknownTraitIsInvalidAndNothingChanges() {
    assertThatThrownBy(
            () ->
                traits.setProviderTraits(
                    host, ExpectedGeneration.of(0), List.of("HW_CPU_X86_AVX2", "CUSTOM_MISSING")))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            e -> assertThat(e.getMessage()).contains("CUSTOM_MISSING"));
    assertThat(traits.providerTraits(host).generation()).isZero();
  }

  @Test
  void staleGenerationIsAConflict() {
    traits.setProviderTraits(host, ExpectedGeneration.of(0), List.of("HW_CPU_X86_AVX"));

    assertThatThrownBy(() -> traits.clearProviderTraits(host, ExpectedGeneration.of(0)))
        .isInstanceOf(GenerationConflictException.class);

    ProviderTraits cleared = traits.clearProviderTraits(host, ExpectedGeneration.of(1));
    assertThat(cleared.traits()).isEmpty();
    assertThat(cleared.generation()).isEqualTo(2L);
  }

  @Test
  void ensureIsIdempotentAndRejectsNonCustomNames() {
    assertThat(traits.ensure("CUSTOM_GOLD")).isTrue();
    assertThat(traits.ensure("CUSTOM_GOLD")).isFalse();
    assertThat(traits.ensure(StandardTraits.MISC_SHARES_VIA_AGGREGATE)).isFalse();
    assertThat(traits.get("CUSTOM_GOLD").standard()).isFalse();

    assertThatThrownBy(() -> traits.ensure("gold")).isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void deleteRules() {
    traits.ensure("CUSTOM_GOLD");
    traits.setProviderTraits(host, ExpectedGeneration.of(0), List.of("CUSTOM_GOLD"));

    assertThatThrownBy(() -> traits.delete("CUSTOM_GOLD")).isInstanceOf(InUseException.class);
    assertThatThrownBy(() -> traits.delete("HW_CPU_X86_AVX"))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> traits.delete("CUSTOM_NEVER")).isInstanceOf(NotFoundException.class);

    traits.clearProviderTraits(host, ExpectedGeneration.of(1));
    traits.delete("CUSTOM_GOLD");
    assertThatThrownBy(() -> traits.get("CUSTOM_GOLD")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void listFiltersByPrefixAndAssociation() {
    traits.ensure("CUSTOM_GOLD");
    traits.ensure("CUSTOM_SILVER");
    traits.setProviderTraits(host, ExpectedGeneration.of(0), List.of("CUSTOM_GOLD"));

    assertThat(traits.list("CUSTOM_", null)).containsExactly("CUSTOM_GOLD", "CUSTOM_SILVER");
    assertThat(traits.list("CUSTOM_", true)).containsExactly("CUSTOM_GOLD");
    assertThat(traits.list("CUSTOM_", false)).containsExactly("CUSTOM_SILVER");
    assertThat(traits.list(null, null)).contains(StandardTraits.MISC_SHARES_VIA_AGGREGATE);
  }
}
