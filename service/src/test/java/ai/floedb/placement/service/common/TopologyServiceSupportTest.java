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

package ai.floedb.placement.service.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.floedb.placement.service.error.AlreadyExistsException;
import ai.floedb.placement.service.error.ErrorCode;
import ai.floedb.placement.service.error.NotFoundException;
import ai.floedb.placement.service.provider.ResourceProviderService;
import ai.floedb.placement.storage.spi.TopologyStore;
import ai.floedb.placement.storage.spi.TopologyStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TopologyServiceSupportTest {

  private TopologyStore store;
  private ResourceProviderService providers;

  @BeforeEach
  void setUp() {
    store = mock(TopologyStore.class);
    providers = new ResourceProviderService(store);
  }

  @Test
  void duplicateKeyBecomesAlreadyExists() {
    when(store.write(any()))
        .thenThrow(
            new TopologyStoreException.DuplicateKeyException("resource provider name", "cn1"));

    assertThatThrownBy(() -> providers.create(null, "cn1", null))
        .isInstanceOfSatisfying(
            AlreadyExistsException.class,
            e -> {
              assertThat(e.code()).isEqualTo(ErrorCode.ALREADY_EXISTS);
              assertThat(e.messageKey()).isEqualTo("resource_provider_name");
              assertThat(e.getMessage())
                  .isEqualTo("Resource provider with name cn1 already exists.");
              assertThat(e.getCause())
                  .isInstanceOf(TopologyStoreException.DuplicateKeyException.class);
            });
    verify(store).write(any());
  }

  @Test
  void missingEntityBecomesNotFound() {
    when(store.read(any()))
        .thenThrow(new TopologyStoreException.MissingEntityException("consumer", "c-1"));

    assertThatThrownBy(() -> providers.get("p-1"))
        .isInstanceOfSatisfying(
            NotFoundException.class,
            e -> assertThat(e.getMessage()).isEqualTo("No consumer with uuid c-1 found."));
  }

  @Test
  void unexpectedFailuresPassThroughUntouched() {
    IllegalStateException boom = new IllegalStateException("disk on fire");
    when(store.read(any())).thenThrow(boom);

    assertThatThrownBy(() -> providers.get("p-1")).isSameAs(boom);
  }
}
