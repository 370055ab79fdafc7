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

import ai.floedb.placement.model.Allocation;
import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/** Read side of allocations, plus the unconditional removal of a consumer's claims. */
@ApplicationScoped
public class AllocationService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(AllocationService.class);

  @Inject
  public AllocationService(TopologyStore store) {
    super(store, LOG);
  }

  public ConsumerAllocationsView forConsumer(String consumerUuid) {
    return inRead(
        "getConsumerAllocations",
        tx -> {
          Optional<Consumer> consumer = tx.consumer(consumerUuid);
          Map<String, Map<String, Long>> byProvider = new LinkedHashMap<>();
          for (Allocation a : tx.allocationsOf(consumerUuid)) {
            byProvider
                .computeIfAbsent(a.providerUuid(), k -> new LinkedHashMap<>())
                .put(a.resourceClass(), a.used());
          }
          return new ConsumerAllocationsView(
              consumerUuid,
              consumer.map(Consumer::generation).orElse(null),
              consumer.map(Consumer::consumerType).orElse(null),
              consumer.map(Consumer::projectId).orElse(null),
              consumer.map(Consumer::userId).orElse(null),
              byProvider);
        });
  }

  public ProviderAllocationsView forProvider(String providerUuid) {
    return inRead(
        "getProviderAllocations",
        tx -> {
          ResourceProvider rp =
              tx.provider(providerUuid)
                  .orElseThrow(() -> PlacementErrors.providerNotFound(providerUuid));
          Map<String, Map<String, Long>> byConsumer = new LinkedHashMap<>();
          for (Allocation a : tx.allocationsAgainst(providerUuid)) {
            byConsumer
                .computeIfAbsent(a.consumerUuid(), k -> new LinkedHashMap<>())
                .put(a.resourceClass(), a.used());
          }
          return new ProviderAllocationsView(providerUuid, rp.generation(), byConsumer);
        });
  }

  /** Drops every allocation of the consumer, and with them the consumer itself. */
  public void deleteConsumer(String consumerUuid) {
    inWrite(
        "deleteConsumerAllocations",
        tx -> {
          if (tx.consumer(consumerUuid).isEmpty()) {
            throw PlacementErrors.consumerNotFound(consumerUuid);
          }
          tx.deleteConsumer(consumerUuid);
          return null;
        });
  }
}
