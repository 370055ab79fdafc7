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

import ai.floedb.placement.model.Allocation;
import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

@ApplicationScoped
public class UsageService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(UsageService.class);

  @Inject
  public UsageService(TopologyStore store) {
    super(store, LOG);
  }

  /** Usage per class of the provider's inventories; unallocated classes report zero. */
  public Map<String, Long> forProvider(String providerUuid) {
    return inRead(
        "getProviderUsages",
        tx -> {
          if (tx.provider(providerUuid).isEmpty()) {
            throw PlacementErrors.providerNotFound(providerUuid);
          }
          return tx.usages(providerUuid);
        });
  }

  /**
   * Totals per class over every consumer owned by {@code projectId}, narrowed to {@code userId}
   * and {@code consumerType} when those are non-null.
   */
  public ProjectUsage forProject(String projectId, String userId, String consumerType) {
    return inRead(
        "getProjectUsages",
        tx -> {
          Map<String, Long> totals = new LinkedHashMap<>();
          int consumers = 0;
          for (Consumer c : tx.consumers()) {
            if (!projectId.equals(c.projectId())) {
              continue;
            }
            if (userId != null && !userId.equals(c.userId())) {
              continue;
            }
            if (consumerType != null && !consumerType.equals(c.consumerType())) {
              continue;
            }
            consumers++;
            for (Allocation a : tx.allocationsOf(c.uuid())) {
              totals.merge(a.resourceClass(), a.used(), Long::sum);
            }
          }
          return new ProjectUsage(projectId, userId, consumers, totals);
        });
  }
}
