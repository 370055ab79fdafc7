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

package ai.floedb.placement.service.provider;

import static ai.floedb.placement.service.error.impl.PlacementErrors.params;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Inventory;
import ai.floedb.placement.model.Names;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.concurrency.GenerationGuard;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyReader;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ResourceProviderService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(ResourceProviderService.class);

  @Inject
  public ResourceProviderService(TopologyStore store) {
    super(store, LOG);
  }

  /** Creates a provider at generation 0. A null {@code uuid} is generated. */
  public ProviderView create(String uuid, String name, String parentUuid) {
    String id = uuid == null ? Names.newUuid() : uuid;
    return inWrite(
        "createResourceProvider",
        tx -> {
          if (parentUuid != null && tx.provider(parentUuid).isEmpty()) {
            throw PlacementErrors.notFound(
                "parent_provider", params("resource", "resource provider", "id", parentUuid));
          }
          ResourceProvider created = ResourceProvider.create(id, name, parentUuid);
          tx.insertProvider(created);
          LOG.debugf("created provider uuid=%s name=%s parent=%s", id, name, parentUuid);
          return new ProviderView(created, tx.rootOf(id));
        });
  }

  public ProviderView get(String uuid) {
    return inRead(
        "getResourceProvider",
        tx -> {
          ResourceProvider rp =
              tx.provider(uuid).orElseThrow(() -> PlacementErrors.providerNotFound(uuid));
          return new ProviderView(rp, tx.rootOf(uuid));
        });
  }

  public List<ProviderView> list(ProviderFilter filter) {
    return inRead(
        "listResourceProviders",
        tx -> {
          String tree = null;
          if (filter.inTree() != null) {
            Optional<ResourceProvider> anchor = tx.provider(filter.inTree());
            if (anchor.isEmpty()) {
              return List.<ProviderView>of();
            }
            tree = tx.rootOf(anchor.get().uuid());
          }
          List<ProviderView> out = new ArrayList<>();
          for (ResourceProvider rp : tx.providers()) {
            String root = tx.rootOf(rp.uuid());
            if (matches(tx, rp, root, tree, filter)) {
              out.add(new ProviderView(rp, root));
            }
          }
          return out;
        });
  }

  private static boolean matches(
      TopologyReader tx, ResourceProvider rp, String root, String tree, ProviderFilter filter) {
    if (filter.name() != null && !filter.name().equals(rp.name())) {
      return false;
    }
    if (filter.uuid() != null && !filter.uuid().equals(rp.uuid())) {
      return false;
    }
    if (tree != null && !tree.equals(root)) {
      return false;
    }
    if (!filter.memberOf().isEmpty()) {
      Set<String> aggs = tx.aggregatesOf(rp.uuid());
      if (filter.memberOf().stream().noneMatch(aggs::contains)) {
        return false;
      }
    }
    Set<String> traits = tx.traitsOf(rp.uuid());
    if (!traits.containsAll(filter.requiredTraits())) {
      return false;
    }
    if (filter.forbiddenTraits().stream().anyMatch(traits::contains)) {
      return false;
    }
    for (Map.Entry<String, Long> want : filter.resources().entrySet()) {
      Optional<Inventory> inv = tx.inventory(rp.uuid(), want.getKey());
      if (inv.isEmpty()) {
        return false;
      }
      long used = tx.usage(rp.uuid(), want.getKey());
      if (inv.get().available(used) < want.getValue()) {
        return false;
      }
    }
    return true;
  }

  /** Renames and/or re-parents a provider. Moving under a descendant is rejected. */
  public ProviderView update(String uuid, ProviderUpdate update) {
    return inWrite(
        "updateResourceProvider",
        tx -> {
          ResourceProvider next =
              GenerationGuard.mutateProvider(
                  tx,
                  uuid,
                  update.expected(),
                  cur -> {
                    ResourceProvider changed =
                        update.name() == null ? cur : cur.withName(update.name());
                    if (update.reparent() && !cur.sameParent(update.parentUuid())) {
                      checkNewParent(tx, uuid, update.parentUuid());
                      changed = changed.withParent(update.parentUuid());
                    }
                    return changed;
                  });
          return new ProviderView(next, tx.rootOf(uuid));
        });
  }

  private static void checkNewParent(TopologyReader tx, String uuid, String parentUuid) {
    if (parentUuid == null) {
      return;
    }
    if (tx.provider(parentUuid).isEmpty()) {
      throw PlacementErrors.notFound(
          "parent_provider", params("resource", "resource provider", "id", parentUuid));
    }
    if (parentUuid.equals(uuid) || tx.ancestors(parentUuid).contains(uuid)) {
      throw PlacementErrors.invalid("cycle", params("id", uuid, "parent", parentUuid));
    }
  }

  /** Disabled providers stay in the topology but are never offered as candidates. */
  public ProviderView setDisabled(String uuid, boolean disabled, ExpectedGeneration expected) {
    return inWrite(
        "setResourceProviderDisabled",
        tx -> {
          ResourceProvider next =
              GenerationGuard.mutateProvider(tx, uuid, expected, cur -> cur.withDisabled(disabled));
          return new ProviderView(next, tx.rootOf(uuid));
        });
  }

  public void delete(String uuid) {
    inWrite(
        "deleteResourceProvider",
        tx -> {
          if (tx.provider(uuid).isEmpty()) {
            throw PlacementErrors.providerNotFound(uuid);
          }
          if (!tx.children(uuid).isEmpty()) {
            throw PlacementErrors.inUse(
                "provider_children", params("resource", "resource provider", "id", uuid));
          }
          if (!tx.allocationsAgainst(uuid).isEmpty()) {
            throw PlacementErrors.inUse(
                "provider_allocations", params("resource", "resource provider", "id", uuid));
          }
          tx.deleteProvider(uuid);
          return null;
        });
  }
}
