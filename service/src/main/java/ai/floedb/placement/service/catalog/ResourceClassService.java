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

import static ai.floedb.placement.service.error.impl.PlacementErrors.params;

import ai.floedb.placement.model.Names;
import ai.floedb.placement.model.ResourceClass;
import ai.floedb.placement.model.StandardResourceClasses;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/** Resource class catalog. Standard classes are fixed; custom ones live under CUSTOM_. */
@ApplicationScoped
public class ResourceClassService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(ResourceClassService.class);

  @Inject
  public ResourceClassService(TopologyStore store) {
    super(store, LOG);
  }

  public List<ResourceClass> list() {
    return inRead("listResourceClasses", tx -> tx.resourceClasses());
  }

  public ResourceClass get(String name) {
    return inRead(
        "getResourceClass",
        tx ->
            tx.resourceClass(name)
                .orElseThrow(
                    () ->
                        PlacementErrors.notFound(
                            "resource_class", params("resource", "resource class", "id", name))));
  }

  public ResourceClass create(String name) {
    requireCustomName(name);
    return inWrite(
        "createResourceClass",
        tx -> {
          ResourceClass rc = ResourceClass.custom(name);
          tx.insertResourceClass(rc);
          return rc;
        });
  }

  /** Idempotent create. Returns true when the class did not exist before. */
  public boolean ensure(String name) {
    if (StandardResourceClasses.isStandard(name)) {
      return false;
    }
    requireCustomName(name);
    return inWrite(
        "ensureResourceClass",
        tx -> {
          if (tx.resourceClass(name).isPresent()) {
            return false;
          }
          tx.insertResourceClass(ResourceClass.custom(name));
          return true;
        });
  }

  public void delete(String name) {
    if (StandardResourceClasses.isStandard(name)) {
      throw PlacementErrors.invalid("standard_resource_class", params("id", name));
    }
    inWrite(
        "deleteResourceClass",
        tx -> {
          if (tx.resourceClass(name).isEmpty()) {
            throw PlacementErrors.notFound(
                "resource_class", params("resource", "resource class", "id", name));
          }
          if (!tx.inventoriesOfClass(name).isEmpty()) {
            throw PlacementErrors.inUse(
                "resource_class", params("resource", "resource class", "id", name));
          }
          tx.deleteResourceClass(name);
          return null;
        });
  }

  private static void requireCustomName(String name) {
    if (!Names.isCustom(name)) {
      throw PlacementErrors.invalid(
          "custom_name", params("field", "name", "kind", "Resource class", "id", name));
    }
  }
}
