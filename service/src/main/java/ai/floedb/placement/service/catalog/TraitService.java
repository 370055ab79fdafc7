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

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.Names;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.model.StandardTraits;
import ai.floedb.placement.model.Trait;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.service.concurrency.GenerationGuard;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyReader;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/** Trait catalog plus the per-provider trait sets. */
@ApplicationScoped
public class TraitService extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(TraitService.class);

  @Inject
  public TraitService(TopologyStore store) {
    super(store, LOG);
  }

  /**
   * Lists trait names.
   *
   * @param prefix keep names starting with it, null for all
   * @param associated true keeps traits attached to some provider, false the unattached ones,
   *     null both
   */
  public List<String> list(String prefix, Boolean associated) {
    return inRead(
        "listTraits",
        tx -> {
          Set<String> attached = new LinkedHashSet<>();
          if (associated != null) {
            for (ResourceProvider rp : tx.providers()) {
              attached.addAll(tx.traitsOf(rp.uuid()));
            }
          }
          List<String> out = new ArrayList<>();
          for (Trait t : tx.traits()) {
            if (prefix != null && !t.name().startsWith(prefix)) {
              continue;
            }
            if (associated != null && attached.contains(t.name()) != associated) {
              continue;
            }
            out.add(t.name());
          }
          return out;
        });
  }

  public Trait get(String name) {
    return inRead("getTrait", tx -> tx.trait(name).orElseThrow(() -> traitNotFound(name)));
  }

  /** Idempotent create of a custom trait. Returns true when it did not exist before. */
  public boolean ensure(String name) {
    if (StandardTraits.isStandard(name)) {
      return false;
    }
    if (!Names.isCustom(name)) {
      throw PlacementErrors.invalid(
          "custom_name", params("field", "name", "kind", "Trait", "id", name));
    }
    return inWrite(
        "ensureTrait",
        tx -> {
          if (tx.trait(name).isPresent()) {
            return false;
          }
          tx.insertTrait(Trait.custom(name));
          return true;
        });
  }

  public void delete(String name) {
    if (StandardTraits.isStandard(name)) {
      throw PlacementErrors.invalid("standard_trait", params("id", name));
    }
    inWrite(
        "deleteTrait",
        tx -> {
          if (tx.trait(name).isEmpty()) {
            throw traitNotFound(name);
          }
          if (!tx.providersWithTrait(name).isEmpty()) {
            throw PlacementErrors.inUse("trait", params("resource", "trait", "id", name));
          }
          tx.deleteTrait(name);
          return null;
        });
  }

  public ProviderTraits providerTraits(String providerUuid) {
    return inRead(
        "getProviderTraits",
        tx -> {
          ResourceProvider rp =
              tx.provider(providerUuid)
                  .orElseThrow(() -> PlacementErrors.providerNotFound(providerUuid));
          return new ProviderTraits(providerUuid, rp.generation(), tx.traitsOf(providerUuid));
        });
  }

  /** Replaces the provider's trait set. Every trait must already be in the catalog. */
  public ProviderTraits setProviderTraits(
      String providerUuid, ExpectedGeneration expected, Collection<String> traits) {
    Set<String> wanted = new LinkedHashSet<>(traits);
    return inWrite(
        "setProviderTraits",
        tx -> {
          ResourceProvider current = GenerationGuard.checkProvider(tx, providerUuid, expected);
          requireKnown(tx, wanted);
          tx.replaceTraits(providerUuid, wanted);
          ResourceProvider bumped = GenerationGuard.bumpProvider(tx, current, current);
          return new ProviderTraits(providerUuid, bumped.generation(), tx.traitsOf(providerUuid));
        });
  }

  public ProviderTraits clearProviderTraits(String providerUuid, ExpectedGeneration expected) {
    return setProviderTraits(providerUuid, expected, Set.of());
  }

  private static void requireKnown(TopologyReader tx, Set<String> traits) {
    Set<String> unknown = new TreeSet<>();
    for (String t : traits) {
      if (tx.trait(t).isEmpty()) {
        unknown.add(t);
      }
    }
    if (!unknown.isEmpty()) {
      throw PlacementErrors.invalid(
          "unknown_trait", params("field", "traits", "id", String.join(", ", unknown)));
    }
  }

  private static RuntimeException traitNotFound(String name) {
    return PlacementErrors.notFound("trait", params("resource", "trait", "id", name));
  }
}
