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

package ai.floedb.placement.service.candidates;

import ai.floedb.placement.model.StandardTraits;
import ai.floedb.placement.service.candidates.impl.GranularResolver;
import ai.floedb.placement.service.candidates.impl.RequestValidator;
import ai.floedb.placement.service.candidates.impl.SearchContext;
import ai.floedb.placement.service.candidates.impl.SharingComposer;
import ai.floedb.placement.service.candidates.impl.SingleGroupResolver;
import ai.floedb.placement.service.candidates.impl.SummaryBuilder;
import ai.floedb.placement.service.common.TopologyServiceSupport;
import ai.floedb.placement.storage.spi.TopologyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Read-only search for allocation candidates.
 *
 * <p>A request with one group takes the single-provider path and falls back to composing a tree
 * with a sharing provider. Several groups go through granular resolution. The result is advisory:
 * nothing is reserved, and a later allocation write re-checks capacity and generations.
 */
@ApplicationScoped
public class AllocationCandidateSearch extends TopologyServiceSupport {
  private static final Logger LOG = Logger.getLogger(AllocationCandidateSearch.class);

  private final int maxLimit;
  private final SingleGroupResolver singleGroup;
  private final GranularResolver granular;

  @Inject
  public AllocationCandidateSearch(
      TopologyStore store,
      @ConfigProperty(name = "placement.candidates.max-limit", defaultValue = "1000") int maxLimit,
      @ConfigProperty(name = "placement.candidates.max-combinations", defaultValue = "10000")
          int maxCombinations,
      @ConfigProperty(
              name = "placement.candidates.sharing-trait",
              defaultValue = StandardTraits.MISC_SHARES_VIA_AGGREGATE)
          String sharingTrait) {
    this(store, new CandidateSearchLimits(maxLimit, maxCombinations, sharingTrait));
  }

  AllocationCandidateSearch(TopologyStore store, CandidateSearchLimits limits) {
    super(Objects.requireNonNull(store, "store"), LOG);
    this.maxLimit = Math.max(1, limits.maxLimit());
    int maxCombinations = Math.max(1, limits.maxCombinations());
    this.singleGroup =
        new SingleGroupResolver(new SharingComposer(limits.sharingTrait(), maxCombinations));
    this.granular = new GranularResolver(maxCombinations);
  }

  public static AllocationCandidateSearch forTesting(
      TopologyStore store, int maxLimit, int maxCombinations) {
    return new AllocationCandidateSearch(
        store,
        new CandidateSearchLimits(
            maxLimit, maxCombinations, StandardTraits.MISC_SHARES_VIA_AGGREGATE));
  }

  public AllocationCandidates search(CandidateRequest request) {
    return inRead(
        "getAllocationCandidates",
        tx -> {
          RequestValidator.validate(tx, request);
          LOG.debugf(
              "groups=%d totalResources=%s", request.groups().size(), request.totalResources());
          SearchContext ctx = new SearchContext(tx, request);

          List<AllocationRequest> found;
          if (request.groups().size() == 1) {
            Map.Entry<String, RequestGroup> only =
                request.groups().entrySet().iterator().next();
            found = singleGroup.resolve(ctx, only.getKey(), only.getValue());
          } else {
            found = granular.resolve(ctx);
          }

          int limit = effectiveLimit(request.limit());
          if (found.size() > limit) {
            LOG.debugf("truncating %d candidates to %d", found.size(), limit);
            found = found.subList(0, limit);
          }
          if (found.isEmpty()) {
            return AllocationCandidates.empty();
          }
          return new AllocationCandidates(found, SummaryBuilder.summarize(ctx, found));
        });
  }

  int effectiveLimit(Integer requested) {
    return requested == null ? maxLimit : Math.min(requested, maxLimit);
  }

  record CandidateSearchLimits(int maxLimit, int maxCombinations, String sharingTrait) {}
}
