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

import static ai.floedb.placement.model.StandardResourceClasses.VCPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.placement.model.Names;
import ai.floedb.placement.service.TopologyFixture;
import ai.floedb.placement.service.error.ErrorCode;
import ai.floedb.placement.service.error.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CandidateRequestValidationTest {

  private TopologyFixture fx;
  private AllocationCandidateSearch search;

  @BeforeEach
  void setUp() {
    fx = new TopologyFixture();
    search = AllocationCandidateSearch.forTesting(fx.store, 1000, 10000);
    fx.inventory(fx.root("host"), VCPU, 8);
  }

  private void assertRejected(CandidateRequest request, String messageKey) {
    assertThatThrownBy(() -> search.search(request))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            e -> {
              assertThat(e.code()).isEqualTo(ErrorCode.INVALID_REQUEST);
              assertThat(e.messageKey()).isEqualTo(messageKey);
            });
  }

  private static RequestGroup.Builder vcpu() {
    return RequestGroup.builder().resource(VCPU, 1);
  }

  @Test
  void unknownResourceClass() {
    assertRejected(
        CandidateRequest.builder()
            .defaultGroup(RequestGroup.builder().resource("CUSTOM_UNKNOWN", 1).build())
            .build(),
        "unknown_resource_class");
  }

  @Test
  void nonPositiveAmount() {
    assertRejected(
        CandidateRequest.builder()
            .defaultGroup(RequestGroup.builder().resource(VCPU, 0).build())
            .build(),
        "amount");
  }

  @Test
  void unknownTraitsAnywhere() {
    assertRejected(
        CandidateRequest.builder().defaultGroup(vcpu().required("CUSTOM_NOPE").build()).build(),
        "unknown_trait");
    assertRejected(
        CandidateRequest.builder()
            .defaultGroup(vcpu().anyOf("HW_CPU_X86_AVX", "CUSTOM_NOPE").build())
            .build(),
        "unknown_trait");
    assertRejected(
        CandidateRequest.builder()
            .defaultGroup(vcpu().build())
            .rootRequired("CUSTOM_NOPE")
            .build(),
        "unknown_trait");
  }

  @Test
  void traitBothRequiredAndForbidden() {
    assertRejected(
        CandidateRequest.builder()
            .defaultGroup(
                vcpu().required("HW_CPU_X86_AVX").forbidden("HW_CPU_X86_AVX").build())
            .build(),
        "conflicting_traits");
  }

  @Test
  void limitBelowOne() {
    assertRejected(
        CandidateRequest.builder().defaultGroup(vcpu().build()).limit(0).build(), "limit");
  }

  @Test
  void malformedAggregate() {
    assertRejected(
        CandidateRequest.builder().defaultGroup(vcpu().memberOf("rack-7").build()).build(),
        "aggregate_uuid");
  }

  @Test
  void unknownInTreeProvider() {
    assertRejected(
        CandidateRequest.builder().defaultGroup(vcpu().inTree(Names.newUuid()).build()).build(),
        "field");
  }

  @Test
  void noResourcesAtAll() {
    assertRejected(
        CandidateRequest.builder().defaultGroup(RequestGroup.builder().build()).build(),
        "no_resources");
  }

  @Test
  void severalNamedGroupsNeedAPolicy() {
    assertRejected(
        CandidateRequest.builder().group("1", vcpu().build()).group("2", vcpu().build()).build(),
        "group_policy_required");
  }

  @Test
  void defaultGroupPlusOneNamedGroupNeedsNoPolicy() {
    CandidateRequest request =
        CandidateRequest.builder().defaultGroup(vcpu().build()).group("1", vcpu().build()).build();

    assertThat(search.search(request).allocationRequests()).hasSize(1);
  }

  @Test
  void sameSubtreeRules() {
    assertRejected(
        CandidateRequest.builder()
            .group("1", vcpu().build())
            .group("2", vcpu().build())
            .groupPolicy(GroupPolicy.NONE)
            .sameSubtree("1", "9")
            .build(),
        "same_subtree_unknown_group");
    assertRejected(
        CandidateRequest.builder()
            .group("1", vcpu().build())
            .group("2", RequestGroup.builder().build())
            .groupPolicy(GroupPolicy.NONE)
            .build(),
        "resourceless_group");
  }
}
