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

package ai.floedb.placement.model;

import java.util.List;

/** Traits seeded into every store. Only {@code CUSTOM_} traits may be created or deleted. */
public final class StandardTraits {
  /** Marks a provider whose inventory is shared with the trees it is aggregated with. */
  public static final String MISC_SHARES_VIA_AGGREGATE = "MISC_SHARES_VIA_AGGREGATE";

  public static final List<String> ALL =
      List.of(
          MISC_SHARES_VIA_AGGREGATE,
          "COMPUTE_STATUS_DISABLED",
          "COMPUTE_VOLUME_MULTI_ATTACH",
          "COMPUTE_NET_ATTACH_INTERFACE",
          "COMPUTE_TRUSTED_CERTS",
          "HW_CPU_X86_AVX",
          "HW_CPU_X86_AVX2",
          "HW_CPU_X86_AVX512F",
          "HW_CPU_X86_SSE42",
          "HW_CPU_X86_VMX",
          "HW_CPU_X86_SVM",
          "HW_CPU_HYPERTHREADING",
          "HW_GPU_API_VULKAN",
          "HW_NIC_OFFLOAD_TSO",
          "HW_NIC_SRIOV",
          "HW_NUMA_ROOT",
          "STORAGE_DISK_HDD",
          "STORAGE_DISK_SSD");

  private StandardTraits() {}

  public static boolean isStandard(String name) {
    return ALL.contains(name);
  }
}
