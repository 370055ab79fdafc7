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

/** Resource classes that always exist and can be neither created nor deleted. */
public final class StandardResourceClasses {
  public static final String VCPU = "VCPU";
  public static final String MEMORY_MB = "MEMORY_MB";
  public static final String DISK_GB = "DISK_GB";
  public static final String PCI_DEVICE = "PCI_DEVICE";
  public static final String SRIOV_NET_VF = "SRIOV_NET_VF";
  public static final String NUMA_SOCKET = "NUMA_SOCKET";
  public static final String NUMA_CORE = "NUMA_CORE";
  public static final String NUMA_THREAD = "NUMA_THREAD";
  public static final String NUMA_MEMORY_MB = "NUMA_MEMORY_MB";
  public static final String IPV4_ADDRESS = "IPV4_ADDRESS";
  public static final String VGPU = "VGPU";
  public static final String VGPU_DISPLAY_HEAD = "VGPU_DISPLAY_HEAD";
  public static final String NET_BW_EGR_KILOBIT_PER_SEC = "NET_BW_EGR_KILOBIT_PER_SEC";
  public static final String NET_BW_IGR_KILOBIT_PER_SEC = "NET_BW_IGR_KILOBIT_PER_SEC";
  public static final String PCPU = "PCPU";
  public static final String FPGA = "FPGA";
  public static final String MEM_ENCRYPTION_CONTEXT = "MEM_ENCRYPTION_CONTEXT";

  public static final List<String> ALL =
      List.of(
          VCPU,
          MEMORY_MB,
          DISK_GB,
          PCI_DEVICE,
          SRIOV_NET_VF,
          NUMA_SOCKET,
          NUMA_CORE,
          NUMA_THREAD,
          NUMA_MEMORY_MB,
          IPV4_ADDRESS,
          VGPU,
          VGPU_DISPLAY_HEAD,
          NET_BW_EGR_KILOBIT_PER_SEC,
          NET_BW_IGR_KILOBIT_PER_SEC,
          PCPU,
          FPGA,
          MEM_ENCRYPTION_CONTEXT);

  private StandardResourceClasses() {}

  public static boolean isStandard(String name) {
    return ALL.contains(name);
  }
}
