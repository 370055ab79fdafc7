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

import ai.floedb.placement.model.ExpectedGeneration;

/**
 * Change to a provider's name and/or position in the forest.
 *
 * <p>{@code name} null keeps the current name. {@code reparent} false keeps the current parent;
 * true moves the provider under {@code parentUuid}, or makes it a root when that is null.
 */
public record ProviderUpdate(
    String name, boolean reparent, String parentUuid, ExpectedGeneration expected) {

  public static ProviderUpdate rename(String name, long generation) {
    return new ProviderUpdate(name, false, null, ExpectedGeneration.of(generation));
  }

  public static ProviderUpdate moveUnder(String parentUuid, long generation) {
    return new ProviderUpdate(null, true, parentUuid, ExpectedGeneration.of(generation));
  }

  public static ProviderUpdate makeRoot(long generation) {
    return new ProviderUpdate(null, true, null, ExpectedGeneration.of(generation));
  }
}
