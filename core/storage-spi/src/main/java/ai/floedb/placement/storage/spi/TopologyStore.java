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

package ai.floedb.placement.storage.spi;

import java.util.function.Function;

/**
 * Transactional entry point to the resource graph.
 *
 * <p>Each call runs {@code work} as exactly one logical transaction:
 *
 * <ul>
 *   <li>{@link #read} sees a consistent snapshot and never blocks writers.
 *   <li>{@link #write} is serializable with respect to other writes. Its effects become visible
 *       only when {@code work} returns normally; if it throws, nothing it did is kept.
 * </ul>
 *
 * <p>Implementations never retry {@code work}; retry after a conflict is the caller's decision.
 */
public interface TopologyStore {

  <T> T read(Function<TopologyReader, T> work);

  <T> T write(Function<TopologyWriter, T> work);
}
