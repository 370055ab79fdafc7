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

package ai.floedb.placement.service.concurrency;

import ai.floedb.placement.model.Consumer;
import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.ResourceProvider;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyReader;
import ai.floedb.placement.storage.spi.TopologyWriter;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.jboss.logging.Logger;

/**
 * Generation check-and-bump for providers and consumers.
 *
 * <p>Every mutation of a versioned entity goes through here with the transaction it writes in:
 * the current generation is read from that same transaction, compared against the caller's
 * expectation, and the bump is written alongside the mutation. A mismatch throws before any write
 * happens, and the store discards the whole transaction.
 */
public final class GenerationGuard {
  private static final Logger LOG = Logger.getLogger(GenerationGuard.class);

  public static final String PROVIDER = "resource_provider";
  public static final String CONSUMER = "consumer";

  private GenerationGuard() {}

  /** Returns the provider at the expected generation; NotFound if it does not exist. */
  public static ResourceProvider checkProvider(
      TopologyReader tx, String uuid, ExpectedGeneration expected) {
    ResourceProvider current =
        tx.provider(uuid).orElseThrow(() -> PlacementErrors.providerNotFound(uuid));
    if (!expected.matches(current.generation())) {
      LOG.debugf(
          "provider generation mismatch uuid=%s expected=%s actual=%d",
          uuid, expected, current.generation());
      throw PlacementErrors.generationConflict(PROVIDER, uuid, expected, current.generation());
    }
    return current;
  }

  /** Writes {@code changed} with the generation one above {@code current}. */
  public static ResourceProvider bumpProvider(
      TopologyWriter tx, ResourceProvider current, ResourceProvider changed) {
    ResourceProvider next =
        new ResourceProvider(
                changed.uuid(),
                changed.name(),
                current.generation(),
                changed.parentUuid(),
                changed.disabled())
            .nextGeneration();
    tx.updateProvider(next);
    return next;
  }

  /** Check, apply {@code change}, bump: the provider mutation protocol in one call. */
  public static ResourceProvider mutateProvider(
      TopologyWriter tx,
      String uuid,
      ExpectedGeneration expected,
      UnaryOperator<ResourceProvider> change) {
    ResourceProvider current = checkProvider(tx, uuid, expected);
    return bumpProvider(tx, current, change.apply(current));
  }

  /**
   * Returns the consumer when {@code expected} names a generation, or empty when the consumer is
   * expected to be absent. Either expectation failing is a conflict, including a consumer that is
   * missing although a generation was supplied.
   */
  public static Optional<Consumer> checkConsumer(
      TopologyReader tx, String uuid, ExpectedGeneration expected) {
    Optional<Consumer> current = tx.consumer(uuid);
    Long actual = current.map(Consumer::generation).orElse(null);
    if (!expected.matches(actual)) {
      LOG.debugf(
          "consumer generation mismatch uuid=%s expected=%s actual=%s", uuid, expected, actual);
      throw PlacementErrors.generationConflict(CONSUMER, uuid, expected, actual);
    }
    return current;
  }

  public static Consumer bumpConsumer(TopologyWriter tx, Consumer current) {
    Consumer next = current.nextGeneration();
    tx.updateConsumer(next);
    return next;
  }
}
