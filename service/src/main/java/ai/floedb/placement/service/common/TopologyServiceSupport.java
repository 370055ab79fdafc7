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

package ai.floedb.placement.service.common;

import ai.floedb.placement.model.ModelValidationException;
import ai.floedb.placement.service.error.PlacementException;
import ai.floedb.placement.service.error.impl.PlacementErrors;
import ai.floedb.placement.storage.spi.TopologyReader;
import ai.floedb.placement.storage.spi.TopologyStore;
import ai.floedb.placement.storage.spi.TopologyStoreException;
import ai.floedb.placement.storage.spi.TopologyWriter;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Runs service operations as single store transactions and maps model and store failures onto
 * {@link PlacementException}s. Every failure aborts the transaction before anything is published.
 */
public abstract class TopologyServiceSupport {
  protected final TopologyStore store;
  private final Logger log;

  protected TopologyServiceSupport(TopologyStore store, Logger log) {
    this.store = store;
    this.log = log;
  }

  protected <T> T inRead(String op, Function<TopologyReader, T> work) {
    return logged(op, () -> store.read(work));
  }

  protected <T> T inWrite(String op, Function<TopologyWriter, T> work) {
    return logged(op, () -> store.write(work));
  }

  private <T> T logged(String op, Supplier<T> call) {
    LogHelper lh = LogHelper.start(log, op);
    try {
      T result = call.get();
      lh.ok();
      return result;
    } catch (PlacementException e) {
      lh.fail(e);
      throw e;
    } catch (ModelValidationException e) {
      PlacementException mapped = PlacementErrors.invalid(e);
      lh.fail(mapped);
      throw mapped;
    } catch (TopologyStoreException e) {
      PlacementException mapped = PlacementErrors.fromStore(e);
      lh.fail(mapped);
      throw mapped;
    } catch (RuntimeException e) {
      lh.fail(e);
      throw e;
    }
  }
}
