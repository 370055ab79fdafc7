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

package ai.floedb.placement.service.error.impl;

import ai.floedb.placement.model.ExpectedGeneration;
import ai.floedb.placement.model.ModelValidationException;
import ai.floedb.placement.service.error.AlreadyExistsException;
import ai.floedb.placement.service.error.CapacityExceededException;
import ai.floedb.placement.service.error.ErrorCode;
import ai.floedb.placement.service.error.GenerationConflictException;
import ai.floedb.placement.service.error.InUseException;
import ai.floedb.placement.service.error.InvalidRequestException;
import ai.floedb.placement.service.error.NotFoundException;
import ai.floedb.placement.service.error.PlacementException;
import ai.floedb.placement.storage.spi.TopologyStoreException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class PlacementErrors {
  private static final MessageCatalog CATALOG = new MessageCatalog(Locale.ROOT);

  private PlacementErrors() {}

  public static NotFoundException notFound(String messageKey, Map<String, String> params) {
    return new NotFoundException(
        messageKey, params, render(ErrorCode.NOT_FOUND, messageKey, params), null);
  }

  public static NotFoundException providerNotFound(String uuid) {
    return notFound("resource_provider", params("resource", "resource provider", "id", uuid));
  }

  public static NotFoundException consumerNotFound(String uuid) {
    return notFound("consumer", params("resource", "consumer", "id", uuid));
  }

  public static NotFoundException inventoryNotFound(String providerUuid, String resourceClass) {
    return notFound(
        "inventory",
        params("resource", "inventory", "id", providerUuid, "resource_class", resourceClass));
  }

  public static GenerationConflictException generationConflict(
      String kind, String id, ExpectedGeneration expected, Long actual) {
    String actualText = actual == null ? "none" : Long.toString(actual);
    Map<String, String> params =
        params("kind", kind, "id", id, "expected", expected.toString(), "actual", actualText);
    return new GenerationConflictException(
        kind,
        id,
        expected.toString(),
        actualText,
        params,
        render(ErrorCode.GENERATION_CONFLICT, kind, params));
  }

  public static InvalidRequestException invalid(String messageKey, Map<String, String> params) {
    return new InvalidRequestException(
        messageKey, params, render(ErrorCode.INVALID_REQUEST, messageKey, params), null);
  }

  public static InvalidRequestException invalid(ModelValidationException e) {
    Map<String, String> params = params("field", e.field(), "detail", e.getMessage());
    return new InvalidRequestException(
        "field", params, render(ErrorCode.INVALID_REQUEST, "field", params), e);
  }

  public static InUseException inUse(String messageKey, Map<String, String> params) {
    return new InUseException(
        messageKey, params, render(ErrorCode.IN_USE, messageKey, params), null);
  }

  public static AlreadyExistsException alreadyExists(
      String messageKey, Map<String, String> params) {
    return new AlreadyExistsException(
        messageKey, params, render(ErrorCode.ALREADY_EXISTS, messageKey, params), null);
  }

  public static CapacityExceededException capacityExceeded(
      String providerUuid, String resourceClass, long amount, long used, long capacity) {
    Map<String, String> params =
        params(
            "id",
            providerUuid,
            "resource_class",
            resourceClass,
            "amount",
            Long.toString(amount),
            "used",
            Long.toString(used),
            "capacity",
            Long.toString(capacity));
    return new CapacityExceededException(
        "", params, render(ErrorCode.CAPACITY_EXCEEDED, "", params), null);
  }

  /** Maps a store-level failure onto the service taxonomy. */
  public static PlacementException fromStore(TopologyStoreException e) {
    if (e instanceof TopologyStoreException.DuplicateKeyException dup) {
      String key = dup.kind().replace(' ', '_');
      Map<String, String> params = params("resource", dup.kind(), "id", dup.key());
      return new AlreadyExistsException(
          key, params, render(ErrorCode.ALREADY_EXISTS, key, params), e);
    }
    if (e instanceof TopologyStoreException.MissingEntityException missing) {
      String key = missing.kind().replace(' ', '_');
      Map<String, String> params = params("resource", missing.kind(), "id", missing.key());
      return new NotFoundException(key, params, render(ErrorCode.NOT_FOUND, key, params), e);
    }
    throw e;
  }

  public static Map<String, String> params(String... kv) {
    if (kv.length % 2 != 0) {
      throw new IllegalArgumentException("params need key/value pairs");
    }
    Map<String, String> out = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) {
      out.put(kv[i], kv[i + 1] == null ? "" : kv[i + 1]);
    }
    return out;
  }

  private static String render(ErrorCode code, String messageKey, Map<String, String> params) {
    return CATALOG.render(code, messageKey, params);
  }
}
