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

/**
 * Capacity record of one resource class on one provider.
 *
 * <ul>
 *   <li>{@code total} is the raw amount present on the provider
 *   <li>{@code reserved} is held back from allocation
 *   <li>{@code minUnit}, {@code maxUnit} and {@code stepSize} quantize a single allocation
 *   <li>{@code allocationRatio} over-commits (or under-commits) the unreserved amount
 * </ul>
 */
public record Inventory(
    String providerUuid,
    String resourceClass,
    long total,
    long reserved,
    long minUnit,
    long maxUnit,
    long stepSize,
    double allocationRatio) {

  public static final long DEFAULT_RESERVED = 0L;
  public static final long DEFAULT_MIN_UNIT = 1L;
  public static final long DEFAULT_MAX_UNIT = Integer.MAX_VALUE;
  public static final long DEFAULT_STEP_SIZE = 1L;
  public static final double DEFAULT_ALLOCATION_RATIO = 1.0d;

  public Inventory {
    Names.requireNonBlank("resource_provider_uuid", providerUuid);
    Names.requireNonBlank("resource_class", resourceClass);
    if (total < 0) {
      throw new ModelValidationException("total", "total must be >= 0");
    }
    if (reserved < 0) {
      throw new ModelValidationException("reserved", "reserved must be >= 0");
    }
    if (reserved > total) {
      throw new ModelValidationException(
          "reserved", "reserved (" + reserved + ") must be <= total (" + total + ")");
    }
    if (minUnit < 1) {
      throw new ModelValidationException("min_unit", "min_unit must be >= 1");
    }
    if (maxUnit < minUnit) {
      throw new ModelValidationException(
          "max_unit", "max_unit (" + maxUnit + ") must be >= min_unit (" + minUnit + ")");
    }
    if (stepSize < 1) {
      throw new ModelValidationException("step_size", "step_size must be >= 1");
    }
    if (!(allocationRatio > 0.0d) || Double.isInfinite(allocationRatio)) {
      throw new ModelValidationException("allocation_ratio", "allocation_ratio must be > 0");
    }
  }

  public static Inventory withTotal(String providerUuid, String resourceClass, long total) {
    return new Inventory(
        providerUuid,
        resourceClass,
        total,
        DEFAULT_RESERVED,
        DEFAULT_MIN_UNIT,
        DEFAULT_MAX_UNIT,
        DEFAULT_STEP_SIZE,
        DEFAULT_ALLOCATION_RATIO);
  }

  /** {@code floor((total - reserved) * allocationRatio)} */
  public long capacity() {
    return (long) Math.floor((total - reserved) * allocationRatio);
  }

  public long available(long used) {
    return capacity() - used;
  }

  /** True when a single allocation of {@code amount} respects min, max and step. */
  public boolean acceptsAmount(long amount) {
    return amount >= minUnit && amount <= maxUnit && (amount - minUnit) % stepSize == 0;
  }

  /** Quantization plus enough headroom on top of {@code used}. */
  public boolean canAllocate(long amount, long used) {
    return acceptsAmount(amount) && available(used) >= amount;
  }

  public Inventory forProvider(String otherProviderUuid) {
    return new Inventory(
        otherProviderUuid,
        resourceClass,
        total,
        reserved,
        minUnit,
        maxUnit,
        stepSize,
        allocationRatio);
  }
}
