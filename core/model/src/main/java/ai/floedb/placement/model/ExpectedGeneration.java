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

import java.util.Objects;

/**
 * Caller's expectation about an entity's current generation.
 *
 * <p>{@link #absent()} means the entity must not exist yet. {@link #of(long)} means it must exist
 * with exactly that generation.
 */
public final class ExpectedGeneration {
  private static final ExpectedGeneration ABSENT = new ExpectedGeneration(-1L);

  private final long value;

  private ExpectedGeneration(long value) {
    this.value = value;
  }

  public static ExpectedGeneration absent() {
    return ABSENT;
  }

  public static ExpectedGeneration of(long generation) {
    if (generation < 0) {
      throw new ModelValidationException("generation", "generation must be >= 0");
    }
    return new ExpectedGeneration(generation);
  }

  public boolean isAbsent() {
    return value < 0;
  }

  public long value() {
    if (isAbsent()) {
      throw new IllegalStateException("no generation expected");
    }
    return value;
  }

  public boolean matches(Long current) {
    return isAbsent() ? current == null : current != null && current == value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ExpectedGeneration other && other.value == value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return isAbsent() ? "none" : Long.toString(value);
  }
}
