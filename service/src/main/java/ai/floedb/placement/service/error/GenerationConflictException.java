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

package ai.floedb.placement.service.error;

import java.util.Map;

/** Expected and actual generation disagreed; safe to retry after re-reading. */
public final class GenerationConflictException extends PlacementException {
  private final String kind;
  private final String id;
  private final String expected;
  private final String actual;

  public GenerationConflictException(
      String kind,
      String id,
      String expected,
      String actual,
      Map<String, String> params,
      String message) {
    super(ErrorCode.GENERATION_CONFLICT, kind, params, message, null);
    this.kind = kind;
    this.id = id;
    this.expected = expected;
    this.actual = actual;
  }

  public String kind() {
    return kind;
  }

  public String id() {
    return id;
  }

  public String expected() {
    return expected;
  }

  public String actual() {
    return actual;
  }

  @Override
  public boolean retryable() {
    return true;
  }
}
