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

/**
 * Base of every error the placement services raise.
 *
 * <p>Carries a category ({@link #code()}), a message key that selects the template inside the
 * {@code errors} bundle, and the parameters the template was rendered with. Callers decide on
 * retry from {@link #retryable()}.
 */
public abstract class PlacementException extends RuntimeException {
  private final ErrorCode code;
  private final String messageKey;
  private final Map<String, String> params;

  protected PlacementException(
      ErrorCode code,
      String messageKey,
      Map<String, String> params,
      String message,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.messageKey = messageKey == null ? "" : messageKey;
    this.params = params == null ? Map.of() : Map.copyOf(params);
  }

  public ErrorCode code() {
    return code;
  }

  public String messageKey() {
    return messageKey;
  }

  public Map<String, String> params() {
    return params;
  }

  public boolean retryable() {
    return false;
  }
}
