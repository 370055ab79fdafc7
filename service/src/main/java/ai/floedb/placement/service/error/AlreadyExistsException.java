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

public final class AlreadyExistsException extends PlacementException {
  public AlreadyExistsException(
      String messageKey, Map<String, String> params, String message, Throwable cause) {
    super(ErrorCode.ALREADY_EXISTS, messageKey, params, message, cause);
  }
}
