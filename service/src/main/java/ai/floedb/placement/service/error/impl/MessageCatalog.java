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

import ai.floedb.placement.service.error.ErrorCode;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;

public final class MessageCatalog {
  private final ResourceBundle bundle;

  public MessageCatalog(Locale locale) {
    this.bundle = ResourceBundle.getBundle("errors", locale);
  }

  public String render(ErrorCode code, String messageKey, Map<String, String> params) {
    String base = code.name();
    String key = messageKey != null && !messageKey.isBlank() ? base + "." + messageKey : base;

    String template =
        bundle.containsKey(key)
            ? bundle.getString(key)
            : (bundle.containsKey(base) ? bundle.getString(base) : defaultTemplate(code));

    return format(template, params);
  }

  private static String defaultTemplate(ErrorCode code) {
    return switch (code) {
      case NOT_FOUND -> "The {resource} was not found: {id}.";
      case GENERATION_CONFLICT ->
          "Generation mismatch for {kind} {id}: expected {expected}, actual {actual}.";
      case INVALID_REQUEST -> "Invalid value for {field}.";
      case IN_USE -> "The {resource} {id} is in use.";
      case ALREADY_EXISTS -> "The {resource} already exists: {id}.";
      case CAPACITY_EXCEEDED -> "Insufficient capacity.";
    };
  }

  private static String format(String template, Map<String, String> params) {
    String formattedMessage = template;
    for (var e : params.entrySet()) {
      formattedMessage = formattedMessage.replace("{" + e.getKey() + "}", e.getValue());
    }
    return formattedMessage;
  }
}
