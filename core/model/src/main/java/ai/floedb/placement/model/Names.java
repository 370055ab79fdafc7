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

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/** Naming rules shared by resource classes, traits, consumers and aggregates. */
public final class Names {
  public static final String CUSTOM_PREFIX = "CUSTOM_";
  public static final int MAX_PROVIDER_NAME_LENGTH = 200;

  private static final Pattern CUSTOM_NAME = Pattern.compile("^CUSTOM_[A-Z0-9_]+$");
  private static final Pattern UPPER_NAME = Pattern.compile("^[A-Z0-9_]+$");
  private static final Pattern CANONICAL_UUID =
      Pattern.compile(
          "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private Names() {}

  public static boolean isCustom(String name) {
    return name != null && CUSTOM_NAME.matcher(name).matches();
  }

  public static boolean isUpperSnake(String name) {
    return name != null && UPPER_NAME.matcher(name).matches();
  }

  public static boolean isUuid(String value) {
    return value != null && CANONICAL_UUID.matcher(value).matches();
  }

  public static String newUuid() {
    return UUID.randomUUID().toString();
  }

  public static String requireCustom(String field, String name) {
    if (!isCustom(name)) {
      throw new ModelValidationException(
          field, field + " '" + name + "' must match " + CUSTOM_PREFIX + "[A-Z0-9_]+");
    }
    return name;
  }

  public static String requireNonBlank(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new ModelValidationException(field, field + " is required");
    }
    return value;
  }

  public static String requireUuid(String field, String value) {
    if (!isUuid(value)) {
      throw new ModelValidationException(field, field + " '" + value + "' is not a valid uuid");
    }
    return value.toLowerCase(Locale.ROOT);
  }
}
