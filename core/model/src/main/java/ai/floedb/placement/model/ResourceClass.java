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

public record ResourceClass(String name, boolean standard) {

  public ResourceClass {
    Names.requireNonBlank("name", name);
    if (!standard) {
      Names.requireCustom("resource class", name);
    }
  }

  public static ResourceClass custom(String name) {
    return new ResourceClass(name, false);
  }

  public static ResourceClass standard(String name) {
    return new ResourceClass(name, true);
  }
}
