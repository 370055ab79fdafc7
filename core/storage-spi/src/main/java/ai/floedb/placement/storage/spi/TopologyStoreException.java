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

package ai.floedb.placement.storage.spi;

public class TopologyStoreException extends RuntimeException {
  public TopologyStoreException(String message) {
    super(message);
  }

  public TopologyStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /** A uniqueness constraint (provider uuid or name, class, trait, consumer) was violated. */
  public static final class DuplicateKeyException extends TopologyStoreException {
    private final String kind;
    private final String key;

    public DuplicateKeyException(String kind, String key) {
      super(kind + " already exists: " + key);
      this.kind = kind;
      this.key = key;
    }

    public String kind() {
      return kind;
    }

    public String key() {
      return key;
    }
  }

  /** A write referenced an entity that is not in the store. */
  public static final class MissingEntityException extends TopologyStoreException {
    private final String kind;
    private final String key;

    public MissingEntityException(String kind, String key) {
      super(kind + " not found: " + key);
      this.kind = kind;
      this.key = key;
    }

    public String kind() {
      return kind;
    }

    public String key() {
      return key;
    }
  }
}
