/*
 * Copyright 2025 The Confgraph Authors
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

package org.confgraph.key;

/**
 * Thrown when a value is required but one of the keys it reads has neither a binding nor a
 * default. The caller is expected to supply more configuration and try again; partial evaluation
 * never throws this.
 */
public class ConfigurationError extends RuntimeException {
  public final String keyName;

  public ConfigurationError(Key<?> key) {
    super("No value for configuration key '" + key.name + "'");
    this.keyName = key.name;
  }
}
