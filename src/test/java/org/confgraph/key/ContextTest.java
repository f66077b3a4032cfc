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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ContextTest {

  private static final Key<String> HOST = Key.create("host");
  private static final Key<Integer> PORT = Key.create("port", 80);

  @Test
  public void empty() {
    assertThat(Context.EMPTY.keys()).isEmpty();
    assertThat(Context.EMPTY.get(HOST)).isNull();
    assertThat(Context.EMPTY.isBound(HOST)).isFalse();
    assertThat(Context.EMPTY.toString()).isEqualTo("{}");
  }

  @Test
  public void builder() {
    Context context = Context.builder().set(HOST, "example.com").set(PORT, 443).build();
    assertThat(context.get(HOST)).isEqualTo("example.com");
    assertThat(context.get(PORT)).isEqualTo(443);
    assertThat(context.keys()).containsExactly(HOST, PORT).inOrder();
    assertThat(context.toString()).isEqualTo("{host=example.com, port=443}");
  }

  @Test
  public void getIgnoresDefaults() {
    assertThat(Context.EMPTY.get(PORT)).isNull();
  }

  @Test
  public void withIsPersistent() {
    Context first = Context.EMPTY.with(HOST, "a");
    Context second = first.with(HOST, "b");
    assertThat(first.get(HOST)).isEqualTo("a");
    assertThat(second.get(HOST)).isEqualTo("b");
    assertThat(second.keys()).containsExactly(HOST);
    assertThat(Context.EMPTY.isBound(HOST)).isFalse();
  }

  @Test
  public void nullsAreRejected() {
    assertThrows(NullPointerException.class, () -> Context.builder().set(HOST, null));
  }
}
