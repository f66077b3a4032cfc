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
public class ValueTest {

  private static final Key<Boolean> K = Key.create("k");
  private static final Key<Boolean> J = Key.create("j");
  private static final Key<Integer> PORT = Key.create("port", 8080);

  @Test
  public void pure() {
    Value<String> v = Value.pure("x");
    assertThat(v.keys()).isEmpty();
    assertThat(v.peek(Context.EMPTY)).isEqualTo("x");
    assertThat(v.eval(Context.EMPTY)).isEqualTo("x");
    assertThat(v.toString()).isEqualTo("x");
  }

  @Test
  public void readKey() {
    Value<Boolean> v = K.value();
    assertThat(v.keys()).containsExactly(K);
    assertThat(v.peek(Context.EMPTY)).isNull();
    assertThat(v.peek(Context.EMPTY.with(K, true))).isTrue();
    assertThat(v.eval(Context.EMPTY.with(K, false))).isFalse();
    assertThat(v.toString()).isEqualTo("k");
  }

  @Test
  public void missingKeyWithoutDefault() {
    ConfigurationError e =
        assertThrows(ConfigurationError.class, () -> K.value().eval(Context.EMPTY));
    assertThat(e.keyName).isEqualTo("k");
    assertThat(e).hasMessageThat().isEqualTo("No value for configuration key 'k'");
  }

  @Test
  public void defaults() {
    Value<Integer> v = PORT.value();
    assertThat(PORT.defaultValue()).isEqualTo(8080);
    assertThat(K.defaultValue()).isNull();
    // peek never uses defaults
    assertThat(v.peek(Context.EMPTY)).isNull();
    assertThat(v.eval(Context.EMPTY)).isEqualTo(8080);
    assertThat(v.eval(Context.EMPTY.with(PORT, 9000))).isEqualTo(9000);
  }

  @Test
  public void peekWithDefaults() {
    Value<String> v = Value.map2("pair", PORT.value(), K.value(), (p, k) -> p + "/" + k);
    assertThat(v.peekWithDefaults(Context.EMPTY)).isNull();
    assertThat(v.peekWithDefaults(Context.EMPTY.with(K, true))).isEqualTo("8080/true");
    assertThat(v.peek(Context.EMPTY.with(K, true))).isNull();
    assertThat(Value.not(K.value()).peekWithDefaults(Context.EMPTY.with(K, true))).isFalse();
  }

  @Test
  public void evalNamesTheMissingKey() {
    Value<Boolean> v = Value.and(Value.not(PORT.value().map("zero", p -> p == 0)), J.value());
    ConfigurationError e = assertThrows(ConfigurationError.class, () -> v.eval(Context.EMPTY));
    assertThat(e.keyName).isEqualTo("j");
    assertThat(v.eval(Context.EMPTY.with(J, true))).isTrue();
  }

  @Test
  public void keysAreComparedByIdentity() {
    Key<Boolean> other = Key.create("k");
    Context context = Context.EMPTY.with(other, true);
    assertThat(K.value().peek(context)).isNull();
    assertThat(other.value().peek(context)).isTrue();
  }

  @Test
  public void booleanOperators() {
    Value<Boolean> v = Value.or(Value.and(K.value(), J.value()), Value.not(K.value()));
    assertThat(v.keys()).containsExactly(K, J);
    assertThat(v.toString()).isEqualTo("((k && j) || !k)");
    Context kOnly = Context.EMPTY.with(K, true);
    assertThat(v.peek(kOnly)).isNull();
    assertThat(v.peek(kOnly.with(J, true))).isTrue();
    assertThat(v.peek(kOnly.with(J, false))).isFalse();
    assertThat(v.eval(Context.EMPTY.with(K, false).with(J, true))).isTrue();
  }

  @Test
  public void mapAndMap2() {
    Value<String> url =
        Value.map2("url", Value.pure("localhost"), PORT.value(), (host, port) -> host + ":" + port);
    assertThat(url.eval(Context.EMPTY)).isEqualTo("localhost:8080");
    assertThat(url.peek(Context.EMPTY)).isNull();
    Value<Integer> length = url.map("len", String::length);
    assertThat(length.eval(Context.EMPTY.with(PORT, 80))).isEqualTo("localhost:80".length());
    assertThat(length.keys()).containsExactly(PORT);
  }

  @Test
  public void emptyKeyNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Key.create(""));
  }
}
