package com.github.adamzv.kafkaclient.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

public record Header(String key, byte[] value) {

  public Header {
    Objects.requireNonNull(key, "header key");
  }

  public static Header of(String key, String value) {
    return new Header(key, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
  }

  public String valueAsString() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Header that)) {
      return false;
    }
    return key.equals(that.key) && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * key.hashCode() + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "Header[key=" + key + ", value=" + valueAsString() + "]";
  }
}
