package com.github.adamzv.kafkaclient.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OptionParsingTest {

  @ParameterizedTest
  @CsvSource({
      "plain, PLAIN",
      "SCRAM-256, SCRAM_256",
      "scram512, SCRAM_512",
      "' aws-msk-iam ', AWS_MSK_IAM",
      "oauth, OAUTH"
  })
  void parsesAuthTypes(String raw, AuthType expected) {
    assertEquals(Optional.of(expected), AuthType.parse(raw));
  }

  @Test
  void blankAuthTypeIsNone() {
    assertEquals(Optional.of(AuthType.NONE), AuthType.parse(" "));
    assertFalse(AuthType.NONE.usesSasl());
    assertTrue(AuthType.parse("gssapi").isEmpty());
  }

  @ParameterizedTest
  @CsvSource({
      "0, NONE",
      "none, NONE",
      "1, LEADER",
      "one, LEADER",
      "all, ALL",
      "-1, ALL"
  })
  void parsesAcks(String raw, Acks expected) {
    assertEquals(Optional.of(expected), Acks.parse(raw));
  }

  @Test
  void mapsOptionsToClientValues() {
    assertEquals("all", Acks.ALL.kafkaValue());
    assertEquals("read_committed", IsolationLevel.parse("committed").orElseThrow().kafkaValue());
    assertEquals(StartOffset.EARLIEST, StartOffset.parse("first").orElseThrow());
    assertEquals("zstd", Compression.parse("ZSTD").orElseThrow().value());
    assertTrue(Compression.parse("brotli").isEmpty());
  }
}
