package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.Problems;
import com.github.adamzv.kafkaclient.support.CredentialProperties;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads a SASL secret from its configured source. Secrets are taken verbatim; only the line
 * terminator that ends a credential file is dropped. Callers own the returned array and must
 * zero it once the secret has been handed to the client.
 */
final class CredentialResolver {

  private static final char[] EMPTY = new char[0];

  private final Function<String, String> environment;

  CredentialResolver(Function<String, String> environment) {
    this.environment = environment;
  }

  char[] resolve(CredentialProperties credential) {
    if (credential == null) {
      return EMPTY.clone();
    }
    if (credential.password() != null && !credential.password().isEmpty()) {
      return credential.password().toCharArray();
    }
    String variable = credential.passwordEnv();
    if (variable != null && !variable.isBlank()) {
      String value = environment.apply(variable.trim());
      if (value != null && !value.isEmpty()) {
        return value.toCharArray();
      }
    }
    String file = credential.passwordFile();
    if (file != null && !file.isBlank()) {
      return readFile(Path.of(file.trim()));
    }
    return EMPTY.clone();
  }

  private static char[] readFile(Path path) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException ex) {
      throw Problems.credentialUnavailable(
          "Cannot read credential file",
          Map.of("path", path.toString(), "error", ex.getClass().getSimpleName()),
          ex
      );
    }
    CharBuffer decoded = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(bytes));
    Arrays.fill(bytes, (byte) 0);
    int end = decoded.limit();
    while (end > 0 && (decoded.get(end - 1) == '\n' || decoded.get(end - 1) == '\r')) {
      end--;
    }
    char[] secret = new char[end];
    decoded.get(secret, 0, end);
    if (decoded.hasArray()) {
      Arrays.fill(decoded.array(), '\0');
    }
    return secret;
  }
}
