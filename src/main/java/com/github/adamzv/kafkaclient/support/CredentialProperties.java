package com.github.adamzv.kafkaclient.support;

/**
 * Where the SASL secret comes from. The first non-empty source wins, in declaration order.
 *
 * @param password literal secret, used verbatim
 * @param passwordEnv name of an environment variable holding the secret
 * @param passwordFile path of a file holding the secret
 */
public record CredentialProperties(
    String password,
    String passwordEnv,
    String passwordFile
) {

  public static CredentialProperties none() {
    return new CredentialProperties(null, null, null);
  }

  public static CredentialProperties literal(String password) {
    return new CredentialProperties(password, null, null);
  }

  public static CredentialProperties fromEnv(String variable) {
    return new CredentialProperties(null, variable, null);
  }

  public static CredentialProperties fromFile(String path) {
    return new CredentialProperties(null, null, path);
  }

  @Override
  public String toString() {
    return "CredentialProperties[password=" + (password == null ? "null" : "****")
        + ", passwordEnv=" + passwordEnv
        + ", passwordFile=" + passwordFile + "]";
  }
}
