package com.github.adamzv.kafkaclient.support;

/**
 * TLS settings. Store types follow kafka-clients ({@code JKS}, {@code PKCS12} or {@code PEM});
 * blank means the client default.
 *
 * @param insecureSkipVerify disables broker host name verification
 */
public record TlsProperties(
    boolean enabled,
    String truststoreLocation,
    String truststorePassword,
    String truststoreType,
    String keystoreLocation,
    String keystorePassword,
    String keystoreType,
    String keyPassword,
    boolean insecureSkipVerify
) {

  public static TlsProperties disabled() {
    return new TlsProperties(false, null, null, null, null, null, null, null, false);
  }

  public static TlsProperties enabledWithTruststore(String location, String type) {
    return new TlsProperties(true, location, null, type, null, null, null, null, false);
  }

  @Override
  public String toString() {
    return "TlsProperties[enabled=" + enabled
        + ", truststoreLocation=" + truststoreLocation
        + ", truststoreType=" + truststoreType
        + ", keystoreLocation=" + keystoreLocation
        + ", keystoreType=" + keystoreType
        + ", insecureSkipVerify=" + insecureSkipVerify + "]";
  }
}
