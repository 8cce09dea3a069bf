package com.github.adamzv.kafkaclient.support;

import com.github.adamzv.kafkaclient.domain.Problems;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Connection settings shared by the producer, consumer and admin clients.
 *
 * @param brokers comma separated {@code host:port} list
 * @param dialTimeout maximum time to establish a broker connection
 * @param requestTimeout maximum time for a single broker request
 */
public record KafkaProperties(
    @NotBlank(message = "brokers must not be blank")
    String brokers,
    String authType,
    String username,
    CredentialProperties credential,
    TlsProperties tls,
    Duration dialTimeout,
    Duration requestTimeout,
    Duration retryBackoff,
    int maxRetries,
    String awsRegion,
    String oauthTokenUrl,
    String clientId
) {

  public static final Duration DEFAULT_DIAL_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);
  public static final int DEFAULT_MAX_RETRIES = 3;

  public KafkaProperties {
    credential = credential == null ? CredentialProperties.none() : credential;
    tls = tls == null ? TlsProperties.disabled() : tls;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static KafkaProperties of(String brokers) {
    return builder().brokers(brokers).build();
  }

  /**
   * Checks brokers, auth type and the settings the auth type depends on, in that order.
   */
  public void validate() {
    if (brokerList().isEmpty()) {
      throw Problems.missingBrokers();
    }
    AuthType type = AuthType.parse(authType).orElseThrow(() -> Problems.invalidAuthType(authType));
    if (type == AuthType.AWS_MSK_IAM && isBlank(awsRegion)) {
      throw Problems.missingAwsRegion();
    }
    if (type == AuthType.OAUTH && isBlank(oauthTokenUrl)) {
      throw Problems.missingOAuthTokenUrl();
    }
  }

  public List<String> brokerList() {
    if (brokers == null) {
      return List.of();
    }
    return Arrays.stream(brokers.split(","))
        .map(String::trim)
        .filter(broker -> !broker.isEmpty())
        .toList();
  }

  /**
   * Resolved auth type; call {@link #validate()} first.
   */
  public AuthType resolvedAuthType() {
    return AuthType.parse(authType).orElseThrow(() -> Problems.invalidAuthType(authType));
  }

  public Duration effectiveDialTimeout() {
    return positiveOr(dialTimeout, DEFAULT_DIAL_TIMEOUT);
  }

  public Duration effectiveRequestTimeout() {
    return positiveOr(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
  }

  public Duration effectiveRetryBackoff() {
    return positiveOr(retryBackoff, DEFAULT_RETRY_BACKOFF);
  }

  public int effectiveMaxRetries() {
    return maxRetries > 0 ? maxRetries : DEFAULT_MAX_RETRIES;
  }

  public Builder toBuilder() {
    return new Builder()
        .brokers(brokers)
        .authType(authType)
        .username(username)
        .credential(credential)
        .tls(tls)
        .dialTimeout(dialTimeout)
        .requestTimeout(requestTimeout)
        .retryBackoff(retryBackoff)
        .maxRetries(maxRetries)
        .awsRegion(awsRegion)
        .oauthTokenUrl(oauthTokenUrl)
        .clientId(clientId);
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  static Duration positiveOr(Duration value, Duration fallback) {
    return value == null || value.isNegative() || value.isZero() ? fallback : value;
  }

  public static final class Builder {
    private String brokers;
    private String authType;
    private String username;
    private CredentialProperties credential;
    private TlsProperties tls;
    private Duration dialTimeout;
    private Duration requestTimeout;
    private Duration retryBackoff;
    private int maxRetries;
    private String awsRegion;
    private String oauthTokenUrl;
    private String clientId;

    private Builder() {
    }

    public Builder brokers(String brokers) {
      this.brokers = brokers;
      return this;
    }

    public Builder authType(String authType) {
      this.authType = authType;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder credential(CredentialProperties credential) {
      this.credential = credential;
      return this;
    }

    public Builder tls(TlsProperties tls) {
      this.tls = tls;
      return this;
    }

    public Builder dialTimeout(Duration dialTimeout) {
      this.dialTimeout = dialTimeout;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder retryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder awsRegion(String awsRegion) {
      this.awsRegion = awsRegion;
      return this;
    }

    public Builder oauthTokenUrl(String oauthTokenUrl) {
      this.oauthTokenUrl = oauthTokenUrl;
      return this;
    }

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public KafkaProperties build() {
      return new KafkaProperties(brokers, authType, username, credential, tls, dialTimeout,
          requestTimeout, retryBackoff, maxRetries, awsRegion, oauthTokenUrl, clientId);
    }
  }
}
