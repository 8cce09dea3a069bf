package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.support.AuthType;
import com.github.adamzv.kafkaclient.support.ConsumerProperties;
import com.github.adamzv.kafkaclient.support.KafkaProperties;
import com.github.adamzv.kafkaclient.support.ProducerProperties;
import com.github.adamzv.kafkaclient.support.TlsProperties;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;
import java.util.function.Function;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.security.auth.SecurityProtocol;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

/**
 * Translates validated settings into kafka-clients configuration. Secrets are read once per
 * call and only survive inside the returned properties.
 */
public final class ClientPropertiesFactory {

  static final String PLAIN_LOGIN_MODULE = "org.apache.kafka.common.security.plain.PlainLoginModule";
  static final String SCRAM_LOGIN_MODULE = "org.apache.kafka.common.security.scram.ScramLoginModule";
  static final String OAUTH_LOGIN_MODULE = "org.apache.kafka.common.security.oauthbearer.OAuthBearerLoginModule";
  static final String OAUTH_CALLBACK_HANDLER =
      "org.apache.kafka.common.security.oauthbearer.OAuthBearerLoginCallbackHandler";
  static final String IAM_LOGIN_MODULE = "software.amazon.msk.auth.iam.IAMLoginModule";
  static final String IAM_CALLBACK_HANDLER = "software.amazon.msk.auth.iam.IAMClientCallbackHandler";
  static final String IAM_MECHANISM = "AWS_MSK_IAM";

  private static final Duration MAX_CONNECTION_SETUP_TIMEOUT = Duration.ofSeconds(30);

  private final CredentialResolver credentials;

  public ClientPropertiesFactory() {
    this(System::getenv);
  }

  ClientPropertiesFactory(Function<String, String> environment) {
    this.credentials = new CredentialResolver(environment);
  }

  public Properties producer(ProducerProperties settings) {
    Properties props = common(settings.connection());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, settings.resolvedAcks().kafkaValue());
    props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, settings.resolvedCompression().value());
    props.put(ProducerConfig.RETRIES_CONFIG, settings.connection().effectiveMaxRetries());
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, settings.idempotent() || settings.isTransactional());
    if (settings.batchMaxBytes() > 0) {
      props.put(ProducerConfig.BATCH_SIZE_CONFIG, settings.batchMaxBytes());
    }
    if (settings.linger() != null && !settings.linger().isNegative()) {
      props.put(ProducerConfig.LINGER_MS_CONFIG, Math.toIntExact(settings.linger().toMillis()));
    }
    if (settings.isTransactional()) {
      props.put(ProducerConfig.TRANSACTIONAL_ID_CONFIG, settings.transactionalId().trim());
    }
    return props;
  }

  public Properties consumer(ConsumerProperties settings) {
    Properties props = common(settings.connection());
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, settings.resolvedStartOffset().value());
    props.put(ConsumerConfig.ISOLATION_LEVEL_CONFIG, settings.resolvedIsolationLevel().kafkaValue());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, settings.autoCommit() && settings.hasGroup());
    if (settings.hasGroup()) {
      props.put(ConsumerConfig.GROUP_ID_CONFIG, settings.group().trim());
    }
    putMillis(props, ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, settings.sessionTimeout());
    putMillis(props, ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, settings.rebalanceTimeout());
    putMillis(props, ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, settings.heartbeatInterval());
    putMillis(props, ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG, settings.autoCommitInterval());
    putMillis(props, ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, settings.fetchMaxWait());
    if (settings.fetchMinBytes() > 0) {
      props.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, settings.fetchMinBytes());
    }
    if (settings.fetchMaxBytes() > 0) {
      props.put(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, settings.fetchMaxBytes());
    }
    if (settings.maxPollRecords() > 0) {
      props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, settings.maxPollRecords());
    }
    return props;
  }

  public Properties admin(KafkaProperties settings) {
    Properties props = common(settings);
    props.put(AdminClientConfig.RETRIES_CONFIG, settings.effectiveMaxRetries());
    return props;
  }

  Properties common(KafkaProperties settings) {
    Properties props = new Properties();
    props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, String.join(",", settings.brokerList()));
    if (settings.clientId() != null && !settings.clientId().isBlank()) {
      props.put(CommonClientConfigs.CLIENT_ID_CONFIG, settings.clientId().trim());
    }
    props.put(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, millis(settings.effectiveRequestTimeout()));
    props.put(CommonClientConfigs.RETRY_BACKOFF_MS_CONFIG, settings.effectiveRetryBackoff().toMillis());
    props.put(CommonClientConfigs.RECONNECT_BACKOFF_MS_CONFIG, settings.effectiveRetryBackoff().toMillis());
    Duration dial = settings.effectiveDialTimeout();
    props.put(CommonClientConfigs.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG, dial.toMillis());
    props.put(
        CommonClientConfigs.SOCKET_CONNECTION_SETUP_TIMEOUT_MAX_MS_CONFIG,
        Math.max(dial.toMillis(), MAX_CONNECTION_SETUP_TIMEOUT.toMillis())
    );

    AuthType authType = settings.resolvedAuthType();
    TlsProperties tls = settings.tls();
    props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, securityProtocol(authType, tls.enabled()).name);
    if (tls.enabled()) {
      applyTls(props, tls);
    }
    if (authType.usesSasl()) {
      applySasl(props, settings, authType);
    }
    return props;
  }

  static SecurityProtocol securityProtocol(AuthType authType, boolean tls) {
    if (authType.usesSasl()) {
      return tls ? SecurityProtocol.SASL_SSL : SecurityProtocol.SASL_PLAINTEXT;
    }
    return tls ? SecurityProtocol.SSL : SecurityProtocol.PLAINTEXT;
  }

  private void applySasl(Properties props, KafkaProperties settings, AuthType authType) {
    String username = settings.username() == null ? "" : settings.username().trim();
    switch (authType) {
      case PLAIN -> {
        props.put(SaslConfigs.SASL_MECHANISM, "PLAIN");
        props.put(SaslConfigs.SASL_JAAS_CONFIG, secretJaas(PLAIN_LOGIN_MODULE, "username", username, "password", settings));
      }
      case SCRAM_256 -> {
        props.put(SaslConfigs.SASL_MECHANISM, "SCRAM-SHA-256");
        props.put(SaslConfigs.SASL_JAAS_CONFIG, secretJaas(SCRAM_LOGIN_MODULE, "username", username, "password", settings));
      }
      case SCRAM_512 -> {
        props.put(SaslConfigs.SASL_MECHANISM, "SCRAM-SHA-512");
        props.put(SaslConfigs.SASL_JAAS_CONFIG, secretJaas(SCRAM_LOGIN_MODULE, "username", username, "password", settings));
      }
      case AWS_MSK_IAM -> {
        props.put(SaslConfigs.SASL_MECHANISM, IAM_MECHANISM);
        props.put(
            SaslConfigs.SASL_JAAS_CONFIG,
            IAM_LOGIN_MODULE + " required awsStsRegion=\"" + escape(settings.awsRegion().trim()) + "\";"
        );
        props.put(SaslConfigs.SASL_CLIENT_CALLBACK_HANDLER_CLASS, IAM_CALLBACK_HANDLER);
      }
      case OAUTH -> {
        props.put(SaslConfigs.SASL_MECHANISM, "OAUTHBEARER");
        props.put(SaslConfigs.SASL_OAUTHBEARER_TOKEN_ENDPOINT_URL, settings.oauthTokenUrl().trim());
        props.put(SaslConfigs.SASL_LOGIN_CALLBACK_HANDLER_CLASS, OAUTH_CALLBACK_HANDLER);
        props.put(SaslConfigs.SASL_JAAS_CONFIG, secretJaas(OAUTH_LOGIN_MODULE, "clientId", username, "clientSecret", settings));
      }
      default -> throw new IllegalStateException("No SASL mapping for " + authType);
    }
  }

  private String secretJaas(String module, String userKey, String user, String secretKey, KafkaProperties settings) {
    char[] secret = credentials.resolve(settings.credential());
    StringBuilder jaas = new StringBuilder(module.length() + user.length() + secret.length + 48);
    try {
      jaas.append(module).append(" required ")
          .append(userKey).append("=\"").append(escape(user)).append("\" ")
          .append(secretKey).append("=\"");
      for (char c : secret) {
        if (c == '"' || c == '\\') {
          jaas.append('\\');
        }
        jaas.append(c);
      }
      jaas.append("\";");
      return jaas.toString();
    } finally {
      Arrays.fill(secret, '\0');
      for (int i = 0; i < jaas.length(); i++) {
        jaas.setCharAt(i, '\0');
      }
    }
  }

  private static void applyTls(Properties props, TlsProperties tls) {
    putIfPresent(props, SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, tls.truststoreLocation());
    putIfPresent(props, SslConfigs.SSL_TRUSTSTORE_PASSWORD_CONFIG, tls.truststorePassword());
    putIfPresent(props, SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, tls.truststoreType());
    putIfPresent(props, SslConfigs.SSL_KEYSTORE_LOCATION_CONFIG, tls.keystoreLocation());
    putIfPresent(props, SslConfigs.SSL_KEYSTORE_PASSWORD_CONFIG, tls.keystorePassword());
    putIfPresent(props, SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, tls.keystoreType());
    putIfPresent(props, SslConfigs.SSL_KEY_PASSWORD_CONFIG, tls.keyPassword());
    if (tls.insecureSkipVerify()) {
      props.put(SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, "");
    }
  }

  private static void putIfPresent(Properties props, String key, String value) {
    if (value != null && !value.isBlank()) {
      props.put(key, value.trim());
    }
  }

  private static void putMillis(Properties props, String key, Duration value) {
    if (value != null && !value.isNegative() && !value.isZero()) {
      props.put(key, millis(value));
    }
  }

  private static int millis(Duration value) {
    return Math.toIntExact(value.toMillis());
  }

  static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
