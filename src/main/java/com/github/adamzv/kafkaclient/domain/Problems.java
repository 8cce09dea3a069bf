package com.github.adamzv.kafkaclient.domain;

import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException nilConfig() {
    return raise(ProblemCodes.NIL_CONFIG, "Config is null", Map.of());
  }

  public static ProblemException missingBrokers() {
    return raise(ProblemCodes.MISSING_BROKERS, "Missing broker address", Map.of());
  }

  public static ProblemException missingTopic(Map<String, Object> details) {
    return raise(ProblemCodes.MISSING_TOPIC, "Missing topic name", details);
  }

  public static ProblemException missingGroup(Map<String, Object> details) {
    return raise(ProblemCodes.MISSING_GROUP, "Missing consumer group", details);
  }

  public static ProblemException invalidAuthType(String authType) {
    return raise(ProblemCodes.INVALID_AUTH_TYPE, "Invalid authentication type", detail("authType", authType));
  }

  public static ProblemException invalidAcks(String acks) {
    return raise(ProblemCodes.INVALID_ACKS, "Invalid acks value", detail("acks", acks));
  }

  public static ProblemException invalidCompression(String compression) {
    return raise(ProblemCodes.INVALID_COMPRESSION, "Invalid compression codec", detail("compression", compression));
  }

  public static ProblemException invalidOffset(String startOffset) {
    return raise(ProblemCodes.INVALID_OFFSET, "Invalid start offset", detail("startOffset", startOffset));
  }

  public static ProblemException invalidIsolation(String isolationLevel) {
    return raise(ProblemCodes.INVALID_ISOLATION, "Invalid isolation level", detail("isolationLevel", isolationLevel));
  }

  public static ProblemException missingAwsRegion() {
    return raise(ProblemCodes.MISSING_AWS_REGION, "AWS region is required for aws-msk-iam authentication", Map.of());
  }

  public static ProblemException missingOAuthTokenUrl() {
    return raise(ProblemCodes.MISSING_OAUTH_TOKEN_URL, "Token URL is required for oauth authentication", Map.of());
  }

  public static ProblemException credentialUnavailable(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.CREDENTIAL_UNAVAILABLE, message, details, cause);
  }

  public static ProblemException clientClosed(String client) {
    return raise(ProblemCodes.CLIENT_CLOSED, "Kafka " + client + " is closed", detail("client", client));
  }

  public static ProblemException nilContext() {
    return raise(ProblemCodes.NIL_CONTEXT, "Call context is required", Map.of());
  }

  public static ProblemException nilHandler() {
    return raise(ProblemCodes.NIL_HANDLER, "Handler is required", Map.of());
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details);
  }

  public static ProblemException transactionAborted() {
    return raise(ProblemCodes.TRANSACTION_ABORTED, "Transaction already aborted or finished", Map.of());
  }

  public static ProblemException noTransactionalId() {
    return raise(ProblemCodes.NO_TRANSACTIONAL_ID, "Producer has no transactional id", Map.of());
  }

  public static ProblemException transactionInProgress(String transactionalId) {
    return raise(
        ProblemCodes.TRANSACTION_IN_PROGRESS,
        "Another transaction is active on this producer",
        detail("transactionalId", transactionalId)
    );
  }

  public static ProblemException notFound(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NOT_FOUND, message, details);
  }

  public static ProblemException kafkaUnavailable(String message, Map<String, Object> details) {
    return raise(ProblemCodes.KAFKA_UNAVAILABLE, message, details);
  }

  public static ProblemException kafkaUnavailable(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.KAFKA_UNAVAILABLE, message, details, cause);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, cause);
  }

  public static ProblemException cancelled(String message) {
    return raise(ProblemCodes.CANCELLED, message, Map.of());
  }

  public static ProblemException serializationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.SERIALIZATION_FAILED, message, details, cause);
  }

  public static ProblemException handlerFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.HANDLER_FAILED, message, details, cause);
  }

  private static Map<String, Object> detail(String key, String value) {
    return value == null ? Map.of() : Map.of(key, value);
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details) {
    return new ProblemException(new Problem(code, message, details));
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details, Throwable cause) {
    return new ProblemException(new Problem(code, message, details), cause);
  }
}
