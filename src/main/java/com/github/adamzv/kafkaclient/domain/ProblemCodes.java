package com.github.adamzv.kafkaclient.domain;

public final class ProblemCodes {

  // configuration
  public static final String NIL_CONFIG = "NIL_CONFIG";
  public static final String MISSING_BROKERS = "MISSING_BROKERS";
  public static final String MISSING_TOPIC = "MISSING_TOPIC";
  public static final String MISSING_GROUP = "MISSING_GROUP";
  public static final String INVALID_AUTH_TYPE = "INVALID_AUTH_TYPE";
  public static final String INVALID_ACKS = "INVALID_ACKS";
  public static final String INVALID_COMPRESSION = "INVALID_COMPRESSION";
  public static final String INVALID_OFFSET = "INVALID_OFFSET";
  public static final String INVALID_ISOLATION = "INVALID_ISOLATION";
  public static final String MISSING_AWS_REGION = "MISSING_AWS_REGION";
  public static final String MISSING_OAUTH_TOKEN_URL = "MISSING_OAUTH_TOKEN_URL";
  public static final String CREDENTIAL_UNAVAILABLE = "CREDENTIAL_UNAVAILABLE";

  // preconditions
  public static final String CLIENT_CLOSED = "CLIENT_CLOSED";
  public static final String NIL_CONTEXT = "NIL_CONTEXT";
  public static final String NIL_HANDLER = "NIL_HANDLER";
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

  // transactions
  public static final String TRANSACTION_ABORTED = "TRANSACTION_ABORTED";
  public static final String NO_TRANSACTIONAL_ID = "NO_TRANSACTIONAL_ID";
  public static final String TRANSACTION_IN_PROGRESS = "TRANSACTION_IN_PROGRESS";

  // runtime
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String KAFKA_UNAVAILABLE = "KAFKA_UNAVAILABLE";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";
  public static final String CANCELLED = "CANCELLED";
  public static final String SERIALIZATION_FAILED = "SERIALIZATION_FAILED";
  public static final String HANDLER_FAILED = "HANDLER_FAILED";

  private ProblemCodes() {
  }
}
