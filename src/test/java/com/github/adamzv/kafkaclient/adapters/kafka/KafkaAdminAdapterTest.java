package com.github.adamzv.kafkaclient.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaclient.domain.BrokerInfo;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.PartitionDetail;
import com.github.adamzv.kafkaclient.domain.ProblemCodes;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.TopicConfig;
import com.github.adamzv.kafkaclient.domain.TopicInfo;
import com.github.adamzv.kafkaclient.support.KafkaProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.admin.MockAdminClient;
import org.apache.kafka.common.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KafkaAdminAdapterTest {

  private static final Node BROKER_0 = new Node(0, "kafka-0", 9092);
  private static final Node BROKER_1 = new Node(1, "kafka-1", 9092);

  private final CallContext ctx = CallContext.background().withTimeout(Duration.ofSeconds(5));
  private MockAdminClient mock;
  private KafkaAdminAdapter adapter;

  @BeforeEach
  void setUp() {
    mock = new MockAdminClient(List.of(BROKER_1, BROKER_0), BROKER_0);
    adapter = new KafkaAdminAdapter(KafkaProperties.of("kafka-0:9092,kafka-1:9092"), mock, null);
  }

  @Test
  void createsAndDescribesTopics() {
    adapter.createTopics(ctx,
        TopicConfig.of("orders", 3, 1),
        new TopicConfig("audit", 1, (short) 2, Map.of("cleanup.policy", "compact")));

    List<TopicInfo> described = adapter.describeTopics(ctx, "orders", "audit");

    assertEquals(List.of("orders", "audit"), described.stream().map(TopicInfo::name).toList());
    TopicInfo orders = described.get(0);
    assertEquals(3, orders.partitionCount());
    assertEquals(List.of(0, 1, 2), orders.partitions().stream().map(PartitionDetail::partition).toList());
    assertFalse(orders.internal());
    assertEquals(2, described.get(1).replicationFactor());
  }

  @Test
  void describeWithoutNamesCoversEveryTopicSorted() {
    adapter.createTopic(ctx, "zeta", 1, 1);
    adapter.createTopic(ctx, "alpha", 1, 1);

    List<TopicInfo> described = adapter.describeTopics(ctx);

    assertEquals(List.of("alpha", "zeta"), described.stream().map(TopicInfo::name).toList());
  }

  @Test
  void describingUnknownTopicIsNotFound() {
    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.describeTopics(ctx, "ghost"));

    assertEquals(ProblemCodes.NOT_FOUND, exception.code());
    assertEquals("ghost", exception.problem().details().get("topic"));
    assertEquals("kafka-0:9092,kafka-1:9092", exception.problem().details().get("bootstrapServers"));
  }

  @Test
  void creatingExistingTopicFails() {
    adapter.createTopic(ctx, "orders", 1, 1);

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.createTopic(ctx, "orders", 1, 1));
    assertEquals(ProblemCodes.KAFKA_UNAVAILABLE, exception.code());
    assertEquals("TopicExistsException", exception.problem().details().get("error"));
  }

  @Test
  void deletesTopicsAndReportsExistence() {
    adapter.createTopic(ctx, "orders", 1, 1);
    assertTrue(adapter.topicExists(ctx, "orders"));
    assertTrue(adapter.listTopics(ctx).contains("orders"));

    adapter.deleteTopics(ctx, "orders");

    assertFalse(adapter.topicExists(ctx, "orders"));
  }

  @Test
  void blankTopicNamesAreRejected() {
    assertEquals(ProblemCodes.MISSING_TOPIC,
        assertThrows(ProblemException.class, () -> adapter.topicExists(ctx, " ")).code());
    assertEquals(ProblemCodes.MISSING_TOPIC,
        assertThrows(ProblemException.class, () -> adapter.createTopic(ctx, "", 1, 1)).code());
    assertEquals(ProblemCodes.INVALID_ARGUMENT,
        assertThrows(ProblemException.class, () -> adapter.deleteTopics(ctx, "a", null)).code());
  }

  @Test
  void listsBrokersById() {
    List<BrokerInfo> brokers = adapter.listBrokers(ctx);

    assertEquals(List.of(0, 1), brokers.stream().map(BrokerInfo::id).toList());
    assertEquals("kafka-1", brokers.get(1).host());
    assertEquals(9092, brokers.get(1).port());
  }

  @Test
  void emptyRequestsDoNothing() {
    adapter.createTopics(ctx);
    adapter.deleteTopics(ctx);

    assertTrue(adapter.describeGroups(ctx).isEmpty());
    assertTrue(adapter.describeTopics(ctx).isEmpty());
  }

  @Test
  void cancelledContextFailsFast() {
    CallContext cancelled = CallContext.background().withCancel();
    cancelled.cancel();

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.listTopics(cancelled));
    assertEquals(ProblemCodes.CANCELLED, exception.code());
  }

  @Test
  void closeIsIdempotent() {
    adapter.close();
    adapter.close();

    assertFalse(adapter.isConnected());
    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.listBrokers(ctx));
    assertEquals(ProblemCodes.CLIENT_CLOSED, exception.code());
  }
}
