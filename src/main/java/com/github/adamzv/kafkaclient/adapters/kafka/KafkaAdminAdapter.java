package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.BrokerInfo;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.GroupInfo;
import com.github.adamzv.kafkaclient.domain.GroupMember;
import com.github.adamzv.kafkaclient.domain.GroupSummary;
import com.github.adamzv.kafkaclient.domain.PartitionAssignment;
import com.github.adamzv.kafkaclient.domain.PartitionDetail;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.Problems;
import com.github.adamzv.kafkaclient.domain.TopicConfig;
import com.github.adamzv.kafkaclient.domain.TopicInfo;
import com.github.adamzv.kafkaclient.ports.KafkaAdminPort;
import com.github.adamzv.kafkaclient.support.KafkaProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.ConsumerGroupDescription;
import org.apache.kafka.clients.admin.ConsumerGroupListing;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.DeleteConsumerGroupsOptions;
import org.apache.kafka.clients.admin.DeleteTopicsOptions;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeConsumerGroupsOptions;
import org.apache.kafka.clients.admin.DescribeTopicsOptions;
import org.apache.kafka.clients.admin.ListConsumerGroupsOptions;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.apache.kafka.clients.admin.MemberDescription;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.TopicPartitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaAdminAdapter implements KafkaAdminPort {

  private static final String CLIENT = "admin";

  private final Logger log;
  private final String bootstrapServers;
  private final Duration requestTimeout;
  private final KafkaCalls calls;

  private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
  private Admin admin;
  private boolean closed;

  public KafkaAdminAdapter(KafkaProperties properties) {
    this(properties, (Logger) null);
  }

  public KafkaAdminAdapter(KafkaProperties properties, Logger logger) {
    this(properties, createClient(properties), logger);
  }

  /**
   * Wraps an existing client, for example a {@code MockAdminClient}. The adapter takes
   * ownership and closes it.
   */
  public KafkaAdminAdapter(KafkaProperties properties, Admin admin, Logger logger) {
    validate(properties);
    if (admin == null) {
      throw Problems.invalidArgument("Admin client must not be null", Map.of());
    }
    this.log = logger == null ? LoggerFactory.getLogger(KafkaAdminAdapter.class) : logger;
    this.bootstrapServers = String.join(",", properties.brokerList());
    this.requestTimeout = properties.effectiveRequestTimeout();
    this.calls = new KafkaCalls(bootstrapServers);
    this.admin = admin;
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_admin_open brokers={}", bootstrapServers);
    }
  }

  private static Admin createClient(KafkaProperties properties) {
    validate(properties);
    try {
      return Admin.create(new ClientPropertiesFactory().admin(properties));
    } catch (RuntimeException ex) {
      throw new KafkaCalls(String.join(",", properties.brokerList())).translate("createAdmin", ex, Map.of());
    }
  }

  private static void validate(KafkaProperties properties) {
    if (properties == null) {
      throw Problems.nilConfig();
    }
    properties.validate();
  }

  @Override
  public void createTopics(CallContext ctx, TopicConfig... topics) {
    requireContext(ctx);
    List<TopicConfig> requested = nonNull(topics, "Topics");
    if (requested.isEmpty()) {
      return;
    }
    List<NewTopic> newTopics = new ArrayList<>(requested.size());
    for (TopicConfig topic : requested) {
      if (topic.name() == null || topic.name().isBlank()) {
        throw Problems.missingTopic(Map.of());
      }
      Optional<Integer> partitions = topic.partitions() > 0 ? Optional.of(topic.partitions()) : Optional.empty();
      Optional<Short> replication = topic.replicationFactor() > 0
          ? Optional.of(topic.replicationFactor())
          : Optional.empty();
      newTopics.add(new NewTopic(topic.name(), partitions, replication).configs(topic.configs()));
    }
    Admin client = client();
    CreateTopicsOptions options = new CreateTopicsOptions().timeoutMs(timeoutMs(ctx));
    CreateTopicsResult result = call("createTopics", () -> client.createTopics(newTopics, options));
    for (TopicConfig topic : requested) {
      await(result.values().get(topic.name()), ctx, "createTopics", Map.of("topic", topic.name()));
    }
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_topics_created topics={}", requested.stream().map(TopicConfig::name).toList());
    }
  }

  @Override
  public void createTopic(CallContext ctx, String topic, int partitions, int replicationFactor) {
    createTopics(ctx, TopicConfig.of(topic, partitions, replicationFactor));
  }

  @Override
  public void deleteTopics(CallContext ctx, String... topics) {
    requireContext(ctx);
    List<String> names = nonNull(topics, "Topics");
    if (names.isEmpty()) {
      return;
    }
    Admin client = client();
    DeleteTopicsOptions options = new DeleteTopicsOptions().timeoutMs(timeoutMs(ctx));
    Map<String, KafkaFuture<Void>> results = call(
        "deleteTopics",
        () -> client.deleteTopics(names, options).topicNameValues()
    );
    for (String name : names) {
      await(results.get(name), ctx, "deleteTopics", Map.of("topic", name));
    }
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_topics_deleted topics={}", names);
    }
  }

  @Override
  public Set<String> listTopics(CallContext ctx) {
    requireContext(ctx);
    Admin client = client();
    ListTopicsOptions options = new ListTopicsOptions().listInternal(true).timeoutMs(timeoutMs(ctx));
    Set<String> names = await(call("listTopics", () -> client.listTopics(options).names()), ctx, "listTopics", Map.of());
    return Set.copyOf(names);
  }

  /**
   * Describes the named topics in request order, or every topic when no name is given.
   */
  @Override
  public List<TopicInfo> describeTopics(CallContext ctx, String... topics) {
    requireContext(ctx);
    List<String> names = nonNull(topics, "Topics");
    if (names.isEmpty()) {
      names = listTopics(ctx).stream().sorted().toList();
      if (names.isEmpty()) {
        return List.of();
      }
    }
    Admin client = client();
    DescribeTopicsOptions options = new DescribeTopicsOptions()
        .timeoutMs(timeoutMs(ctx))
        .includeAuthorizedOperations(false);
    List<String> requested = names;
    Map<String, KafkaFuture<TopicDescription>> results = call(
        "describeTopics",
        () -> client.describeTopics(requested, options).topicNameValues()
    );
    List<TopicInfo> described = new ArrayList<>(requested.size());
    for (String name : requested) {
      TopicDescription description = await(results.get(name), ctx, "describeTopics", Map.of("topic", name));
      described.add(toTopicInfo(description));
    }
    return List.copyOf(described);
  }

  private static TopicInfo toTopicInfo(TopicDescription description) {
    List<PartitionDetail> partitions = description.partitions().stream()
        .sorted(Comparator.comparingInt(TopicPartitionInfo::partition))
        .map(partition -> new PartitionDetail(
            partition.partition(),
            partition.leader() == null ? -1 : partition.leader().id(),
            nodeIds(partition.replicas()),
            nodeIds(partition.isr())
        ))
        .toList();
    return new TopicInfo(description.name(), description.isInternal(), partitions);
  }

  @Override
  public boolean topicExists(CallContext ctx, String topic) {
    requireContext(ctx);
    if (topic == null || topic.isBlank()) {
      throw Problems.missingTopic(Map.of());
    }
    return listTopics(ctx).contains(topic);
  }

  @Override
  public List<BrokerInfo> listBrokers(CallContext ctx) {
    requireContext(ctx);
    Admin client = client();
    DescribeClusterOptions options = new DescribeClusterOptions().timeoutMs(timeoutMs(ctx));
    Collection<Node> nodes = await(
        call("listBrokers", () -> client.describeCluster(options).nodes()),
        ctx,
        "listBrokers",
        Map.of()
    );
    return nodes.stream()
        .sorted(Comparator.comparingInt(Node::id))
        .map(node -> new BrokerInfo(node.id(), node.host(), node.port(), node.rack()))
        .toList();
  }

  @Override
  public List<GroupSummary> listGroups(CallContext ctx) {
    requireContext(ctx);
    Admin client = client();
    ListConsumerGroupsOptions options = new ListConsumerGroupsOptions().timeoutMs(timeoutMs(ctx));
    Collection<ConsumerGroupListing> listings = await(
        call("listGroups", () -> client.listConsumerGroups(options).all()),
        ctx,
        "listGroups",
        Map.of()
    );
    return listings.stream()
        .sorted(Comparator.comparing(ConsumerGroupListing::groupId))
        .map(listing -> new GroupSummary(
            listing.groupId(),
            listing.state().map(Object::toString).orElse(""),
            listing.isSimpleConsumerGroup() ? "" : "consumer"
        ))
        .toList();
  }

  @Override
  public List<GroupInfo> describeGroups(CallContext ctx, String... groupIds) {
    requireContext(ctx);
    List<String> ids = nonNull(groupIds, "Group ids");
    if (ids.isEmpty()) {
      return List.of();
    }
    Admin client = client();
    DescribeConsumerGroupsOptions options = new DescribeConsumerGroupsOptions().timeoutMs(timeoutMs(ctx));
    Map<String, KafkaFuture<ConsumerGroupDescription>> results = call(
        "describeGroups",
        () -> client.describeConsumerGroups(ids, options).describedGroups()
    );
    List<GroupInfo> groups = new ArrayList<>(ids.size());
    for (String id : ids) {
      ConsumerGroupDescription description = await(results.get(id), ctx, "describeGroups", Map.of("groupId", id));
      groups.add(toGroupInfo(description));
    }
    return List.copyOf(groups);
  }

  private static GroupInfo toGroupInfo(ConsumerGroupDescription description) {
    List<GroupMember> members = description.members().stream()
        .map(KafkaAdminAdapter::toGroupMember)
        .toList();
    return new GroupInfo(
        description.groupId(),
        description.state() == null ? "" : description.state().toString(),
        description.isSimpleConsumerGroup() ? "" : "consumer",
        description.partitionAssignor() == null ? "" : description.partitionAssignor(),
        members
    );
  }

  private static GroupMember toGroupMember(MemberDescription member) {
    List<PartitionAssignment> assignments = new ArrayList<>();
    if (member.assignment() != null && member.assignment().topicPartitions() != null) {
      for (TopicPartition tp : member.assignment().topicPartitions()) {
        assignments.add(new PartitionAssignment(tp.topic(), tp.partition()));
      }
    }
    assignments.sort(Comparator.comparing(PartitionAssignment::topic).thenComparingInt(PartitionAssignment::partition));
    return new GroupMember(member.consumerId(), member.clientId(), member.host(), List.copyOf(assignments));
  }

  @Override
  public void deleteGroups(CallContext ctx, String... groupIds) {
    requireContext(ctx);
    List<String> ids = nonNull(groupIds, "Group ids");
    if (ids.isEmpty()) {
      return;
    }
    Admin client = client();
    DeleteConsumerGroupsOptions options = new DeleteConsumerGroupsOptions().timeoutMs(timeoutMs(ctx));
    Map<String, KafkaFuture<Void>> results = call(
        "deleteGroups",
        () -> client.deleteConsumerGroups(ids, options).deletedGroups()
    );
    for (String id : ids) {
      await(results.get(id), ctx, "deleteGroups", Map.of("groupId", id));
    }
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_groups_deleted groups={}", ids);
    }
  }

  @Override
  public boolean isConnected() {
    stateLock.readLock().lock();
    try {
      return !closed;
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public void close() {
    Admin client;
    stateLock.writeLock().lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      client = admin;
      admin = null;
    } finally {
      stateLock.writeLock().unlock();
    }
    try (KafkaLogContext ignored = logContext()) {
      try {
        client.close(requestTimeout);
      } catch (RuntimeException ex) {
        log.warn("kafka_admin_close_failed brokers={} error={}", bootstrapServers, ex.getMessage(), ex);
        return;
      }
      log.info("kafka_admin_closed brokers={}", bootstrapServers);
    }
  }

  private <T> T await(KafkaFuture<T> future, CallContext ctx, String operation, Map<String, Object> context) {
    if (future == null) {
      throw Problems.operationFailed("Kafka returned no result during " + operation, calls.details(context, null));
    }
    return calls.await(future, ctx, operation, context);
  }

  /**
   * Runs the request-building half of an admin call, which can fail before any future exists.
   */
  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (ProblemException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw calls.translate(operation, ex, Map.of());
    }
  }

  private int timeoutMs(CallContext ctx) {
    ctx.checkActive();
    return Math.toIntExact(Math.max(1L, ctx.remaining(requestTimeout).toMillis()));
  }

  private Admin client() {
    stateLock.readLock().lock();
    try {
      if (closed) {
        throw Problems.clientClosed(CLIENT);
      }
      return admin;
    } finally {
      stateLock.readLock().unlock();
    }
  }

  private KafkaLogContext logContext() {
    return KafkaLogContext.of(CLIENT, bootstrapServers);
  }

  private static List<Integer> nodeIds(List<Node> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      return List.of();
    }
    return nodes.stream().map(Node::id).toList();
  }

  private static <T> List<T> nonNull(T[] values, String label) {
    if (values == null) {
      throw Problems.invalidArgument(label + " must not be null", Map.of());
    }
    if (Arrays.stream(values).anyMatch(value -> value == null)) {
      throw Problems.invalidArgument(label + " must not contain null", Map.of());
    }
    return List.of(values);
  }

  private static void requireContext(CallContext ctx) {
    if (ctx == null) {
      throw Problems.nilContext();
    }
  }
}
