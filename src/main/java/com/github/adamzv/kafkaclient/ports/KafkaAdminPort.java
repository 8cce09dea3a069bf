package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.BrokerInfo;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.GroupInfo;
import com.github.adamzv.kafkaclient.domain.GroupSummary;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.TopicConfig;
import com.github.adamzv.kafkaclient.domain.TopicInfo;
import java.util.List;
import java.util.Set;

public interface KafkaAdminPort extends AutoCloseable {

  void createTopics(CallContext ctx, TopicConfig... topics) throws ProblemException;

  void createTopic(CallContext ctx, String topic, int partitions, int replicationFactor) throws ProblemException;

  void deleteTopics(CallContext ctx, String... topics) throws ProblemException;

  Set<String> listTopics(CallContext ctx) throws ProblemException;

  List<TopicInfo> describeTopics(CallContext ctx, String... topics) throws ProblemException;

  boolean topicExists(CallContext ctx, String topic) throws ProblemException;

  List<BrokerInfo> listBrokers(CallContext ctx) throws ProblemException;

  List<GroupSummary> listGroups(CallContext ctx) throws ProblemException;

  List<GroupInfo> describeGroups(CallContext ctx, String... groupIds) throws ProblemException;

  void deleteGroups(CallContext ctx, String... groupIds) throws ProblemException;

  boolean isConnected();

  @Override
  void close();
}
