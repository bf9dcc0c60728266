package com.platformcore.webhook.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platformcore.webhook.exceptions.WebhookStoreException;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.DeliveryStatus;
import com.platformcore.webhook.models.WebhookSubscription;
import com.platformcore.webhook.utils.JsonUtils;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * DynamoDB-backed {@link WebhookStore}.
 *
 * <p>Item layout: partition key {@code service_tenant} ({@code "{service}#{tenant}"}), sort key
 * {@code webhook_id}. The configuration is a JSON document in {@code config}; health fields are
 * native attributes so they can be changed with atomic {@code ADD}/{@code SET}. The bounded
 * delivery list is a JSON array in {@code deliveries}, rewritten under an optimistic
 * {@code deliveries_version} condition.
 */
public class WebhookDynamoDbService implements WebhookStore {

  static final String PK = "service_tenant";
  static final String SK = "webhook_id";
  static final String SERVICE_NAME = "service_name";
  static final String TENANT_ID = "tenant_id";
  static final String CONFIG = "config";
  static final String IS_ACTIVE = "is_active";
  static final String CONSECUTIVE_FAILURES = "consecutive_failures";
  static final String DISABLED_REASON = "disabled_reason";
  static final String LAST_DELIVERY_AT = "last_delivery_at";
  static final String LAST_DELIVERY_STATUS = "last_delivery_status";
  static final String DELIVERIES = "deliveries";
  static final String DELIVERIES_VERSION = "deliveries_version";
  static final String DELIVERY_COUNT = "delivery_count";

  static final char KEY_SEPARATOR = '#';

  private static final int MAX_LIST_WRITE_ATTEMPTS = 5;
  private static final String[] HEALTH_FIELDS = {"isActive", "consecutiveFailures",
      "disabledReason", "lastDeliveryAt", "lastDeliveryStatus", "deliveries", "deliveryCount"};

  private static final LambdaLogger logger = LambdaRuntime.getLogger();

  private final DynamoDbClient dynamoDb;
  private final String tableName;
  private final String serviceName;
  private final ObjectMapper objectMapper;

  public WebhookDynamoDbService(String tableName, String serviceName) {
    this(DynamoDbClient.builder().build(), tableName, serviceName);
  }

  public WebhookDynamoDbService(DynamoDbClient dynamoDb, String tableName, String serviceName) {
    if (serviceName == null || serviceName.isEmpty()
        || serviceName.indexOf(KEY_SEPARATOR) >= 0) {
      throw new IllegalArgumentException("serviceName must be non-empty and must not contain '"
          + KEY_SEPARATOR + "': " + serviceName);
    }
    this.dynamoDb = dynamoDb;
    this.tableName = tableName;
    this.serviceName = serviceName;
    this.objectMapper = JsonUtils.newObjectMapper();
  }

  @Override
  public void insert(WebhookSubscription subscription) {
    Map<String, AttributeValue> item = new HashMap<>(key(subscription.getTenantId(),
        subscription.getId()));
    item.put(SERVICE_NAME, s(serviceName));
    item.put(TENANT_ID, s(subscription.getTenantId()));
    item.put(CONFIG, s(toConfigJson(subscription)));
    item.put(IS_ACTIVE, AttributeValue.builder().bool(subscription.isActiveSubscription()).build());
    item.put(CONSECUTIVE_FAILURES, n(subscription.getConsecutiveFailures()));
    item.put(DELIVERIES, s(writeJson(subscription.getDeliveries())));
    item.put(DELIVERIES_VERSION, n(0));
    item.put(DELIVERY_COUNT, n(subscription.getDeliveryCount()));

    PutItemRequest request = PutItemRequest.builder().tableName(tableName).item(item)
        .conditionExpression("attribute_not_exists(#sk)")
        .expressionAttributeNames(Map.of("#sk", SK)).build();
    try {
      dynamoDb.putItem(request);
    } catch (ConditionalCheckFailedException e) {
      throw new WebhookStoreException("Webhook already exists: " + subscription.getId(), e);
    }
  }

  @Override
  public Optional<WebhookSubscription> find(String tenantId, String id) {
    GetItemRequest request = GetItemRequest.builder().tableName(tableName).key(key(tenantId, id))
        .consistentRead(true).build();
    Map<String, AttributeValue> item = dynamoDb.getItem(request).item();
    if (item == null || item.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toSubscription(item));
  }

  @Override
  public List<WebhookSubscription> findByTenant(String tenantId) {
    List<WebhookSubscription> subscriptions = new ArrayList<>();
    Map<String, AttributeValue> startKey = null;
    do {
      QueryRequest.Builder request = QueryRequest.builder().tableName(tableName)
          .keyConditionExpression("#pk = :pk")
          .expressionAttributeNames(Map.of("#pk", PK))
          .expressionAttributeValues(Map.of(":pk", s(partitionKey(tenantId))));
      if (startKey != null) {
        request.exclusiveStartKey(startKey);
      }
      QueryResponse response = dynamoDb.query(request.build());
      response.items().forEach(item -> subscriptions.add(toSubscription(item)));
      startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
          ? response.lastEvaluatedKey() : null;
    } while (startKey != null);
    return subscriptions;
  }

  @Override
  public List<WebhookSubscription> findAll() {
    List<WebhookSubscription> subscriptions = new ArrayList<>();
    Map<String, AttributeValue> startKey = null;
    do {
      ScanRequest.Builder request = ScanRequest.builder().tableName(tableName)
          .filterExpression("#svc = :svc")
          .expressionAttributeNames(Map.of("#svc", SERVICE_NAME))
          .expressionAttributeValues(Map.of(":svc", s(serviceName)));
      if (startKey != null) {
        request.exclusiveStartKey(startKey);
      }
      ScanResponse response = dynamoDb.scan(request.build());
      response.items().forEach(item -> subscriptions.add(toSubscription(item)));
      startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
          ? response.lastEvaluatedKey() : null;
    } while (startKey != null);
    return subscriptions;
  }

  @Override
  public Optional<WebhookSubscription> saveConfiguration(WebhookSubscription subscription,
      boolean resetHealth) {
    Map<String, String> names = new HashMap<>();
    names.put("#sk", SK);
    names.put("#config", CONFIG);
    names.put("#active", IS_ACTIVE);
    Map<String, AttributeValue> values = new HashMap<>();
    values.put(":config", s(toConfigJson(subscription)));
    values.put(":active", AttributeValue.builder().bool(subscription.isActiveSubscription()).build());

    String expression = "SET #config = :config, #active = :active";
    if (resetHealth) {
      names.put("#failures", CONSECUTIVE_FAILURES);
      names.put("#reason", DISABLED_REASON);
      values.put(":zero", n(0));
      expression += ", #failures = :zero REMOVE #reason";
    }

    UpdateItemRequest request = UpdateItemRequest.builder().tableName(tableName)
        .key(key(subscription.getTenantId(), subscription.getId()))
        .updateExpression(expression)
        .conditionExpression("attribute_exists(#sk)")
        .expressionAttributeNames(names)
        .expressionAttributeValues(values)
        .returnValues(ReturnValue.ALL_NEW).build();
    try {
      UpdateItemResponse response = dynamoDb.updateItem(request);
      return Optional.of(toSubscription(response.attributes()));
    } catch (ConditionalCheckFailedException e) {
      return Optional.empty();
    }
  }

  @Override
  public boolean delete(String tenantId, String id) {
    DeleteItemRequest request = DeleteItemRequest.builder().tableName(tableName)
        .key(key(tenantId, id)).returnValues(ReturnValue.ALL_OLD).build();
    DeleteItemResponse response = dynamoDb.deleteItem(request);
    return response.hasAttributes() && !response.attributes().isEmpty();
  }

  @Override
  public boolean markDelivered(String tenantId, String id, Instant deliveredAt) {
    UpdateItemRequest request = UpdateItemRequest.builder().tableName(tableName)
        .key(key(tenantId, id))
        .updateExpression("SET #failures = :zero, #status = :status, #at = :at")
        .conditionExpression("attribute_exists(#sk)")
        .expressionAttributeNames(Map.of("#sk", SK, "#failures", CONSECUTIVE_FAILURES,
            "#status", LAST_DELIVERY_STATUS, "#at", LAST_DELIVERY_AT))
        .expressionAttributeValues(Map.of(":zero", n(0),
            ":status", s(DeliveryStatus.SUCCESS.getValue()), ":at", s(deliveredAt.toString())))
        .build();
    return updateExisting(request, tenantId, id) != null;
  }

  @Override
  public OptionalInt markFailed(String tenantId, String id, Instant attemptedAt) {
    UpdateItemRequest request = UpdateItemRequest.builder().tableName(tableName)
        .key(key(tenantId, id))
        .updateExpression("ADD #failures :one SET #status = :status, #at = :at")
        .conditionExpression("attribute_exists(#sk)")
        .expressionAttributeNames(Map.of("#sk", SK, "#failures", CONSECUTIVE_FAILURES,
            "#status", LAST_DELIVERY_STATUS, "#at", LAST_DELIVERY_AT))
        .expressionAttributeValues(Map.of(":one", n(1),
            ":status", s(DeliveryStatus.FAILED.getValue()), ":at", s(attemptedAt.toString())))
        .returnValues(ReturnValue.UPDATED_NEW).build();
    UpdateItemResponse response = updateExisting(request, tenantId, id);
    if (response == null) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(Integer.parseInt(response.attributes().get(CONSECUTIVE_FAILURES).n()));
  }

  @Override
  public boolean disable(String tenantId, String id, String reason) {
    UpdateItemRequest request = UpdateItemRequest.builder().tableName(tableName)
        .key(key(tenantId, id))
        .updateExpression("SET #active = :false, #reason = :reason")
        .conditionExpression("attribute_exists(#sk)")
        .expressionAttributeNames(Map.of("#sk", SK, "#active", IS_ACTIVE,
            "#reason", DISABLED_REASON))
        .expressionAttributeValues(Map.of(":false", AttributeValue.builder().bool(false).build(),
            ":reason", s(reason)))
        .build();
    return updateExisting(request, tenantId, id) != null;
  }

  @Override
  public boolean appendDelivery(String tenantId, String id, DeliveryRecord record, int capacity) {
    return rewriteDeliveries(tenantId, id, true, deliveries -> {
      List<DeliveryRecord> updated = new ArrayList<>(deliveries);
      updated.add(record);
      return tail(updated, capacity);
    }) != null;
  }

  @Override
  public int pruneDeliveries(String tenantId, String id, Predicate<DeliveryRecord> retain,
      int capacity) {
    int[] removed = new int[1];
    List<DeliveryRecord> result = rewriteDeliveries(tenantId, id, false, deliveries -> {
      List<DeliveryRecord> kept = new ArrayList<>();
      for (DeliveryRecord delivery : deliveries) {
        if (retain.test(delivery)) {
          kept.add(delivery);
        }
      }
      removed[0] = deliveries.size() - kept.size();
      return tail(kept, capacity);
    });
    return result == null ? 0 : removed[0];
  }

  /**
   * Read-modify-write of the delivery list guarded by {@code deliveries_version}. Retries when
   * another writer got in between; returns null if the item no longer exists.
   */
  private List<DeliveryRecord> rewriteDeliveries(String tenantId, String id,
      boolean incrementCount, UnaryOperator<List<DeliveryRecord>> change) {
    for (int attempt = 1; attempt <= MAX_LIST_WRITE_ATTEMPTS; attempt++) {
      GetItemRequest read = GetItemRequest.builder().tableName(tableName).key(key(tenantId, id))
          .projectionExpression("#d, #v")
          .expressionAttributeNames(Map.of("#d", DELIVERIES, "#v", DELIVERIES_VERSION))
          .consistentRead(true).build();
      Map<String, AttributeValue> item = dynamoDb.getItem(read).item();
      if (item == null || item.isEmpty()) {
        return null;
      }
      List<DeliveryRecord> current = readDeliveries(item);
      AttributeValue version = item.get(DELIVERIES_VERSION);
      long expected = version == null ? 0 : Long.parseLong(version.n());
      List<DeliveryRecord> updated = change.apply(current);

      Map<String, String> names = new HashMap<>();
      names.put("#sk", SK);
      names.put("#d", DELIVERIES);
      names.put("#v", DELIVERIES_VERSION);
      Map<String, AttributeValue> values = new HashMap<>();
      values.put(":d", s(writeJson(updated)));
      values.put(":next", n(expected + 1));
      String expression = "SET #d = :d, #v = :next";
      if (incrementCount) {
        names.put("#count", DELIVERY_COUNT);
        values.put(":one", n(1));
        expression += " ADD #count :one";
      }
      String condition = "attribute_exists(#sk) AND ";
      if (version == null) {
        condition += "attribute_not_exists(#v)";
      } else {
        values.put(":expected", n(expected));
        condition += "#v = :expected";
      }

      UpdateItemRequest write = UpdateItemRequest.builder().tableName(tableName)
          .key(key(tenantId, id))
          .updateExpression(expression)
          .conditionExpression(condition)
          .expressionAttributeNames(names)
          .expressionAttributeValues(values).build();
      try {
        dynamoDb.updateItem(write);
        return updated;
      } catch (ConditionalCheckFailedException e) {
        logger.log("Concurrent update of deliveries for webhook " + id + ", attempt " + attempt);
      }
    }
    throw new WebhookStoreException("Could not update deliveries of webhook " + id + " after "
        + MAX_LIST_WRITE_ATTEMPTS + " attempts");
  }

  private UpdateItemResponse updateExisting(UpdateItemRequest request, String tenantId,
      String id) {
    try {
      return dynamoDb.updateItem(request);
    } catch (ConditionalCheckFailedException e) {
      logger.log("Webhook not found: id=" + id + ", tenantId=" + tenantId + ", service="
          + serviceName);
      return null;
    }
  }

  WebhookSubscription toSubscription(Map<String, AttributeValue> item) {
    WebhookSubscription subscription = readJson(item.get(CONFIG).s(), WebhookSubscription.class);
    subscription.setIsActive(item.containsKey(IS_ACTIVE) && item.get(IS_ACTIVE).bool());
    subscription.setConsecutiveFailures(intAttribute(item, CONSECUTIVE_FAILURES));
    subscription.setDisabledReason(item.containsKey(DISABLED_REASON)
        ? item.get(DISABLED_REASON).s() : null);
    subscription.setLastDeliveryAt(item.containsKey(LAST_DELIVERY_AT)
        ? Instant.parse(item.get(LAST_DELIVERY_AT).s()) : null);
    subscription.setLastDeliveryStatus(item.containsKey(LAST_DELIVERY_STATUS)
        ? DeliveryStatus.fromValue(item.get(LAST_DELIVERY_STATUS).s()) : null);
    // items written before deliveries were embedded have neither attribute
    subscription.setDeliveries(readDeliveries(item));
    subscription.setDeliveryCount(item.containsKey(DELIVERY_COUNT)
        ? Long.parseLong(item.get(DELIVERY_COUNT).n()) : 0L);
    return subscription;
  }

  private List<DeliveryRecord> readDeliveries(Map<String, AttributeValue> item) {
    AttributeValue value = item.get(DELIVERIES);
    if (value == null || value.s() == null || value.s().isEmpty()) {
      return new ArrayList<>();
    }
    return new ArrayList<>(readJson(value.s(), new TypeReference<List<DeliveryRecord>>() {}));
  }

  private String toConfigJson(WebhookSubscription subscription) {
    ObjectNode node = objectMapper.valueToTree(subscription);
    for (String field : HEALTH_FIELDS) {
      node.remove(field);
    }
    return writeJson(node);
  }

  private static List<DeliveryRecord> tail(List<DeliveryRecord> deliveries, int capacity) {
    if (deliveries.size() <= capacity) {
      return deliveries;
    }
    return new ArrayList<>(deliveries.subList(deliveries.size() - capacity, deliveries.size()));
  }

  private static int intAttribute(Map<String, AttributeValue> item, String name) {
    AttributeValue value = item.get(name);
    return value == null ? 0 : Integer.parseInt(value.n());
  }

  private Map<String, AttributeValue> key(String tenantId, String id) {
    return Map.of(PK, s(partitionKey(tenantId)), SK, s(id));
  }

  String partitionKey(String tenantId) {
    return serviceName + KEY_SEPARATOR + tenantId;
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new WebhookStoreException("Failed to serialize webhook data", e);
    }
  }

  private <T> T readJson(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new WebhookStoreException("Failed to read stored webhook", e);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new WebhookStoreException("Failed to read stored deliveries", e);
    }
  }

  private static AttributeValue s(String value) {
    return AttributeValue.builder().s(value).build();
  }

  private static AttributeValue n(long value) {
    return AttributeValue.builder().n(Long.toString(value)).build();
  }
}
