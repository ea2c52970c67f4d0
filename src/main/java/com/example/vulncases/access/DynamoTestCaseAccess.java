package com.example.vulncases.access;

import com.example.vulncases.config.TestCaseStoreProperties;
import com.example.vulncases.models.Platform;
import com.example.vulncases.models.TestCase;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * DynamoDB-backed {@link TestCaseAccess}. Uniqueness of {@code vuln_id} comes from conditional
 * writes on the partition key. Batches that fit in one transaction are written atomically;
 * larger batches fall back to a pre-check plus compensating deletes, which leaves a window for a
 * concurrent writer between the check and the write.
 */
@Component
@Slf4j
public class DynamoTestCaseAccess implements TestCaseAccess {

    /** Maximum number of actions DynamoDB accepts in a single TransactWriteItems call. */
    static final int TRANSACTION_LIMIT = 100;

    private static final Expression KEY_NOT_EXISTS = Expression.builder()
            .expression("attribute_not_exists(vuln_id)")
            .build();
    private static final Expression KEY_EXISTS = Expression.builder()
            .expression("attribute_exists(vuln_id)")
            .build();

    private final DynamoDbClient dynamo;
    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<TestCase> table;
    private final String tableName;

    @Autowired
    public DynamoTestCaseAccess(DynamoDbClient dynamo,
                                DynamoDbEnhancedClient enhancedClient,
                                TestCaseStoreProperties properties) {
        this(dynamo, enhancedClient, properties.getTableName());
    }

    public DynamoTestCaseAccess(DynamoDbClient dynamo,
                                DynamoDbEnhancedClient enhancedClient,
                                String tableName) {
        this.dynamo = dynamo;
        this.enhancedClient = enhancedClient;
        this.tableName = tableName;
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(TestCase.class));
    }

    @Override
    public int insertAll(List<TestCase> testCases) {
        if (testCases.isEmpty()) {
            return 0;
        }
        List<TestCase> items = testCases.stream()
                .map(tc -> tc.toBuilder().documentId(UUID.randomUUID().toString()).build())
                .toList();

        if (items.size() == 1) {
            putNew(items.get(0));
        } else if (items.size() <= TRANSACTION_LIMIT) {
            putAllInTransaction(items);
        } else {
            putAllWithCompensation(items);
        }
        return items.size();
    }

    @Override
    public Optional<TestCase> findByVulnId(String vulnId) {
        return Optional.ofNullable(table.getItem(r -> r.key(keyOf(vulnId))
                .consistentRead(true)));
    }

    @Override
    public List<TestCase> findAll() {
        return sorted(table.scan(r -> r.consistentRead(true)).items().stream());
    }

    @Override
    public List<TestCase> findByPlatform(Platform platform) {
        Expression samePlatform = Expression.builder()
                .expression("#platform = :platform")
                .putExpressionName("#platform", "platform")
                .putExpressionValue(":platform", AttributeValue.builder().s(platform.value()).build())
                .build();
        return sorted(table.scan(r -> r.consistentRead(true).filterExpression(samePlatform))
                .items()
                .stream());
    }

    @Override
    public boolean update(TestCase patch) {
        try {
            table.updateItem(r -> r.item(patch)
                    .ignoreNulls(true)
                    .conditionExpression(KEY_EXISTS));
            return true;
        } catch (ConditionalCheckFailedException ex) {
            return false;
        }
    }

    @Override
    public int deleteAll(Collection<String> vulnIds) {
        int deleted = 0;
        for (String vulnId : new LinkedHashSet<>(vulnIds)) {
            if (table.deleteItem(keyOf(vulnId)) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public void ping() {
        dynamo.describeTable(b -> b.tableName(tableName));
    }

    private void putNew(TestCase item) {
        try {
            table.putItem(r -> r.item(item).conditionExpression(KEY_NOT_EXISTS));
        } catch (ConditionalCheckFailedException ex) {
            throw new DuplicateVulnIdException(item.getVulnId(), ex);
        }
    }

    private void putAllInTransaction(List<TestCase> items) {
        TransactWriteItemsEnhancedRequest.Builder request = TransactWriteItemsEnhancedRequest.builder();
        for (TestCase item : items) {
            request.addPutItem(table, TransactPutItemEnhancedRequest.builder(TestCase.class)
                    .item(item)
                    .conditionExpression(KEY_NOT_EXISTS)
                    .build());
        }
        try {
            enhancedClient.transactWriteItems(request.build());
        } catch (TransactionCanceledException ex) {
            List<CancellationReason> reasons = ex.hasCancellationReasons() ? ex.cancellationReasons() : List.of();
            for (int i = 0; i < reasons.size() && i < items.size(); i++) {
                if ("ConditionalCheckFailed".equals(reasons.get(i).code())) {
                    throw new DuplicateVulnIdException(items.get(i).getVulnId(), ex);
                }
            }
            throw ex;
        }
    }

    private void putAllWithCompensation(List<TestCase> items) {
        for (TestCase item : items) {
            if (findByVulnId(item.getVulnId()).isPresent()) {
                throw new DuplicateVulnIdException(item.getVulnId(), null);
            }
        }

        List<TestCase> written = new ArrayList<>(items.size());
        try {
            for (TestCase item : items) {
                putNew(item);
                written.add(item);
            }
        } catch (DuplicateVulnIdException ex) {
            log.warn("Concurrent insert of {} detected, removing {} test cases written by this batch",
                    ex.getVulnId(), written.size());
            removeWritten(written, ex);
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Batch insert failed after {} of {} test cases, removing them", written.size(), items.size());
            removeWritten(written, ex);
            throw ex;
        }
    }

    private void removeWritten(List<TestCase> written, RuntimeException failure) {
        for (TestCase item : written) {
            try {
                table.deleteItem(keyOf(item.getVulnId()));
            } catch (RuntimeException ex) {
                log.error("Could not remove test case {} left by a failed batch insert", item.getVulnId(), ex);
                failure.addSuppressed(ex);
            }
        }
    }

    private static Key keyOf(String vulnId) {
        return Key.builder().partitionValue(vulnId).build();
    }

    private static List<TestCase> sorted(Stream<TestCase> items) {
        return items.sorted(Comparator.comparing(TestCase::getVulnId))
                .collect(Collectors.toList());
    }
}
