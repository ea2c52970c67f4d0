package com.example.vulncases.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

/**
 * Declares the {@code test_cases} table before the first write. The partition key on
 * {@code vuln_id} is the uniqueness constraint. Safe to run repeatedly.
 */
@Component
@Order(0)
@Slf4j
public class TableInitializer implements ApplicationRunner {

    private final DynamoDbClient dynamo;
    private final TestCaseStoreProperties properties;

    public TableInitializer(DynamoDbClient dynamo, TestCaseStoreProperties properties) {
        this.dynamo = dynamo;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isCreateTableOnStartup()) {
            log.info("Table creation on startup disabled; expecting table {} to exist", properties.getTableName());
            return;
        }
        ensureTable();
    }

    /**
     * @return true if the table was created by this call
     */
    public boolean ensureTable() {
        String tableName = properties.getTableName();
        try {
            dynamo.describeTable(b -> b.tableName(tableName));
            log.info("Table {} already exists", tableName);
            return false;
        } catch (ResourceNotFoundException ex) {
            log.info("Creating table {} with unique key vuln_id", tableName);
        }

        try {
            dynamo.createTable(CreateTableRequest.builder()
                    .tableName(tableName)
                    .attributeDefinitions(AttributeDefinition.builder()
                            .attributeName("vuln_id")
                            .attributeType(ScalarAttributeType.S)
                            .build())
                    .keySchema(KeySchemaElement.builder().attributeName("vuln_id").keyType(KeyType.HASH).build())
                    .billingMode(BillingMode.PAY_PER_REQUEST)
                    .build());
        } catch (ResourceInUseException ex) {
            // another instance won the race
            log.info("Table {} was created concurrently", tableName);
            return false;
        }

        try (DynamoDbWaiter waiter = dynamo.waiter()) {
            waiter.waitUntilTableExists(b -> b.tableName(tableName));
        }
        log.info("Table {} is ready", tableName);
        return true;
    }
}
