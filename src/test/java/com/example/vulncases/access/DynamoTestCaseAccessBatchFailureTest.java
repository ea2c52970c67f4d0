package com.example.vulncases.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.vulncases.models.TestCase;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Storage failures in the middle of a batch too large for one transaction.
 */
@SuppressWarnings("unchecked")
class DynamoTestCaseAccessBatchFailureTest {

    private static final int BATCH_SIZE = DynamoTestCaseAccess.TRANSACTION_LIMIT + 5;
    private static final int FAILING_PUT = 50;

    private DynamoDbTable<TestCase> table;
    private DynamoTestCaseAccess testCaseAccess;

    @BeforeEach
    void setUp() {
        table = mock(DynamoDbTable.class);
        DynamoDbEnhancedClient enhancedClient = mock(DynamoDbEnhancedClient.class);
        when(enhancedClient.table(eq("test_cases"), any(TableSchema.class))).thenReturn(table);
        testCaseAccess = new DynamoTestCaseAccess(mock(DynamoDbClient.class), enhancedClient, "test_cases");

        AtomicInteger puts = new AtomicInteger();
        doAnswer(inv -> {
            if (puts.incrementAndGet() == FAILING_PUT) {
                throw SdkClientException.create("throttled");
            }
            return null;
        }).when(table).putItem(any(Consumer.class));
    }

    private static List<TestCase> batch() {
        return IntStream.range(0, BATCH_SIZE)
                .mapToObj(i -> TestCase.builder()
                        .vulnId(String.format("L%03d", i))
                        .vulnName("Name " + i)
                        .platform("web")
                        .build())
                .toList();
    }

    @Test
    @DisplayName("storage error mid-batch removes every test case already written and rethrows")
    void storageErrorRollsBack() {
        SdkClientException ex = assertThrows(SdkClientException.class, () -> testCaseAccess.insertAll(batch()));

        assertEquals("throttled", ex.getMessage());
        verify(table, times(FAILING_PUT - 1)).deleteItem(any(Key.class));
    }

    @Test
    @DisplayName("a failing removal is attached to the original error instead of replacing it")
    void failedRemovalKeepsOriginalError() {
        SdkClientException deleteFailure = SdkClientException.create("delete failed");
        doThrow(deleteFailure).when(table).deleteItem(any(Key.class));

        SdkClientException ex = assertThrows(SdkClientException.class, () -> testCaseAccess.insertAll(batch()));

        assertEquals("throttled", ex.getMessage());
        assertEquals(FAILING_PUT - 1, ex.getSuppressed().length);
        assertSame(deleteFailure, ex.getSuppressed()[0]);
        verify(table, times(FAILING_PUT - 1)).deleteItem(any(Key.class));
    }
}
