package com.example.vulncases.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;

import com.example.vulncases.access.DynamoTestCaseAccess;
import com.example.vulncases.access.TestCaseAccess;
import com.example.vulncases.config.TableInitializer;
import com.example.vulncases.config.TestCaseStoreProperties;
import com.example.vulncases.models.TestCase;
import com.example.vulncases.service.TestCaseService;
import com.example.vulncases.validation.TestCaseValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Full-stack test for {@link TestCaseController}: MockMvc in front of the real service, validator
 * and DynamoDB access layer, with LocalStack as the store.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TestCaseControllerDynamoIntegrationTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final String PATH = "/api/v1/test_cases";

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbTable<TestCase> table;
    private MockMvc mockMvc;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        DynamoDbClient dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        DynamoDbEnhancedClient enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();

        TestCaseStoreProperties properties = new TestCaseStoreProperties();
        new TableInitializer(dynamo, properties).ensureTable();
        table = enhancedClient.table(properties.getTableName(), TableSchema.fromBean(TestCase.class));

        TestCaseAccess testCaseAccess = new DynamoTestCaseAccess(dynamo, enhancedClient, properties.getTableName());
        TestCaseService service = new TestCaseService(testCaseAccess, new TestCaseValidator());
        mockMvc = MockMvcBuilders.standaloneSetup(new TestCaseController(service, new ObjectMapper()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @BeforeEach
    void truncateTable() {
        table.scan().items().forEach(item -> table.deleteItem(item));
    }

    private void post(String body, int expectedStatus) throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post(PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(MockMvcResultMatchers.status().is(expectedStatus));
    }

    @Test
    @DisplayName("POST then GET with the matching platform returns the stored record")
    void postThenGetByPlatform() throws Exception {
        post("{\"vuln_id\":\"T1\",\"vuln_name\":\"XSS\",\"platform\":\"WEB\",\"cvss_score\":\"6.1\",\"Automated\":\"no\"}", 201);

        mockMvc.perform(MockMvcRequestBuilders.get(PATH).param("platform", "web"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0]._id", notNullValue()))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].vuln_id", equalTo("T1")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].platform", equalTo("web")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].cvss_score", equalTo(6.1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].Automated", equalTo(false)));

        mockMvc.perform(MockMvcRequestBuilders.get(PATH).param("platform", "API"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(0)));
    }

    @Test
    @DisplayName("duplicate POST returns 409 and leaves one document")
    void duplicatePost() throws Exception {
        String body = "{\"vuln_id\":\"T1\",\"vuln_name\":\"XSS\",\"platform\":\"web\"}";
        post(body, 201);

        mockMvc.perform(MockMvcRequestBuilders.post(PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vuln_id\":\"T1\",\"vuln_name\":\"Other\",\"platform\":\"API\"}"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("DUPLICATE_VULN_ID")));

        mockMvc.perform(MockMvcRequestBuilders.get(PATH))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].vuln_name", equalTo("XSS")));
    }

    @Test
    @DisplayName("batch POST colliding with a stored vuln_id writes nothing")
    void batchPostWithStoredDuplicate() throws Exception {
        post("{\"vuln_id\":\"B\",\"vuln_name\":\"b\",\"platform\":\"web\"}", 201);

        post("{\"test_cases\":["
                + "{\"vuln_id\":\"A\",\"vuln_name\":\"a\",\"platform\":\"web\"},"
                + "{\"vuln_id\":\"B\",\"vuln_name\":\"b2\",\"platform\":\"web\"},"
                + "{\"vuln_id\":\"C\",\"vuln_name\":\"c\",\"platform\":\"web\"}]}", 409);

        mockMvc.perform(MockMvcRequestBuilders.get(PATH))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].vuln_id", equalTo("B")));
    }

    @Test
    @DisplayName("batch POST larger than one transaction is readable in full")
    void largeBatchPost() throws Exception {
        int size = 105;
        String items = IntStream.range(0, size)
                .mapToObj(i -> String.format("{\"vuln_id\":\"L%03d\",\"vuln_name\":\"n\",\"platform\":\"mobile\"}", i))
                .collect(Collectors.joining(","));

        mockMvc.perform(MockMvcRequestBuilders.post(PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + items + "]"))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.jsonPath("$.inserted", equalTo(size)));

        mockMvc.perform(MockMvcRequestBuilders.get(PATH).param("platform", "Mobile"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(size)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].vuln_id", equalTo("L000")));
    }

    @Test
    @DisplayName("PUT changes only supplied fields and DELETE removes the record")
    void updateThenDelete() throws Exception {
        post("{\"vuln_id\":\"T1\",\"vuln_name\":\"XSS\",\"platform\":\"web\",\"description\":\"keep\"}", 201);

        mockMvc.perform(MockMvcRequestBuilders.put(PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"vuln_id\":\"T1\",\"cvss_score\":7.5},{\"vuln_id\":\"ZZZ\",\"cvss_score\":1}]"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.updated", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.not_found[0]", equalTo("ZZZ")));

        mockMvc.perform(MockMvcRequestBuilders.get(PATH))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].cvss_score", equalTo(7.5)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases[0].description", equalTo("keep")));

        mockMvc.perform(MockMvcRequestBuilders.delete(PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vuln_ids\":[\"T1\",\"ZZZ\"]}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.deleted_count", equalTo(1)));

        mockMvc.perform(MockMvcRequestBuilders.get(PATH))
                .andExpect(MockMvcResultMatchers.jsonPath("$.test_cases", hasSize(0)));
    }
}
