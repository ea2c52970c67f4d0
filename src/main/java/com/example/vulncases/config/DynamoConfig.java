package com.example.vulncases.config;

import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Single process-wide DynamoDB client; the context closes it on shutdown.
 */
@Configuration
@Slf4j
public class DynamoConfig {

    @Bean(destroyMethod = "close")
    public DynamoDbClient dynamo(
            @Value("${server.aws.region}") String region,
            @Value("${server.aws.endpoint}") String endpoint,
            @Value("${server.aws.use-localstack:true}") boolean useLocalstack) {
        var builder = DynamoDbClient.builder().region(Region.of(region));
        if (useLocalstack) {
            log.info("Using LocalStack DynamoDB endpoint {}", endpoint);
            builder.endpointOverride(URI.create(endpoint))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("test", "test")));
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient enhancedClient(DynamoDbClient dynamo) {
        return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
    }
}
