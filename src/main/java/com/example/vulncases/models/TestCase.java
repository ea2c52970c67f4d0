package com.example.vulncases.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * A vulnerability test case. The partition key {@code vuln_id} doubles as the uniqueness
 * constraint; {@code _id} is assigned by the access layer when the item is first written.
 *
 * <p>Only {@code vulnId} is enforced by the builder: partial update patches are built from the
 * same type with every other attribute left null.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class TestCase {

    @NonNull
    private String vulnId;

    private String documentId;
    private String vulnName;
    private String platform;
    private String analysisType;
    private String owaspRef;
    private String compliance;
    private String vulnAbstract;
    private String description;
    private String recommendation;
    private String example;
    private Double cvssScore;
    private Boolean automated;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("vuln_id")
    public String getVulnId() { return vulnId; }

    @DynamoDbAttribute("_id")
    public String getDocumentId() { return documentId; }

    @DynamoDbAttribute("vuln_name")
    public String getVulnName() { return vulnName; }

    @DynamoDbAttribute("platform")
    public String getPlatform() { return platform; }

    @DynamoDbAttribute("analysis_type")
    public String getAnalysisType() { return analysisType; }

    @DynamoDbAttribute("owasp_ref")
    public String getOwaspRef() { return owaspRef; }

    @DynamoDbAttribute("compliance")
    public String getCompliance() { return compliance; }

    @DynamoDbAttribute("vuln_abstract")
    public String getVulnAbstract() { return vulnAbstract; }

    @DynamoDbAttribute("description")
    public String getDescription() { return description; }

    @DynamoDbAttribute("recommendation")
    public String getRecommendation() { return recommendation; }

    @DynamoDbAttribute("example")
    public String getExample() { return example; }

    @DynamoDbAttribute("cvss_score")
    public Double getCvssScore() { return cvssScore; }

    @DynamoDbAttribute("Automated")
    public Boolean getAutomated() { return automated; }

    // ----- Domain helpers -----

    /**
     * True when the item carries nothing besides its key, i.e. a patch with no fields to apply.
     */
    public boolean isKeyOnly() {
        return vulnName == null && platform == null && analysisType == null && owaspRef == null
                && compliance == null && vulnAbstract == null && description == null
                && recommendation == null && example == null && cvssScore == null
                && automated == null;
    }
}
