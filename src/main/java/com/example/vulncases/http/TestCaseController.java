package com.example.vulncases.http;

import com.example.vulncases.models.TestCase;
import com.example.vulncases.requests.DeleteTestCasesRequest;
import com.example.vulncases.requests.WriteTestCasesRequest;
import com.example.vulncases.service.TestCaseService;
import com.example.vulncases.service.TestCaseService.InsertResult;
import com.example.vulncases.service.TestCaseService.UpdateResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for the test case collection. There are no per-record paths: every verb
 * works on {@code /test_cases} and identifies records by {@code vuln_id} in the body.
 */
@RestController
@RequestMapping("/api/v1/test_cases")
public class TestCaseController {

    private final TestCaseService testCaseService;
    private final ObjectMapper objectMapper;

    public TestCaseController(TestCaseService testCaseService, ObjectMapper objectMapper) {
        this.testCaseService = testCaseService;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public ResponseEntity<TestCaseListResponse> getTestCases(
            @RequestParam(value = "platform", required = false) String platform) {
        List<TestCaseResponse> testCases = testCaseService.find(platform).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new TestCaseListResponse(testCases));
    }

    @PostMapping
    public ResponseEntity<InsertResponse> addTestCases(@RequestBody(required = false) JsonNode body) {
        InsertResult result = testCaseService.insert(WriteTestCasesRequest.fromBody(body, objectMapper));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new InsertResponse(result.inserted(), result.vulnId()));
    }

    @PutMapping
    public ResponseEntity<UpdateResponse> updateTestCases(@RequestBody(required = false) JsonNode body) {
        UpdateResult result = testCaseService.update(WriteTestCasesRequest.fromBody(body, objectMapper));
        return ResponseEntity.ok(new UpdateResponse(result.updated(), result.notFound()));
    }

    @DeleteMapping
    public ResponseEntity<DeleteResponse> deleteTestCases(@RequestBody(required = false) JsonNode body) {
        int deleted = testCaseService.delete(DeleteTestCasesRequest.fromBody(body));
        return ResponseEntity.ok(new DeleteResponse(deleted));
    }

    private TestCaseResponse map(TestCase testCase) {
        return new TestCaseResponse(
                testCase.getDocumentId(),
                testCase.getVulnId(),
                testCase.getVulnName(),
                testCase.getPlatform(),
                testCase.getAnalysisType(),
                testCase.getOwaspRef(),
                testCase.getCompliance(),
                testCase.getVulnAbstract(),
                testCase.getDescription(),
                testCase.getRecommendation(),
                testCase.getExample(),
                testCase.getCvssScore(),
                testCase.getAutomated()
        );
    }
}
