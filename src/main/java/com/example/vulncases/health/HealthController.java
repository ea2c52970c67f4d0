package com.example.vulncases.health;

import com.example.vulncases.access.TestCaseAccess;
import java.time.Instant;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus store connectivity: 200 when the test case table answers, 503 otherwise.
 */
@RestController
@Slf4j
public class HealthController {

    private final TestCaseAccess testCaseAccess;
    private final BuildProperties buildProperties;
    private final String env;

    public HealthController(TestCaseAccess testCaseAccess,
                            @Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties) {
        this.testCaseAccess = testCaseAccess;
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            testCaseAccess.ping();
        } catch (RuntimeException ex) {
            log.warn("Health check failed: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "unhealthy"));
        }
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now().toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "vuln-testcases",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev"
        ));
    }
}
