package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.HealthSnapshot;
import biz.kryukov.dev.healthwatch.HealthWatch;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * {@code /health} endpoints for load balancers and orchestrators. Unhealthy answers 503.
 */
@RestController
@RequestMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
public class HealthController {

    private final HealthWatch healthWatch;

    public HealthController(HealthWatch healthWatch) {
        this.healthWatch = healthWatch;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health(
            @RequestParam(name = "force", defaultValue = "false") boolean force) {
        return respond(healthWatch.checkHealth(force));
    }

    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> live() {
        return ResponseEntity.ok(HealthResponses.liveness(healthWatch.checkLiveness()));
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        return respond(healthWatch.checkReadiness());
    }

    private static ResponseEntity<Map<String, Object>> respond(HealthSnapshot snapshot) {
        HttpStatus code = snapshot.isServing() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(code).body(HealthResponses.snapshot(snapshot));
    }
}
