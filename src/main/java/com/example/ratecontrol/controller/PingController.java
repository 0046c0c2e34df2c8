package com.example.ratecontrol.controller;

import com.example.ratecontrol.filter.RequestGate;
import com.example.ratecontrol.model.RateLimitPolicies;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Minimal endpoints used to exercise the rate limiter in local and integration environments.
 * {@code /api/ping} is guarded by the servlet filter; {@code /api/echo} is excluded from the filter and
 * guards itself with the strict preset.
 */
@RestController
public class PingController {

    private final RequestGate requestGate;

    public PingController(RequestGate requestGate) {
        this.requestGate = requestGate;
    }

    @GetMapping("/api/ping")
    public ResponseEntity<Map<String, Object>> ping() {
        return ResponseEntity.ok(Map.of(
                "status", "ok"
        ));
    }

    @PostMapping("/api/echo")
    public ResponseEntity<?> echo(HttpServletRequest request, @RequestBody(required = false) String body) {
        return requestGate
                .wrap(req -> ResponseEntity.ok(Map.of("echo", body == null ? "" : body)), RateLimitPolicies.API_STRICT)
                .handle(request);
    }
}
