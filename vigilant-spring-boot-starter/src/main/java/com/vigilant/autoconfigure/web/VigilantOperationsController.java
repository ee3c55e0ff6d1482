package com.vigilant.autoconfigure.web;

import com.vigilant.core.config.MonitoringConfig;
import com.vigilant.core.incident.IncidentNotFoundException;
import com.vigilant.core.incident.IncidentSink;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.monitor.MonitorStartupException;
import com.vigilant.core.monitor.MonitoringStats;
import com.vigilant.core.monitor.SecurityMonitor;
import com.vigilant.core.rule.CorrelationRule;
import com.vigilant.core.rule.CorrelationRuleStore;
import com.vigilant.core.rule.ResponseRule;
import com.vigilant.core.rule.ResponseRuleStore;
import com.vigilant.core.rule.RuleNotFoundException;
import com.vigilant.core.store.DecisionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operational surface of the monitor: lifecycle, rule management, incidents and
 * active blocks. Securing these endpoints is left to the host application's
 * security configuration.
 */
@RestController
@RequestMapping("/api/vigilant")
public class VigilantOperationsController {

    private static final Logger log = LoggerFactory.getLogger(VigilantOperationsController.class);

    private final SecurityMonitor monitor;
    private final CorrelationRuleStore correlationRules;
    private final ResponseRuleStore responseRules;
    private final IncidentSink incidentSink;
    private final DecisionStore decisionStore;

    public VigilantOperationsController(SecurityMonitor monitor, CorrelationRuleStore correlationRules,
            ResponseRuleStore responseRules, IncidentSink incidentSink, DecisionStore decisionStore) {
        this.monitor = monitor;
        this.correlationRules = correlationRules;
        this.responseRules = responseRules;
        this.incidentSink = incidentSink;
        this.decisionStore = decisionStore;
    }

    // --- Monitor ---

    @GetMapping("/monitor/stats")
    public MonitoringStats stats() {
        return monitor.getStats();
    }

    @PostMapping("/monitor/start")
    public MonitoringStats start() {
        log.info("[Vigilant] Monitor start requested by {}", operator());
        monitor.start();
        return monitor.getStats();
    }

    @PostMapping("/monitor/stop")
    public MonitoringStats stop() {
        log.info("[Vigilant] Monitor stop requested by {}", operator());
        monitor.stop();
        return monitor.getStats();
    }

    @PostMapping("/monitor/check")
    public MonitoringStats check() {
        return monitor.forceCheck();
    }

    @GetMapping("/monitor/config")
    public MonitoringConfig config() {
        return monitor.getConfig();
    }

    @PutMapping("/monitor/config")
    public MonitoringConfig updateConfig(@RequestBody MonitoringConfigUpdate update) {
        monitor.updateConfig(update.applyTo(monitor.getConfig()));
        log.info("[Vigilant] Monitoring configuration changed by {}", operator());
        return monitor.getConfig();
    }

    // --- Correlation rules ---

    @GetMapping("/rules/correlation")
    public List<CorrelationRuleRequest> correlationRules() {
        return correlationRules.list().stream().map(CorrelationRuleRequest::from).collect(Collectors.toList());
    }

    @GetMapping("/rules/correlation/{id}")
    public CorrelationRuleRequest correlationRule(@PathVariable String id) {
        return CorrelationRuleRequest.from(correlationRules.get(id).orElseThrow(() -> new RuleNotFoundException(id)));
    }

    @PostMapping("/rules/correlation")
    @ResponseStatus(HttpStatus.CREATED)
    public CorrelationRuleRequest addCorrelationRule(@RequestBody CorrelationRuleRequest request) {
        CorrelationRule rule = request.toRule();
        correlationRules.add(rule);
        log.info("[Vigilant] Correlation rule '{}' added by {}", rule.getId(), operator());
        return CorrelationRuleRequest.from(rule);
    }

    @PutMapping("/rules/correlation/{id}")
    public CorrelationRuleRequest updateCorrelationRule(@PathVariable String id,
            @RequestBody CorrelationRuleRequest request) {
        request.setId(id);
        CorrelationRule rule = request.toRule();
        correlationRules.update(rule);
        log.info("[Vigilant] Correlation rule '{}' updated by {}", id, operator());
        return CorrelationRuleRequest.from(rule);
    }

    @DeleteMapping("/rules/correlation/{id}")
    public ResponseEntity<Void> deleteCorrelationRule(@PathVariable String id) {
        correlationRules.delete(id);
        log.info("[Vigilant] Correlation rule '{}' deleted by {}", id, operator());
        return ResponseEntity.noContent().build();
    }

    // --- Response rules ---

    @GetMapping("/rules/response")
    public List<ResponseRuleRequest> responseRules() {
        return responseRules.list().stream().map(ResponseRuleRequest::from).collect(Collectors.toList());
    }

    @GetMapping("/rules/response/{id}")
    public ResponseRuleRequest responseRule(@PathVariable String id) {
        return ResponseRuleRequest.from(responseRules.get(id).orElseThrow(() -> new RuleNotFoundException(id)));
    }

    @PostMapping("/rules/response")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseRuleRequest addResponseRule(@RequestBody ResponseRuleRequest request) {
        ResponseRule rule = request.toRule();
        responseRules.add(rule);
        log.info("[Vigilant] Response rule '{}' added by {}", rule.getId(), operator());
        return ResponseRuleRequest.from(rule);
    }

    @PutMapping("/rules/response/{id}")
    public ResponseRuleRequest updateResponseRule(@PathVariable String id, @RequestBody ResponseRuleRequest request) {
        request.setId(id);
        ResponseRule rule = request.toRule();
        responseRules.update(rule);
        log.info("[Vigilant] Response rule '{}' updated by {}", id, operator());
        return ResponseRuleRequest.from(rule);
    }

    @DeleteMapping("/rules/response/{id}")
    public ResponseEntity<Void> deleteResponseRule(@PathVariable String id) {
        responseRules.delete(id);
        log.info("[Vigilant] Response rule '{}' deleted by {}", id, operator());
        return ResponseEntity.noContent().build();
    }

    // --- Incidents and blocks ---

    @GetMapping("/incidents")
    public List<SecurityIncident> incidents(@RequestParam(defaultValue = "50") int limit) {
        return incidentSink.listRecent(Math.max(1, Math.min(limit, 500)));
    }

    @GetMapping("/incidents/{id}")
    public SecurityIncident incident(@PathVariable String id) {
        return incidentSink.findById(id).orElseThrow(() -> new IncidentNotFoundException(id));
    }

    @GetMapping("/blocks")
    public Map<String, String> blocks() {
        return decisionStore.getAllBlocked();
    }

    @DeleteMapping("/blocks/{target}")
    public ResponseEntity<Void> unblock(@PathVariable String target) {
        decisionStore.unblock(target);
        log.info("[Vigilant] '{}' unblocked by {}", target, operator());
        return ResponseEntity.noContent().build();
    }

    // --- Errors ---

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler({ RuleNotFoundException.class, IncidentNotFoundException.class })
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(MonitorStartupException.class)
    public ResponseEntity<Map<String, String>> startupFailed(MonitorStartupException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", String.valueOf(e.getMessage()), "status", monitor.getStatus().name()));
    }

    private static String operator() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        return authentication != null && authentication.getName() != null ? authentication.getName() : "anonymous";
    }
}
