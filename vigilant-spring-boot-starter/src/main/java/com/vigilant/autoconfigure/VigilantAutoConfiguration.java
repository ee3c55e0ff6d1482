package com.vigilant.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigilant.autoconfigure.event.ApplicationEventMonitorListener;
import com.vigilant.autoconfigure.web.VigilantBlockingFilter;
import com.vigilant.autoconfigure.web.VigilantOperationsController;
import com.vigilant.core.alert.AlertDispatcher;
import com.vigilant.core.alert.LoggingAlertDispatcher;
import com.vigilant.core.audit.InMemoryResponseAuditLog;
import com.vigilant.core.audit.JsonLinesResponseAuditLog;
import com.vigilant.core.audit.ResponseAuditLog;
import com.vigilant.core.config.MonitoringConfig;
import com.vigilant.core.config.VigilantProperties;
import com.vigilant.core.incident.InMemoryIncidentSink;
import com.vigilant.core.incident.IncidentSink;
import com.vigilant.core.intel.InMemoryIndicatorStore;
import com.vigilant.core.intel.ThreatIntelProvider;
import com.vigilant.core.monitor.MonitorListener;
import com.vigilant.core.monitor.SecurityMonitor;
import com.vigilant.core.response.ActionHandler;
import com.vigilant.core.response.ActionHandlerRegistry;
import com.vigilant.core.response.AutomatedResponseEngine;
import com.vigilant.core.response.ResponseContext;
import com.vigilant.core.rule.CorrelationRuleStore;
import com.vigilant.core.rule.DefaultRules;
import com.vigilant.core.rule.ResponseRuleStore;
import com.vigilant.core.source.InMemorySecurityEventSource;
import com.vigilant.core.source.SecurityEventSource;
import com.vigilant.core.store.DecisionStore;
import com.vigilant.core.store.InMemoryDecisionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Auto-configuration for Vigilant.
 * Activated when {@code vigilant.enabled=true} (default).
 */
@AutoConfiguration
@ConditionalOnProperty(name = "vigilant.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties
@ComponentScan(basePackages = "com.vigilant.module")
public class VigilantAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VigilantAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "vigilant")
    public VigilantProperties vigilantProperties() {
        return new VigilantProperties();
    }

    @Bean
    @ConditionalOnMissingBean(name = "vigilantClock")
    public Clock vigilantClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionStore decisionStore(@Qualifier("vigilantClock") Clock clock) {
        log.info("[Vigilant] Using InMemoryDecisionStore");
        return new InMemoryDecisionStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityEventSource securityEventSource(@Qualifier("vigilantClock") Clock clock) {
        log.warn("[Vigilant] No SecurityEventSource bean found, using an empty in-memory source");
        return new InMemorySecurityEventSource(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public IncidentSink incidentSink(@Qualifier("vigilantClock") Clock clock) {
        return new InMemoryIncidentSink(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertDispatcher alertDispatcher() {
        return new LoggingAlertDispatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreatIntelProvider threatIntelProvider() {
        return new InMemoryIndicatorStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseAuditLog responseAuditLog(VigilantProperties properties, ObjectProvider<ObjectMapper> mapper) {
        String file = properties.getAudit().getLogFile();
        if (file == null || file.isBlank()) {
            return new InMemoryResponseAuditLog();
        }
        log.info("[Vigilant] Writing response audit trail to {}", file);
        return new JsonLinesResponseAuditLog(Path.of(file), mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrelationRuleStore correlationRuleStore(VigilantProperties properties) {
        return new CorrelationRuleStore(properties.getRules().isLoadDefaults()
                ? DefaultRules.correlationRules()
                : List.of());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseRuleStore responseRuleStore(VigilantProperties properties) {
        return new ResponseRuleStore(properties.getRules().isLoadDefaults()
                ? DefaultRules.responseRules()
                : List.of());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseContext responseContext(DecisionStore decisionStore, AlertDispatcher alertDispatcher,
            ResponseAuditLog auditLog, VigilantProperties properties, @Qualifier("vigilantClock") Clock clock) {
        return new ResponseContext(decisionStore, alertDispatcher, auditLog, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionHandlerRegistry actionHandlerRegistry(List<ActionHandler> handlers) {
        return new ActionHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean(name = "vigilantExecutor")
    public ThreadPoolTaskExecutor vigilantExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("vigilant-worker-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean(name = "vigilantScheduler")
    public ThreadPoolTaskScheduler vigilantScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("vigilant-tick-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public AutomatedResponseEngine automatedResponseEngine(ResponseRuleStore rules, ActionHandlerRegistry registry,
            ResponseContext context, VigilantProperties properties,
            @Qualifier("vigilantExecutor") ThreadPoolTaskExecutor vigilantExecutor) {
        return new AutomatedResponseEngine(rules, registry, context,
                vigilantExecutor.getThreadPoolExecutor(),
                properties.getMonitor().getResponseActionTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(name = "applicationEventMonitorListener")
    public ApplicationEventMonitorListener applicationEventMonitorListener(ApplicationEventPublisher publisher) {
        return new ApplicationEventMonitorListener(publisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityMonitor securityMonitor(SecurityEventSource source, CorrelationRuleStore correlationRules,
            AutomatedResponseEngine responseEngine, IncidentSink incidentSink, AlertDispatcher alertDispatcher,
            ThreatIntelProvider intelProvider, ObjectProvider<MonitorListener> listeners,
            VigilantProperties properties,
            @Qualifier("vigilantScheduler") ThreadPoolTaskScheduler vigilantScheduler,
            @Qualifier("vigilantExecutor") ThreadPoolTaskExecutor vigilantExecutor,
            @Qualifier("vigilantClock") Clock clock) {
        return SecurityMonitor.builder()
                .source(source)
                .correlationRules(correlationRules)
                .responseEngine(responseEngine)
                .incidentSink(incidentSink)
                .alertDispatcher(alertDispatcher)
                .intelProvider(intelProvider)
                .listeners(listeners.orderedStream().collect(Collectors.toList()))
                .scheduler(vigilantScheduler.getScheduledExecutor())
                .workers(vigilantExecutor.getThreadPoolExecutor())
                .config(MonitoringConfig.from(properties))
                .clock(clock)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public VigilantMonitorLifecycle vigilantMonitorLifecycle(SecurityMonitor monitor, VigilantProperties properties) {
        return new VigilantMonitorLifecycle(monitor, properties.getMonitor().isAutoStart());
    }

    /**
     * Operational endpoints and block enforcement for servlet applications.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "jakarta.servlet.Filter")
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public VigilantOperationsController vigilantOperationsController(SecurityMonitor monitor,
                CorrelationRuleStore correlationRules, ResponseRuleStore responseRules, IncidentSink incidentSink,
                DecisionStore decisionStore) {
            return new VigilantOperationsController(monitor, correlationRules, responseRules, incidentSink,
                    decisionStore);
        }

        @Bean
        @ConditionalOnProperty(name = "vigilant.enforce-blocks", havingValue = "true", matchIfMissing = true)
        public VigilantBlockingFilter vigilantBlockingFilter(DecisionStore decisionStore,
                VigilantProperties properties) {
            return new VigilantBlockingFilter(decisionStore, properties.getTenantHeader());
        }
    }
}
