package com.tessera.tenancy.config;

import com.tessera.database.retry.RetryProperties;
import com.tessera.database.retry.TransientFailureRetrier;
import com.tessera.observability.MetricFactory;
import com.tessera.observability.SecurityEventRecorder;
import com.tessera.security.TenantRolePolicies;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the framework-free pieces from the shared libraries into the Spring context.
 */
@Configuration
public class TenancyConfig {

    /** Registered once at startup; handlers refer to policies by role. */
    @Bean
    public TenantRolePolicies tenantRolePolicies() {
        return TenantRolePolicies.registerAll();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, TenancyServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SecurityEventRecorder securityEventRecorder(MetricFactory metricFactory) {
        return new SecurityEventRecorder(metricFactory);
    }

    @Bean
    public TransientFailureRetrier transientFailureRetrier(RetryProperties retryProperties, MetricFactory metricFactory) {
        return new TransientFailureRetrier(retryProperties, metricFactory);
    }

    @Bean
    public TransactionTemplate tenancyTransactionTemplate(
            PlatformTransactionManager transactionManager, TenancyServiceProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout((int) Math.max(1, properties.transactionTimeout().toSeconds()));
        return template;
    }
}
