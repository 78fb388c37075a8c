package com.stator;

import com.stator.config.StatorProperties;
import com.stator.internal.StateGraphRegistry;
import com.stator.internal.StatorMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage(basePackages = "com.stator")
@ComponentScan("com.stator")
@EnableScheduling
@EnableConfigurationProperties(StatorProperties.class)
public class StatorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock statorClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "statorHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer statorHibernatePropertiesCustomizer(StatorProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                String trimmedPrefix = prefix.trim();
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // Only stator tables
                                if (original.getText().toLowerCase().startsWith("stator_")) {
                                    return new Identifier(trimmedPrefix + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class StatorMetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public StatorMetrics statorMetrics(StatorStore store, StateGraphRegistry registry, MeterRegistry meterRegistry) {
            return new StatorMetrics(store, registry, meterRegistry);
        }
    }
}
