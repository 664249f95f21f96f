package com.autobulk;

import com.autobulk.config.AutobulkProperties;
import com.autobulk.delivery.CachedRecipientResolver;
import com.autobulk.delivery.LoggingMessageTransport;
import com.autobulk.delivery.MessageSender;
import com.autobulk.delivery.MessageTransport;
import com.autobulk.delivery.PropertyTemplateRenderer;
import com.autobulk.delivery.RecipientResolver;
import com.autobulk.delivery.TemplateRenderer;
import com.autobulk.delivery.TransportMessageSender;
import com.autobulk.internal.AutobulkMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationExcludeFilter;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.TypeExcludeFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.FilterType;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.Locale;

@AutoConfiguration(
        before = HibernateJpaAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage(basePackages = "com.autobulk")
@ComponentScan(basePackages = "com.autobulk", excludeFilters = {
        @ComponentScan.Filter(type = FilterType.CUSTOM, classes = TypeExcludeFilter.class),
        @ComponentScan.Filter(type = FilterType.CUSTOM, classes = AutoConfigurationExcludeFilter.class) })
@EnableScheduling
@EnableConfigurationProperties(AutobulkProperties.class)
public class AutobulkAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock autobulkClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "autobulkHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer autobulkHibernatePropertiesCustomizer(AutobulkProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                String trimmedPrefix = prefix.trim();
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // Only autobulk tables get the prefix
                                if (original.getText().toLowerCase(Locale.ROOT).startsWith("autobulk_")) {
                                    return new Identifier(trimmedPrefix + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean(RecipientResolver.class)
    public RecipientResolver autobulkRecipientResolver(AutobulkProperties properties) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return new CachedRecipientResolver(properties.getRecipients().getCachePath(),
                properties.getRecipients().getAddressField(), mapper);
    }

    @Bean
    @ConditionalOnMissingBean(TemplateRenderer.class)
    public TemplateRenderer autobulkTemplateRenderer(AutobulkProperties properties) {
        return new PropertyTemplateRenderer(properties.getTemplates());
    }

    @Bean
    @ConditionalOnMissingBean(MessageTransport.class)
    public MessageTransport autobulkMessageTransport() {
        return new LoggingMessageTransport();
    }

    @Bean
    @ConditionalOnMissingBean(MessageSender.class)
    public MessageSender autobulkMessageSender(MessageTransport transport) {
        return new TransportMessageSender(transport);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public AutobulkMetrics autobulkMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
            return new AutobulkMetrics(jobRepository, meterRegistry);
        }
    }
}
