package com.nayem.leasehold.spring;

import com.nayem.leasehold.broker.BrokerClient;
import com.nayem.leasehold.broker.InMemoryBrokerClient;
import com.nayem.leasehold.broker.RetryingBrokerClient;
import com.nayem.leasehold.core.LeaseManagerFactory;
import com.nayem.leasehold.core.LeaseMetrics;
import com.nayem.leasehold.worker.LeasedMessageProcessor;
import com.nayem.leasehold.worker.MessageHandler;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@AutoConfiguration
@EnableConfigurationProperties(LeaseholdProperties.class)
public class LeaseholdAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LeaseholdAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock leaseholdClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseMetrics leaseMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new LeaseMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseManagerFactory leaseManagerFactory(LeaseholdProperties properties,
            ObjectProvider<BrokerClient> brokerProvider,
            Clock clock,
            LeaseMetrics metrics) {

        BrokerClient broker = brokerProvider.getIfAvailable();
        if (broker == null) {
            log.warn("No BrokerClient bean found for entity '{}', falling back to in-memory broker",
                    properties.getEntityPath());
            broker = new InMemoryBrokerClient();
        }

        if (properties.isRetryDispositions()) {
            broker = new RetryingBrokerClient(broker,
                    properties.getMaximumRetryCount(),
                    properties.getMinimumBackoff(),
                    properties.getMaximumBackoff());
        }

        return LeaseManagerFactory.builder()
                .broker(broker)
                .clock(clock)
                .metrics(metrics)
                .schedulerThreads(properties.getSchedulerThreads())
                .brokerTimeout(properties.getBrokerTimeout())
                .shutdownTimeout(properties.getShutdownTimeout())
                .build();
    }

    @Bean
    @ConditionalOnBean(MessageHandler.class)
    @ConditionalOnMissingBean
    public LeasedMessageProcessor leasedMessageProcessor(LeaseholdProperties properties,
            LeaseManagerFactory leaseManagerFactory,
            MessageHandler handler) {

        log.info("Processing messages from '{}' with up to {} concurrent calls",
                properties.getEntityPath(), properties.getMaxConcurrentCalls());

        return LeasedMessageProcessor.builder()
                .leaseFactory(leaseManagerFactory)
                .handler(handler)
                .maxConcurrentCalls(properties.getMaxConcurrentCalls())
                .callbackTimeout(properties.getMaximumCallbackTimeout())
                .shutdownTimeout(properties.getShutdownTimeout())
                .threadNamePrefix(properties.getThreadNamePrefix())
                .build();
    }
}
