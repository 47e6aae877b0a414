package com.nayem.leasehold.spring;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for consuming leased messages from a queue or topic
 * subscription.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code leasehold} prefix. Either {@code queue-name} or
 * {@code topic-name} with {@code subscription-name} identifies the entity
 * messages are received from.
 * </p>
 */
@ConfigurationProperties(prefix = "leasehold")
@Validated
public class LeaseholdProperties {

    /**
     * Broker connection string. Passed through to the broker client.
     */
    private String connectionString;

    /**
     * Queue to receive from. Mutually exclusive with topic-name.
     */
    private String queueName;

    /**
     * Topic to receive from. Requires subscription-name.
     */
    private String topicName;

    /**
     * Subscription of topic-name to receive from.
     */
    private String subscriptionName;

    /**
     * Maximum number of messages processed at the same time.
     */
    @Min(1)
    private int maxConcurrentCalls = 1;

    /**
     * Delay before the first retry of a failed disposition.
     */
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration minimumBackoff = Duration.ofSeconds(5);

    /**
     * Upper bound on the delay between retries of a failed disposition.
     */
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maximumBackoff = Duration.ofSeconds(50);

    /**
     * Number of times a failed disposition is retried when retry-dispositions is
     * on.
     */
    @Min(0)
    @Max(100)
    private int maximumRetryCount = 10;

    /**
     * How long a handler may run before its work is cancelled. Unset leaves only
     * the lock expiry in charge.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maximumCallbackTimeout;

    /**
     * How long a disposition waits for the broker before the attempt is counted
     * as failed.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration brokerTimeout = Duration.ofSeconds(30);

    /**
     * Whether failed dispositions are retried with backoff. Off by default:
     * failures are logged and dropped.
     */
    private boolean retryDispositions = false;

    /**
     * Threads running lease expiry timers.
     */
    @Min(1)
    @Max(64)
    private int schedulerThreads = 1;

    /**
     * Maximum time to wait for in-flight work and timers during shutdown.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * Prefix for worker thread names.
     */
    private String threadNamePrefix = "leasehold-worker-";

    /**
     * @return the queue name, or {@code topic/subscriptions/subscription} for a
     *         topic subscription, or null when neither is configured
     */
    public String getEntityPath() {
        if (hasText(queueName)) {
            return queueName;
        }
        if (hasText(topicName)) {
            return topicName + "/subscriptions/" + subscriptionName;
        }
        return null;
    }

    @AssertTrue(message = "configure either queue-name or topic-name with subscription-name, not both")
    public boolean isEntityConsistent() {
        if (hasText(queueName)) {
            return !hasText(topicName) && !hasText(subscriptionName);
        }
        return hasText(topicName) == hasText(subscriptionName);
    }

    @AssertTrue(message = "minimum-backoff must not exceed maximum-backoff")
    public boolean isBackoffRangeValid() {
        return minimumBackoff == null || maximumBackoff == null || minimumBackoff.compareTo(maximumBackoff) <= 0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /** @return the broker connection string */
    public String getConnectionString() {
        return connectionString;
    }

    /** @param connectionString the broker connection string */
    public void setConnectionString(String connectionString) {
        this.connectionString = connectionString;
    }

    /** @return the queue name */
    public String getQueueName() {
        return queueName;
    }

    /** @param queueName the queue name */
    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    /** @return the topic name */
    public String getTopicName() {
        return topicName;
    }

    /** @param topicName the topic name */
    public void setTopicName(String topicName) {
        this.topicName = topicName;
    }

    /** @return the subscription name */
    public String getSubscriptionName() {
        return subscriptionName;
    }

    /** @param subscriptionName the subscription name */
    public void setSubscriptionName(String subscriptionName) {
        this.subscriptionName = subscriptionName;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public Duration getMinimumBackoff() {
        return minimumBackoff;
    }

    public void setMinimumBackoff(Duration minimumBackoff) {
        this.minimumBackoff = minimumBackoff;
    }

    public Duration getMaximumBackoff() {
        return maximumBackoff;
    }

    public void setMaximumBackoff(Duration maximumBackoff) {
        this.maximumBackoff = maximumBackoff;
    }

    public int getMaximumRetryCount() {
        return maximumRetryCount;
    }

    public void setMaximumRetryCount(int maximumRetryCount) {
        this.maximumRetryCount = maximumRetryCount;
    }

    public Duration getMaximumCallbackTimeout() {
        return maximumCallbackTimeout;
    }

    public void setMaximumCallbackTimeout(Duration maximumCallbackTimeout) {
        this.maximumCallbackTimeout = maximumCallbackTimeout;
    }

    public Duration getBrokerTimeout() {
        return brokerTimeout;
    }

    public void setBrokerTimeout(Duration brokerTimeout) {
        this.brokerTimeout = brokerTimeout;
    }

    public boolean isRetryDispositions() {
        return retryDispositions;
    }

    public void setRetryDispositions(boolean retryDispositions) {
        this.retryDispositions = retryDispositions;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
