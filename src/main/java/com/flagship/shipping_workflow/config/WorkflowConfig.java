package com.flagship.shipping_workflow.config;

import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import com.flagship.shipping_workflow.payment.PaymentProvider;
import com.flagship.shipping_workflow.payment.PaymentProviderException;
import com.flagship.shipping_workflow.quote.RateFetchException;
import com.flagship.shipping_workflow.quote.RateProvider;
import com.flagship.shipping_workflow.session.FinalizationStrategy;
import com.flagship.shipping_workflow.session.SequentialFinalization;
import com.flagship.shipping_workflow.session.TransactionalFinalization;
import com.flagship.shipping_workflow.workflow.PlaceholderPhoneGenerator;
import com.flagship.shipping_workflow.workflow.StepGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Wiring for the workflow engine: time source, step graph, finalization
 * strategy and fallbacks for the external providers.
 */
@Configuration
@Slf4j
public class WorkflowConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StepGraph stepGraph(WorkflowProperties properties) {
        return StepGraph.standard(properties.getParcel().getDefaultDimension(), new PlaceholderPhoneGenerator());
    }

    /**
     * Picks how session hand-offs run. In {@code auto} mode the database is
     * asked once whether it supports transactions.
     */
    @Bean
    @ConditionalOnProperty(name = "workflow.session.store", havingValue = "jdbc", matchIfMissing = true)
    public FinalizationStrategy finalizationStrategy(WorkflowProperties properties,
                                                     DataSource dataSource,
                                                     PlatformTransactionManager transactionManager,
                                                     WorkflowMetrics metrics) {
        WorkflowProperties.FinalizationMode mode = properties.getSession().getFinalization();
        boolean transactional = switch (mode) {
            case TRANSACTIONAL -> true;
            case SEQUENTIAL -> false;
            case AUTO -> supportsTransactions(dataSource);
        };

        FinalizationStrategy strategy = transactional
                ? new TransactionalFinalization(new TransactionTemplate(transactionManager), metrics)
                : new SequentialFinalization(metrics);
        log.info("Session finalization strategy: {} (mode={})", strategy.name(), mode);
        return strategy;
    }

    /**
     * Used until a real rate client is deployed; every lookup fails and the
     * workflow rolls back to confirmation.
     */
    @Bean
    @ConditionalOnMissingBean
    public RateProvider rateProvider() {
        return shipment -> {
            throw new RateFetchException("Rate provider is not configured");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public PaymentProvider paymentProvider() {
        return request -> {
            throw new PaymentProviderException("Payment provider is not configured");
        };
    }

    private static boolean supportsTransactions(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.getMetaData().supportsTransactions();
        } catch (SQLException e) {
            log.warn("Could not read database capabilities, finalizing sessions without transactions: {}",
                    e.getMessage());
            return false;
        }
    }
}
