package com.flagship.shipping_workflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables under the {@code workflow.*} prefix.
 */
@ConfigurationProperties(prefix = "workflow")
@Getter
public class WorkflowProperties {

    private final Session session = new Session();
    private final Lock lock = new Lock();
    private final Quotes quotes = new Quotes();
    private final Payments payments = new Payments();
    private final Parcel parcel = new Parcel();
    private final Templates templates = new Templates();

    @Getter
    @Setter
    public static class Session {
        private Duration ttl = Duration.ofSeconds(900);
        private StoreType store = StoreType.JDBC;
        private FinalizationMode finalization = FinalizationMode.AUTO;
    }

    @Getter
    @Setter
    public static class Lock {
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Quotes {
        private Duration ttl = Duration.ofMinutes(60);
        private CacheType cache = CacheType.REDIS;
        private String keyPrefix = "quotes:";
    }

    @Getter
    @Setter
    public static class Payments {
        private Duration pendingExpiry = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Parcel {
        private BigDecimal defaultDimension = BigDecimal.TEN;
    }

    @Getter
    @Setter
    public static class Templates {
        private int maxPerUser = 10;
    }

    public enum StoreType { JDBC, MEMORY }

    public enum CacheType { REDIS, MEMORY }

    public enum FinalizationMode { AUTO, TRANSACTIONAL, SEQUENTIAL }
}
