package com.connector.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the runtime, bound from {@code connector.runtime.*}.
 */
@Data
@ConfigurationProperties(prefix = "connector.runtime")
public class RuntimeProperties {

    /**
     * Directory scanned for {@code *.json} integration definitions at startup.
     */
    private String definitionsDirectory = "./definitions";

    /**
     * Directory holding {@code state.json}.
     */
    private String stateDirectory = System.getProperty("user.home") + "/.connector-runtime";

    /**
     * Public base URL under which {@code /hooks/{hookRef}} is reachable by providers.
     */
    private String publicUrl = "http://localhost:8080";

    private Http http = new Http();
    private Connection connection = new Connection();
    private Pagination pagination = new Pagination();
    private Poll poll = new Poll();
    private Functions functions = new Functions();
    private Retry retry = new Retry();
    private Webhook webhook = new Webhook();

    @Data
    public static class Http {
        private Duration responseTimeout = Duration.ofSeconds(30);
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    @Data
    public static class Connection {
        /**
         * Credentials expiring within this window are refreshed before use.
         */
        private Duration refreshSkew = Duration.ofSeconds(60);

        /**
         * How long an OAuth authorization state stays redeemable; abandoned ones are evicted after this.
         */
        private Duration authorizationTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Pagination {
        private int maxPages = 100;
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Poll {
        private Duration timeout = Duration.ofMinutes(2);
        private int poolSize = 8;
    }

    @Data
    public static class Functions {
        private Duration timeout = Duration.ofSeconds(1);
        private int poolSize = 4;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxRetryAfter = Duration.ofSeconds(60);
    }

    @Data
    public static class Webhook {
        /**
         * Number of recent event ids remembered per hook for replay detection.
         */
        private int dedupeWindow = 1000;

        /**
         * Maximum number of undrained bundles queued per hook; the oldest are dropped beyond it.
         */
        private int maxQueuedBundles = 10000;
    }
}
