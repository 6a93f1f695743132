package com.yieldoracle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
@Data
public class AppProps {
    @Valid
    private Chain chain = new Chain();
    @Valid
    private Polling polling = new Polling();
    @Valid
    private Breaker breaker = new Breaker();

    /** Protocol id -> source definition. Insertion order is kept. */
    private Map<String, @Valid Protocol> protocols = new LinkedHashMap<>();

    @Data
    public static class Chain {
        @NotEmpty
        private List<String> rpcUrls = new ArrayList<>();
        /** Upper bound for a single eth_call against one endpoint. */
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(5);
        private Duration failoverPenalty = Duration.ofSeconds(20);
        private Duration baseBackoff = Duration.ofMillis(400);
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Polling {
        /** Cycle period; also the TTL of the cached snapshot. */
        @NotNull
        private Duration interval = Duration.ofMinutes(10);
        private Duration initialDelay = Duration.ZERO;
        @Min(1)
        private int collectorThreads = 4;
    }

    @Data
    public static class Breaker {
        @Min(1)
        private int failureThreshold = 5;
        @NotNull
        private Duration cooldown = Duration.ofMinutes(30);
    }

    @Data
    public static class Protocol {
        @NotBlank
        private String name;
        @NotBlank
        private String address;
        /** RAY, BASIS_POINTS, PER_BLOCK; anything else is read as basis points. */
        private String encoding = "BASIS_POINTS";
        private int riskScore;
        /** Smallest units of the underlying token. */
        private BigInteger minLiquidity = BigInteger.ZERO;
        @Min(0)
        private int tokenDecimals = 6;
        @Positive
        private double blockTimeSeconds = 12;
        @Valid @NotNull
        private Call apy;
        @Valid @NotNull
        private Call tvl;
        @Valid @NotNull
        private Call liquidity;
    }

    @Data
    public static class Call {
        @NotBlank
        private String function;
        /** Address-typed arguments, in ABI order. */
        private List<String> args = new ArrayList<>();
        /** Number of uint256 words the function returns. */
        @Min(1)
        private int outputs = 1;
        @Min(0)
        private int outputIndex = 0;
    }
}
