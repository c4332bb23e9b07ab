package com.example.demo.reconciliation;

import com.example.demo.reconciliation.model.MatchingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for invoice reconciliation: matching weights and thresholds,
 * plus the executor used when several invoices are reconciled in one batch.
 * Supports both platform threads and virtual threads (Java 21+).
 */
@Configuration
@ConfigurationProperties(prefix = "app.reconciliation")
@Validated
public class ReconciliationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationConfig.class);

    /**
     * Enable virtual threads for batch reconciliation (requires Java 21+).
     * Falls back to a platform thread pool when unavailable.
     */
    private boolean useVirtualThreads = true;

    /**
     * Maximum number of threads in the system-wide executor pool (platform
     * threads only).
     */
    @Min(1)
    private int systemMaxThreads = 20;

    /**
     * Core pool size for the executor (platform threads only).
     */
    @Min(1)
    private int systemCoreThreads = 10;

    /**
     * Queue capacity for pending reconciliations (platform threads only).
     */
    @Min(0)
    private int queueCapacity = 100;

    /**
     * Maximum reconciliations running at once for a single batch request.
     */
    @Min(1)
    private int maxConcurrentReconciliationsPerBatch = 5;

    /**
     * Thread keep-alive time in seconds (platform threads only).
     */
    @Min(1)
    private long threadKeepAliveSeconds = 60;

    /**
     * Timeout for acquiring a batch-level permit (in seconds).
     */
    @Min(1)
    private long permitAcquisitionTimeoutSeconds = 30;

    /**
     * Overall timeout for a batch request (in seconds).
     */
    @Min(1)
    private long batchTimeoutSeconds = 120;

    @Valid
    private Matching matching = new Matching();

    @Bean(name = "reconciliationExecutor", destroyMethod = "shutdown")
    public ExecutorService reconciliationExecutor() {
        if (useVirtualThreads && isVirtualThreadsSupported()) {
            return createVirtualThreadExecutor();
        } else {
            return createPlatformThreadExecutor();
        }
    }

    @Bean
    public Clock reconciliationClock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Snapshot of the matching block as an immutable value for one call.
     */
    public MatchingSettings toMatchingSettings() {
        return matching.toSettings();
    }

    private ExecutorService createVirtualThreadExecutor() {
        try {
            // Reflection keeps the build on Java 17
            var method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            ExecutorService executor = (ExecutorService) method.invoke(null);

            logger.info("Virtual threads enabled for reconciliation");
            return executor;

        } catch (Exception e) {
            logger.warn("Failed to create virtual thread executor, falling back to platform threads: {}",
                    e.getMessage());
            return createPlatformThreadExecutor();
        }
    }

    private ExecutorService createPlatformThreadExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                systemCoreThreads,
                systemMaxThreads,
                threadKeepAliveSeconds,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                new NamedThreadFactory("reconciler"),
                new ThreadPoolExecutor.CallerRunsPolicy());

        executor.allowCoreThreadTimeOut(true);

        logger.info("Platform threads enabled for reconciliation (max: {})", systemMaxThreads);
        return executor;
    }

    private boolean isVirtualThreadsSupported() {
        try {
            Thread.class.getMethod("ofVirtual");
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    public String getConcurrencyModel() {
        if (useVirtualThreads && isVirtualThreadsSupported()) {
            return "VIRTUAL_THREADS";
        } else {
            return "PLATFORM_THREADS";
        }
    }

    // Getters and setters
    public boolean isUseVirtualThreads() {
        return useVirtualThreads;
    }

    public void setUseVirtualThreads(boolean useVirtualThreads) {
        this.useVirtualThreads = useVirtualThreads;
    }

    public int getSystemMaxThreads() {
        return systemMaxThreads;
    }

    public void setSystemMaxThreads(int systemMaxThreads) {
        this.systemMaxThreads = systemMaxThreads;
    }

    public int getSystemCoreThreads() {
        return systemCoreThreads;
    }

    public void setSystemCoreThreads(int systemCoreThreads) {
        this.systemCoreThreads = systemCoreThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getMaxConcurrentReconciliationsPerBatch() {
        return maxConcurrentReconciliationsPerBatch;
    }

    public void setMaxConcurrentReconciliationsPerBatch(int maxConcurrentReconciliationsPerBatch) {
        this.maxConcurrentReconciliationsPerBatch = maxConcurrentReconciliationsPerBatch;
    }

    public long getThreadKeepAliveSeconds() {
        return threadKeepAliveSeconds;
    }

    public void setThreadKeepAliveSeconds(long threadKeepAliveSeconds) {
        this.threadKeepAliveSeconds = threadKeepAliveSeconds;
    }

    public long getPermitAcquisitionTimeoutSeconds() {
        return permitAcquisitionTimeoutSeconds;
    }

    public void setPermitAcquisitionTimeoutSeconds(long permitAcquisitionTimeoutSeconds) {
        this.permitAcquisitionTimeoutSeconds = permitAcquisitionTimeoutSeconds;
    }

    public long getBatchTimeoutSeconds() {
        return batchTimeoutSeconds;
    }

    public void setBatchTimeoutSeconds(long batchTimeoutSeconds) {
        this.batchTimeoutSeconds = batchTimeoutSeconds;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    /**
     * Weights and thresholds of the matching algorithm, bound from
     * {@code app.reconciliation.matching}.
     */
    public static class Matching {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double identifierWeight = 0.45;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lotWeight = 0.15;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double quantityWeight = 0.20;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double priceWeight = 0.20;

        /**
         * Identifier credit when one side has no usable identifier but the
         * descriptions agree.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double identifierFallbackCredit = 0.5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double descriptionSimilarityThreshold = 0.8;

        /**
         * Pairs scoring below this are never assigned.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double pairFloor = 0.35;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lineSimilarityWeight = 0.7;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double headerWeight = 0.2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double coverageWeight = 0.1;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double acceptanceThreshold = 0.5;

        @DecimalMin("0.0")
        private double priceVarianceTolerance = 0.02;

        @DecimalMin("0.0")
        private double errorVarianceThreshold = 0.10;

        @DecimalMin("0.0")
        private double subtotalAbsoluteTolerance = 0.01;

        @DecimalMin("0.0")
        private double subtotalRelativeTolerance = 0.01;

        /**
         * Upper bound on candidates considered when no explicit PO ids are given.
         */
        @Min(1)
        private int candidateWindow = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double vendorSimilarityFloor = 0.5;

        MatchingSettings toSettings() {
            return MatchingSettings.builder()
                    .identifierWeight(identifierWeight)
                    .lotWeight(lotWeight)
                    .quantityWeight(quantityWeight)
                    .priceWeight(priceWeight)
                    .identifierFallbackCredit(identifierFallbackCredit)
                    .descriptionSimilarityThreshold(descriptionSimilarityThreshold)
                    .pairFloor(pairFloor)
                    .lineSimilarityWeight(lineSimilarityWeight)
                    .headerWeight(headerWeight)
                    .coverageWeight(coverageWeight)
                    .acceptanceThreshold(acceptanceThreshold)
                    .priceVarianceTolerance(priceVarianceTolerance)
                    .errorVarianceThreshold(errorVarianceThreshold)
                    .subtotalAbsoluteTolerance(subtotalAbsoluteTolerance)
                    .subtotalRelativeTolerance(subtotalRelativeTolerance)
                    .candidateWindow(candidateWindow)
                    .vendorSimilarityFloor(vendorSimilarityFloor)
                    .build();
        }

        public double getIdentifierWeight() {
            return identifierWeight;
        }

        public void setIdentifierWeight(double identifierWeight) {
            this.identifierWeight = identifierWeight;
        }

        public double getLotWeight() {
            return lotWeight;
        }

        public void setLotWeight(double lotWeight) {
            this.lotWeight = lotWeight;
        }

        public double getQuantityWeight() {
            return quantityWeight;
        }

        public void setQuantityWeight(double quantityWeight) {
            this.quantityWeight = quantityWeight;
        }

        public double getPriceWeight() {
            return priceWeight;
        }

        public void setPriceWeight(double priceWeight) {
            this.priceWeight = priceWeight;
        }

        public double getIdentifierFallbackCredit() {
            return identifierFallbackCredit;
        }

        public void setIdentifierFallbackCredit(double identifierFallbackCredit) {
            this.identifierFallbackCredit = identifierFallbackCredit;
        }

        public double getDescriptionSimilarityThreshold() {
            return descriptionSimilarityThreshold;
        }

        public void setDescriptionSimilarityThreshold(double descriptionSimilarityThreshold) {
            this.descriptionSimilarityThreshold = descriptionSimilarityThreshold;
        }

        public double getPairFloor() {
            return pairFloor;
        }

        public void setPairFloor(double pairFloor) {
            this.pairFloor = pairFloor;
        }

        public double getLineSimilarityWeight() {
            return lineSimilarityWeight;
        }

        public void setLineSimilarityWeight(double lineSimilarityWeight) {
            this.lineSimilarityWeight = lineSimilarityWeight;
        }

        public double getHeaderWeight() {
            return headerWeight;
        }

        public void setHeaderWeight(double headerWeight) {
            this.headerWeight = headerWeight;
        }

        public double getCoverageWeight() {
            return coverageWeight;
        }

        public void setCoverageWeight(double coverageWeight) {
            this.coverageWeight = coverageWeight;
        }

        public double getAcceptanceThreshold() {
            return acceptanceThreshold;
        }

        public void setAcceptanceThreshold(double acceptanceThreshold) {
            this.acceptanceThreshold = acceptanceThreshold;
        }

        public double getPriceVarianceTolerance() {
            return priceVarianceTolerance;
        }

        public void setPriceVarianceTolerance(double priceVarianceTolerance) {
            this.priceVarianceTolerance = priceVarianceTolerance;
        }

        public double getErrorVarianceThreshold() {
            return errorVarianceThreshold;
        }

        public void setErrorVarianceThreshold(double errorVarianceThreshold) {
            this.errorVarianceThreshold = errorVarianceThreshold;
        }

        public double getSubtotalAbsoluteTolerance() {
            return subtotalAbsoluteTolerance;
        }

        public void setSubtotalAbsoluteTolerance(double subtotalAbsoluteTolerance) {
            this.subtotalAbsoluteTolerance = subtotalAbsoluteTolerance;
        }

        public double getSubtotalRelativeTolerance() {
            return subtotalRelativeTolerance;
        }

        public void setSubtotalRelativeTolerance(double subtotalRelativeTolerance) {
            this.subtotalRelativeTolerance = subtotalRelativeTolerance;
        }

        public int getCandidateWindow() {
            return candidateWindow;
        }

        public void setCandidateWindow(int candidateWindow) {
            this.candidateWindow = candidateWindow;
        }

        public double getVendorSimilarityFloor() {
            return vendorSimilarityFloor;
        }

        public void setVendorSimilarityFloor(double vendorSimilarityFloor) {
            this.vendorSimilarityFloor = vendorSimilarityFloor;
        }
    }

    /**
     * Custom thread factory for named platform threads.
     */
    private static class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
