package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.ReconciliationConfig;
import com.example.demo.reconciliation.model.BatchItemResult;
import com.example.demo.reconciliation.model.BatchItemStatus;
import com.example.demo.reconciliation.model.BatchReconciliationRequest;
import com.example.demo.reconciliation.model.BatchReconciliationResponse;
import com.example.demo.reconciliation.model.BatchSummary;
import com.example.demo.reconciliation.model.MatchResult;
import com.example.demo.reconciliation.model.MatchStatus;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.ReconciliationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reconciles many invoices concurrently on the shared executor.
 * Supports partial success - each invoice completes, fails or times out on
 * its own, and results come back in request order.
 */
@Service
public class BatchReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(BatchReconciliationService.class);

    private final ExecutorService systemExecutor;
    private final ReconciliationConfig config;
    private final ReconciliationEngine reconciliationEngine;

    public BatchReconciliationService(
            @Qualifier("reconciliationExecutor") ExecutorService systemExecutor,
            ReconciliationConfig config,
            ReconciliationEngine reconciliationEngine) {
        this.systemExecutor = systemExecutor;
        this.config = config;
        this.reconciliationEngine = reconciliationEngine;
    }

    /**
     * Reconcile a single request with the configured settings.
     */
    public MatchResult reconcile(ReconciliationRequest request) {
        return reconciliationEngine.reconcile(
                request.getInvoice(),
                request.getPurchaseOrderIds(),
                request.getReconciliationDate(),
                config.toMatchingSettings());
    }

    /**
     * Reconcile every invoice in the batch with controlled concurrency.
     *
     * @param request the invoices to reconcile
     * @return one result per invoice, in request order (partial success allowed)
     */
    public BatchReconciliationResponse reconcileBatch(BatchReconciliationRequest request) {
        long startTime = System.currentTimeMillis();
        List<ReconciliationRequest> reconciliations = request.getReconciliations();

        logger.info("Starting batch reconciliation of {} invoices", reconciliations.size());

        MatchingSettings settings = config.toMatchingSettings();
        Semaphore batchSemaphore = new Semaphore(config.getMaxConcurrentReconciliationsPerBatch());

        List<ReconciliationTask> tasks = new ArrayList<>();
        for (ReconciliationRequest reconciliation : reconciliations) {
            String invoiceNumber = invoiceNumberOf(reconciliation);
            CompletableFuture<BatchItemResult> future = reconcileWithSemaphore(
                    invoiceNumber, reconciliation, settings, batchSemaphore);
            tasks.add(new ReconciliationTask(invoiceNumber, future));
        }

        List<BatchItemResult> results = waitWithPartialSuccess(tasks, config.getBatchTimeoutSeconds());

        long totalTime = System.currentTimeMillis() - startTime;
        BatchSummary summary = buildSummary(results, totalTime);

        logger.info("Completed batch: {} total, {} completed ({} matched, {} needs review), {} failed, {} timeout",
                summary.getTotalInvoices(),
                summary.getCompletedInvoices(),
                summary.getMatchedInvoices(),
                summary.getNeedsReviewInvoices(),
                summary.getFailedInvoices(),
                summary.getTimeoutInvoices());

        return new BatchReconciliationResponse(results, summary);
    }

    /**
     * Wait for every task until the batch deadline, then mark whatever is left
     * as timed out.
     */
    private List<BatchItemResult> waitWithPartialSuccess(List<ReconciliationTask> tasks, long timeoutSeconds) {
        List<BatchItemResult> results = new ArrayList<>();
        long deadline = System.currentTimeMillis() + (timeoutSeconds * 1000);

        CompletableFuture<Void> all = CompletableFuture.allOf(
                tasks.stream()
                        .map(task -> task.future)
                        .toArray(CompletableFuture[]::new));

        try {
            all.get(timeoutSeconds, TimeUnit.SECONDS);
            logger.debug("All {} reconciliations completed within timeout", tasks.size());

        } catch (TimeoutException e) {
            logger.warn("Batch timed out after {} seconds. Collecting partial results.", timeoutSeconds);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Batch interrupted. Collecting partial results.", e);

        } catch (ExecutionException e) {
            logger.warn("Some reconciliations failed during execution. Collecting partial results.", e);
        }

        for (ReconciliationTask task : tasks) {
            long remainingTime = deadline - System.currentTimeMillis();

            if (task.future.isDone()) {
                try {
                    BatchItemResult result = task.future.getNow(null);
                    results.add(result != null
                            ? result
                            : BatchItemResult.failure(task.invoiceNumber, "Reconciliation returned no result"));
                } catch (Exception e) {
                    logger.error("Reconciliation of invoice {} failed with exception", task.invoiceNumber, e);
                    results.add(BatchItemResult.failure(task.invoiceNumber,
                            "Reconciliation failed: " + e.getMessage()));
                }

            } else if (remainingTime > 100) {
                try {
                    results.add(task.future.get(Math.min(remainingTime, 1000), TimeUnit.MILLISECONDS));
                } catch (TimeoutException e) {
                    logger.warn("Reconciliation of invoice {} timed out", task.invoiceNumber);
                    task.future.cancel(true);
                    results.add(BatchItemResult.timeout(task.invoiceNumber));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    task.future.cancel(true);
                    results.add(BatchItemResult.failure(task.invoiceNumber, "Reconciliation interrupted"));
                } catch (Exception e) {
                    logger.error("Reconciliation of invoice {} failed", task.invoiceNumber, e);
                    task.future.cancel(true);
                    results.add(BatchItemResult.failure(task.invoiceNumber,
                            "Reconciliation failed: " + e.getMessage()));
                }

            } else {
                logger.warn("Reconciliation of invoice {} did not complete in time", task.invoiceNumber);
                task.future.cancel(true);
                results.add(BatchItemResult.timeout(task.invoiceNumber));
            }
        }

        return results;
    }

    /**
     * Run one reconciliation under the batch semaphore. Never completes
     * exceptionally: every failure becomes a failed item.
     */
    private CompletableFuture<BatchItemResult> reconcileWithSemaphore(
            String invoiceNumber,
            ReconciliationRequest reconciliation,
            MatchingSettings settings,
            Semaphore semaphore) {

        return CompletableFuture.supplyAsync(() -> {
            boolean permitAcquired = false;

            try {
                permitAcquired = semaphore.tryAcquire(
                        config.getPermitAcquisitionTimeoutSeconds(),
                        TimeUnit.SECONDS);

                if (!permitAcquired) {
                    logger.warn("Failed to acquire permit for invoice {} within timeout", invoiceNumber);
                    return BatchItemResult.failure(invoiceNumber,
                            "Failed to acquire processing permit (system busy)");
                }

                long itemStart = System.currentTimeMillis();
                MatchResult result = reconciliationEngine.reconcile(
                        reconciliation.getInvoice(),
                        reconciliation.getPurchaseOrderIds(),
                        reconciliation.getReconciliationDate(),
                        settings);
                long processingTime = System.currentTimeMillis() - itemStart;

                logger.debug("Reconciled invoice {} in {}ms", invoiceNumber, processingTime);
                return BatchItemResult.completed(invoiceNumber, result, processingTime);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.error("Interrupted while acquiring permit for invoice {}", invoiceNumber, e);
                return BatchItemResult.failure(invoiceNumber, "Reconciliation interrupted");

            } catch (ReconciliationEngine.InvalidInvoiceException e) {
                logger.warn("Invoice {} rejected: {}", invoiceNumber, e.getViolations());
                return BatchItemResult.failure(invoiceNumber, e.getMessage());

            } catch (Exception e) {
                logger.error("Unexpected error reconciling invoice {}", invoiceNumber, e);
                return BatchItemResult.failure(invoiceNumber,
                        e.getMessage() != null ? e.getMessage() : "Reconciliation failed");

            } finally {
                if (permitAcquired) {
                    semaphore.release();
                }
            }
        }, systemExecutor).exceptionally(throwable -> {
            logger.error("CompletableFuture exception for invoice {}", invoiceNumber, throwable);
            return BatchItemResult.failure(invoiceNumber, "Async execution failed: " + throwable.getMessage());
        });
    }

    private BatchSummary buildSummary(List<BatchItemResult> results, long totalTime) {
        int completed = 0;
        int failed = 0;
        int timeout = 0;
        int matched = 0;
        int needsReview = 0;

        for (BatchItemResult result : results) {
            if (result.getStatus() == BatchItemStatus.COMPLETED) {
                completed++;
                if (result.getResult() != null && result.getResult().getStatus() == MatchStatus.MATCHED) {
                    matched++;
                } else {
                    needsReview++;
                }
            } else if (result.getStatus() == BatchItemStatus.FAILED) {
                failed++;
            } else if (result.getStatus() == BatchItemStatus.TIMEOUT) {
                timeout++;
            }
        }

        return new BatchSummary(results.size(), completed, failed, timeout, matched, needsReview, totalTime);
    }

    private static String invoiceNumberOf(ReconciliationRequest reconciliation) {
        if (reconciliation == null || reconciliation.getInvoice() == null) {
            return null;
        }
        return reconciliation.getInvoice().getInvoiceNumber();
    }

    private static class ReconciliationTask {
        final String invoiceNumber;
        final CompletableFuture<BatchItemResult> future;

        ReconciliationTask(String invoiceNumber, CompletableFuture<BatchItemResult> future) {
            this.invoiceNumber = invoiceNumber;
            this.future = future;
        }
    }
}
