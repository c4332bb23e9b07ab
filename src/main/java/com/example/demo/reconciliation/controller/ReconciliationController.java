package com.example.demo.reconciliation.controller;

import com.example.demo.reconciliation.model.BatchReconciliationRequest;
import com.example.demo.reconciliation.model.BatchReconciliationResponse;
import com.example.demo.reconciliation.model.BatchSummary;
import com.example.demo.reconciliation.model.MatchResult;
import com.example.demo.reconciliation.model.MatchStatus;
import com.example.demo.reconciliation.model.ReconciliationRequest;
import com.example.demo.reconciliation.service.BatchReconciliationService;
import com.example.demo.reconciliation.service.ReconciliationEngine;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for invoice reconciliation.
 */
@RestController
@RequestMapping("/api/v1/reconciliations")
public class ReconciliationController {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationController.class);

    private final BatchReconciliationService reconciliationService;
    private final Timer reconciliationTimer;
    private final Timer batchTimer;
    private final Counter matchedCounter;
    private final Counter needsReviewCounter;

    public ReconciliationController(
            BatchReconciliationService reconciliationService,
            MeterRegistry meterRegistry) {
        this.reconciliationService = reconciliationService;

        this.reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to reconcile one invoice")
                .register(meterRegistry);

        this.batchTimer = Timer.builder("reconciliation.batch.duration")
                .description("Time taken to reconcile a batch of invoices")
                .register(meterRegistry);

        this.matchedCounter = Counter.builder("reconciliation.matched")
                .description("Invoices matched to a purchase order")
                .register(meterRegistry);

        this.needsReviewCounter = Counter.builder("reconciliation.needs_review")
                .description("Invoices flagged for manual review")
                .register(meterRegistry);
    }

    /**
     * Reconcile one invoice.
     *
     * POST /api/v1/reconciliations
     *
     * // @formatter:off
     * Example request:
     * {
     *   "invoice": {
     *     "invoiceNumber": "INV-1001",
     *     "poNumber": "PO-77",
     *     "vendor": {"name": "Acme Pharma"},
     *     "items": [
     *       {"lineNumber": 1, "description": "Amoxicillin 500mg",
     *        "identifier": "00093-4155-01", "lotNumber": "L123",
     *        "expiryDate": "12/31/2027", "quantity": 50, "unitPrice": 12.50}
     *     ]
     *   },
     *   "purchaseOrderIds": ["po-1"],
     *   "reconciliationDate": "2026-01-15"
     * }
     * // @formatter:on
     */
    @PostMapping
    public ResponseEntity<MatchResult> reconcile(@Valid @RequestBody ReconciliationRequest request) {

        logger.info("Received reconciliation request for invoice {}", request.getInvoice().getInvoiceNumber());

        return reconciliationTimer.record(() -> {
            MatchResult result = reconciliationService.reconcile(request);

            if (result.getStatus() == MatchStatus.MATCHED) {
                matchedCounter.increment();
            } else {
                needsReviewCounter.increment();
            }
            return ResponseEntity.ok(result);
        });
    }

    /**
     * Reconcile several invoices concurrently.
     *
     * POST /api/v1/reconciliations/batch
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchReconciliationResponse> reconcileBatch(
            @Valid @RequestBody BatchReconciliationRequest request) {

        logger.info("Received batch reconciliation request for {} invoices",
                request.getReconciliations().size());

        return batchTimer.record(() -> {
            BatchReconciliationResponse response = reconciliationService.reconcileBatch(request);
            BatchSummary summary = response.getSummary();

            if (summary.getMatchedInvoices() > 0) {
                matchedCounter.increment(summary.getMatchedInvoices());
            }
            if (summary.getNeedsReviewInvoices() > 0) {
                needsReviewCounter.increment(summary.getNeedsReviewInvoices());
            }

            boolean hasCompleted = summary.getCompletedInvoices() > 0;
            boolean hasFailed = summary.getFailedInvoices() > 0 || summary.getTimeoutInvoices() > 0;

            if (hasCompleted && !hasFailed) {
                logger.info("Reconciled all {} invoices", summary.getTotalInvoices());
                return ResponseEntity.ok(response);

            } else if (hasCompleted) {
                logger.warn("Partial success: {} completed, {} failed, {} timeout",
                        summary.getCompletedInvoices(),
                        summary.getFailedInvoices(),
                        summary.getTimeoutInvoices());
                return ResponseEntity.status(HttpStatus.MULTI_STATUS).body(response);

            } else {
                logger.error("All invoices failed: {} failed, {} timeout",
                        summary.getFailedInvoices(),
                        summary.getTimeoutInvoices());
                return ResponseEntity
                        .status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(response);
            }
        });
    }

    /**
     * GET /api/v1/reconciliations/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(new HealthStatus("UP", "Reconciliation service is operational"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String errorMessage = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", errorMessage));
    }

    @ExceptionHandler(ReconciliationEngine.InvalidInvoiceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInvoice(ReconciliationEngine.InvalidInvoiceException e) {
        logger.warn("Invalid invoice {}: {}", e.getInvoiceNumber(), e.getViolations());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_INVOICE", e.getMessage(), e.getViolations()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedException(Exception e) {
        logger.error("Unexpected error", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    /**
     * Health status response.
     */
    public static class HealthStatus {
        private String status;
        private String message;

        public HealthStatus(String status, String message) {
            this.status = status;
            this.message = message;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }

    /**
     * Error response.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        private String errorCode;
        private String errorMessage;
        private List<String> details;

        public ErrorResponse(String errorCode, String errorMessage) {
            this(errorCode, errorMessage, null);
        }

        public ErrorResponse(String errorCode, String errorMessage, List<String> details) {
            this.errorCode = errorCode;
            this.errorMessage = errorMessage;
            this.details = details;
        }

        public String getErrorCode() {
            return errorCode;
        }

        public void setErrorCode(String errorCode) {
            this.errorCode = errorCode;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public void setErrorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
        }

        public List<String> getDetails() {
            return details;
        }

        public void setDetails(List<String> details) {
            this.details = details;
        }
    }
}
