package com.example.demo.reconciliation.controller;

import com.example.demo.reconciliation.controller.ReconciliationController.ErrorResponse;
import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.model.PurchaseOrderLineItem;
import com.example.demo.reconciliation.repository.InMemoryPurchaseOrderSource;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Registers and reads purchase orders held by the in-memory source.
 */
@RestController
@RequestMapping("/api/v1/purchase-orders")
public class PurchaseOrderController {

    private static final Logger logger = LoggerFactory.getLogger(PurchaseOrderController.class);

    private final InMemoryPurchaseOrderSource purchaseOrderSource;

    public PurchaseOrderController(InMemoryPurchaseOrderSource purchaseOrderSource) {
        this.purchaseOrderSource = purchaseOrderSource;
    }

    /**
     * PUT /api/v1/purchase-orders
     */
    @PutMapping
    public ResponseEntity<?> register(@Valid @RequestBody PurchaseOrder purchaseOrder) {
        List<String> duplicates = duplicateLineNumbers(purchaseOrder);
        if (!duplicates.isEmpty()) {
            logger.warn("Rejected purchase order {}: {}", purchaseOrder.getId(), duplicates);
            return ResponseEntity
                    .status(HttpStatus.BAD_REQUEST)
                    .body(new ErrorResponse("VALIDATION_ERROR", String.join(", ", duplicates)));
        }
        logger.info("Registering purchase order {} ({})", purchaseOrder.getId(), purchaseOrder.getPoNumber());
        purchaseOrderSource.save(purchaseOrder);
        return ResponseEntity.ok(purchaseOrder);
    }

    /**
     * GET /api/v1/purchase-orders/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable("id") String id) {
        return purchaseOrderSource.findById(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity
                        .status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("NOT_FOUND", "Purchase order " + id + " not found")));
    }

    private static List<String> duplicateLineNumbers(PurchaseOrder purchaseOrder) {
        List<String> duplicates = new ArrayList<>();
        if (purchaseOrder.getItems() == null) {
            return duplicates;
        }
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < purchaseOrder.getItems().size(); i++) {
            PurchaseOrderLineItem item = purchaseOrder.getItems().get(i);
            if (item != null && item.getLineNumber() != null && !seen.add(item.getLineNumber())) {
                duplicates.add("items[" + i + "].lineNumber: duplicate line number " + item.getLineNumber());
            }
        }
        return duplicates;
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
}
