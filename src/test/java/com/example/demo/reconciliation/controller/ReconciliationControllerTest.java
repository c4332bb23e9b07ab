package com.example.demo.reconciliation.controller;

import com.example.demo.reconciliation.model.BatchItemResult;
import com.example.demo.reconciliation.model.BatchReconciliationRequest;
import com.example.demo.reconciliation.model.BatchReconciliationResponse;
import com.example.demo.reconciliation.model.BatchSummary;
import com.example.demo.reconciliation.model.Discrepancy;
import com.example.demo.reconciliation.model.DiscrepancyKind;
import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.InvoiceLineItem;
import com.example.demo.reconciliation.model.LineItemMatch;
import com.example.demo.reconciliation.model.MatchResult;
import com.example.demo.reconciliation.model.MatchStatus;
import com.example.demo.reconciliation.model.Party;
import com.example.demo.reconciliation.model.ReconciliationRequest;
import com.example.demo.reconciliation.model.Severity;
import com.example.demo.reconciliation.service.BatchReconciliationService;
import com.example.demo.reconciliation.service.ReconciliationEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for the reconciliation endpoints.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationControllerTest {

    @Mock
    private BatchReconciliationService reconciliationService;

    private MockMvc mockMvc;
    private SimpleMeterRegistry meterRegistry;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ReconciliationController(reconciliationService, meterRegistry))
                .build();
        objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    @Test
    void testReconcile_ReturnsMatchResult() throws Exception {
        // Arrange
        MatchResult result = new MatchResult("INV-1", "po-1", 0.97, MatchStatus.MATCHED,
                LocalDate.of(2025, 1, 15),
                List.of(LineItemMatch.matched(1, 1, 0.99)),
                List.of(new Discrepancy(DiscrepancyKind.QUANTITY_MISMATCH, Severity.WARNING, 1, 1,
                        "Invoiced quantity 50 differs from ordered quantity 48 (4.2%)")));
        when(reconciliationService.reconcile(any(ReconciliationRequest.class))).thenReturn(result);

        // Act & Assert
        mockMvc.perform(post("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchedPurchaseOrderId").value("po-1"))
                .andExpect(jsonPath("$.status").value("MATCHED"))
                .andExpect(jsonPath("$.reconciliationDate").value("2025-01-15"))
                .andExpect(jsonPath("$.issues[0].kind").value("quantity-mismatch"))
                .andExpect(jsonPath("$.issues[0].severity").value("warning"));

        assertEquals(1.0, meterRegistry.counter("reconciliation.matched").count());
    }

    @Test
    void testReconcile_NegativeQuantityIsBadRequest() throws Exception {
        // Arrange
        ReconciliationRequest request = validRequest();
        request.getInvoice().getItems().get(0).setQuantity(-5);

        // Act & Assert
        mockMvc.perform(post("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(reconciliationService);
    }

    @Test
    void testReconcile_InvalidInvoiceMappedWithDetails() throws Exception {
        // Arrange
        when(reconciliationService.reconcile(any(ReconciliationRequest.class)))
                .thenThrow(new ReconciliationEngine.InvalidInvoiceException("INV-1",
                        List.of("items[1]: duplicate line number 1")));

        // Act & Assert
        mockMvc.perform(post("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INVOICE"))
                .andExpect(jsonPath("$.details[0]").value("items[1]: duplicate line number 1"));
    }

    @Test
    void testReconcile_UnexpectedErrorIsInternalError() throws Exception {
        // Arrange
        when(reconciliationService.reconcile(any(ReconciliationRequest.class)))
                .thenThrow(new IllegalStateException("source unavailable"));

        // Act & Assert
        mockMvc.perform(post("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"));
    }

    @Test
    void testReconcileBatch_PartialSuccessIsMultiStatus() throws Exception {
        // Arrange
        BatchReconciliationResponse response = new BatchReconciliationResponse(
                Arrays.asList(
                        BatchItemResult.completed("INV-1", new MatchResult("INV-1", null, 0.2,
                                MatchStatus.NEEDS_REVIEW, LocalDate.of(2025, 1, 15),
                                Collections.emptyList(), Collections.emptyList()), 12),
                        BatchItemResult.failure("INV-2", "Reconciliation failed")),
                new BatchSummary(2, 1, 1, 0, 0, 1, 20));
        when(reconciliationService.reconcileBatch(any(BatchReconciliationRequest.class))).thenReturn(response);

        BatchReconciliationRequest request = new BatchReconciliationRequest(List.of(validRequest()));

        // Act & Assert
        mockMvc.perform(post("/api/v1/reconciliations/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isMultiStatus())
                .andExpect(jsonPath("$.summary.failedInvoices").value(1))
                .andExpect(jsonPath("$.results[1].status").value("FAILED"));

        assertEquals(1.0, meterRegistry.counter("reconciliation.needs_review").count());
    }

    @Test
    void testReconcileBatch_EmptyBatchIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/reconciliations/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reconciliations\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliations/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    private static ReconciliationRequest validRequest() {
        InvoiceLineItem line = new InvoiceLineItem(1, "Amoxicillin 500mg", "55150-0188-10", 48,
                new BigDecimal("23.79"));
        Invoice invoice = new Invoice("INV-1", "PO-77", new Party("Acme Pharma", null), List.of(line));
        return new ReconciliationRequest(invoice, List.of("po-1"));
    }
}
