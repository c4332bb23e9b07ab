package com.example.demo.reconciliation.controller;

import com.example.demo.reconciliation.repository.InMemoryPurchaseOrderSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PurchaseOrderControllerTest {

    private static final String PURCHASE_ORDER = "{"
            + "\"id\": \"po-1\", \"poNumber\": \"PO-77\", \"status\": \"open\","
            + "\"vendor\": {\"name\": \"Acme Pharma\"},"
            + "\"items\": [{\"lineNumber\": 1, \"identifier\": \"55150-0188-10\","
            + " \"quantity\": 48, \"unitPrice\": 23.79}]"
            + "}";

    private InMemoryPurchaseOrderSource purchaseOrderSource;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        purchaseOrderSource = new InMemoryPurchaseOrderSource();
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PurchaseOrderController(purchaseOrderSource))
                .build();
    }

    @Test
    void testRegisterThenGet() throws Exception {
        // Act
        mockMvc.perform(put("/api/v1/purchase-orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PURCHASE_ORDER))
                .andExpect(status().isOk());

        // Assert
        assertTrue(purchaseOrderSource.findById("po-1").isPresent());
        mockMvc.perform(get("/api/v1/purchase-orders/po-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.poNumber").value("PO-77"))
                .andExpect(jsonPath("$.status").value("open"))
                .andExpect(jsonPath("$.items[0].quantity").value(48));
    }

    @Test
    void testGet_UnknownIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/purchase-orders/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void testRegister_MissingIdIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/v1/purchase-orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"poNumber\": \"PO-77\", \"items\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void testRegister_DuplicateLineNumbersRejected() throws Exception {
        // Arrange
        String duplicated = "{"
                + "\"id\": \"po-2\", \"poNumber\": \"PO-78\","
                + "\"items\": ["
                + "{\"lineNumber\": 1, \"identifier\": \"55150-0188-10\", \"quantity\": 48, \"unitPrice\": 23.79},"
                + "{\"lineNumber\": 1, \"identifier\": \"00093-4155-01\", \"quantity\": 1, \"unitPrice\": 1.00}"
                + "]}";

        // Act
        mockMvc.perform(put("/api/v1/purchase-orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(duplicated))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        // Assert
        assertFalse(purchaseOrderSource.findById("po-2").isPresent());
    }
}
