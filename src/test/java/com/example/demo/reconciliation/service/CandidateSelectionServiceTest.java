package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.Party;
import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.model.PurchaseOrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Unit tests for candidate selection.
 */
@ExtendWith(MockitoExtension.class)
class CandidateSelectionServiceTest {

    @Mock
    private PurchaseOrderSource purchaseOrderSource;

    private CandidateSelectionService selectionService;
    private MatchingSettings settings;

    @BeforeEach
    void setUp() {
        selectionService = new CandidateSelectionService(purchaseOrderSource);
        settings = MatchingSettings.defaults();
    }

    @Test
    void testSelectCandidates_ExplicitIdsLoadedAsGiven() {
        // Arrange
        PurchaseOrder po2 = purchaseOrder("po-2", "PO-2", "Acme Pharma");
        PurchaseOrder po1 = purchaseOrder("po-1", "PO-1", "Acme Pharma");
        when(purchaseOrderSource.loadPurchaseOrders(Arrays.asList("po-2", "po-1")))
                .thenReturn(Arrays.asList(po2, po1));

        Invoice invoice = invoice("PO-1", "Acme Pharma");

        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice, Arrays.asList(" po-2", "po-1", "po-2", ""), settings);

        // Assert
        assertEquals(Arrays.asList(po2, po1), candidates);
        verify(purchaseOrderSource, never()).findPurchaseOrdersByNumberOrVendor(any(), any());
    }

    @Test
    void testSelectCandidates_ExplicitIdsKeepRequestOrderWhateverTheSourceReturns() {
        // Arrange
        PurchaseOrder po1 = purchaseOrder("po-1", "PO-1", "Acme Pharma");
        PurchaseOrder po2 = purchaseOrder("po-2", "PO-2", "Acme Pharma");
        PurchaseOrder po3 = purchaseOrder("po-3", "PO-3", "Acme Pharma");
        when(purchaseOrderSource.loadPurchaseOrders(Arrays.asList("po-3", "po-1", "po-2")))
                .thenReturn(Arrays.asList(po1, po2, po3));

        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice("PO-1", "Acme Pharma"), Arrays.asList("po-3", "po-1", "po-2"), settings);

        // Assert
        assertEquals(Arrays.asList("po-3", "po-1", "po-2"), ids(candidates));
    }

    @Test
    void testSelectCandidates_MissingExplicitIdsSkipped() {
        // Arrange
        PurchaseOrder po1 = purchaseOrder("po-1", "PO-1", "Acme Pharma");
        when(purchaseOrderSource.loadPurchaseOrders(anyList())).thenReturn(List.of(po1));

        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice("PO-1", "Acme Pharma"), Arrays.asList("po-1", "po-missing"), settings);

        // Assert
        assertEquals(1, candidates.size());
        assertEquals("po-1", candidates.get(0).getId());
    }

    @Test
    void testSelectCandidates_LookupRanksNumberMatchThenVendor() {
        // Arrange
        PurchaseOrder sameVendorA = purchaseOrder("po-a", "PO-900", "Acme Pharma");
        PurchaseOrder numberMatch = purchaseOrder("po-z", "PO-77", "Other Distributor");
        PurchaseOrder closeVendor = purchaseOrder("po-b", "PO-901", "Acme Pharmacy Supply");
        PurchaseOrder unrelated = purchaseOrder("po-c", "PO-902", "Zeta Medical");
        when(purchaseOrderSource.findPurchaseOrdersByNumberOrVendor("PO-77", "Acme Pharma"))
                .thenReturn(Arrays.asList(unrelated, closeVendor, sameVendorA, numberMatch));

        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice("PO-77", "Acme Pharma"), Collections.emptyList(), settings);

        // Assert
        assertEquals(Arrays.asList("po-z", "po-a", "po-b"), ids(candidates));
    }

    @Test
    void testSelectCandidates_CancelledPurchaseOrdersExcluded() {
        // Arrange
        PurchaseOrder cancelled = purchaseOrder("po-1", "PO-77", "Acme Pharma");
        cancelled.setStatus(PurchaseOrderStatus.CANCELLED);
        PurchaseOrder open = purchaseOrder("po-2", "PO-78", "Acme Pharma");
        when(purchaseOrderSource.findPurchaseOrdersByNumberOrVendor(any(), any()))
                .thenReturn(Arrays.asList(cancelled, open));

        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice("PO-77", "Acme Pharma"), null, settings);

        // Assert
        assertEquals(List.of("po-2"), ids(candidates));
    }

    @Test
    void testSelectCandidates_WindowLimitsCandidates() {
        // Arrange
        List<PurchaseOrder> found = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            found.add(purchaseOrder("po-" + i, "PO-" + i, "Acme Pharma"));
        }
        when(purchaseOrderSource.findPurchaseOrdersByNumberOrVendor(any(), any())).thenReturn(found);
        MatchingSettings narrow = MatchingSettings.builder().candidateWindow(2).build();

        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice(null, "Acme Pharma"), Collections.emptyList(), narrow);

        // Assert
        assertEquals(Arrays.asList("po-0", "po-1"), ids(candidates));
    }

    @Test
    void testSelectCandidates_NoHeaderReferencesMeansNoCandidates() {
        // Act
        List<PurchaseOrder> candidates = selectionService.selectCandidates(
                invoice(" ", null), Collections.emptyList(), settings);

        // Assert
        assertTrue(candidates.isEmpty());
        verifyNoInteractions(purchaseOrderSource);
    }

    private static List<String> ids(List<PurchaseOrder> purchaseOrders) {
        return purchaseOrders.stream().map(PurchaseOrder::getId).collect(Collectors.toList());
    }

    private static Invoice invoice(String poNumber, String vendorName) {
        return new Invoice("INV-1", poNumber, vendorName != null ? new Party(vendorName, null) : null,
                new ArrayList<>());
    }

    private static PurchaseOrder purchaseOrder(String id, String poNumber, String vendorName) {
        return new PurchaseOrder(id, poNumber, new Party(vendorName, null), new ArrayList<>());
    }
}
