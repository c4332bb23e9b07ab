package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.model.PurchaseOrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses the purchase orders an invoice is matched against.
 * <p>
 * Explicit ids win: exactly those purchase orders are loaded, in the given
 * order. Without ids the invoice's PO number and vendor name drive a lookup
 * whose results are ranked and cut to a bounded window.
 */
@Service
public class CandidateSelectionService {

    private static final Logger logger = LoggerFactory.getLogger(CandidateSelectionService.class);

    private final PurchaseOrderSource purchaseOrderSource;

    public CandidateSelectionService(PurchaseOrderSource purchaseOrderSource) {
        this.purchaseOrderSource = purchaseOrderSource;
    }

    /**
     * @param invoice         invoice being reconciled
     * @param explicitPoIds   ids chosen upstream, possibly empty
     * @param settings        window size and vendor floor
     * @return candidates in a deterministic order; empty when nothing fits
     */
    public List<PurchaseOrder> selectCandidates(Invoice invoice, List<String> explicitPoIds,
            MatchingSettings settings) {

        if (explicitPoIds != null && !explicitPoIds.isEmpty()) {
            List<String> ids = distinctIds(explicitPoIds);
            List<PurchaseOrder> loaded = inRequestedOrder(ids, purchaseOrderSource.loadPurchaseOrders(ids));
            if (loaded.size() < ids.size()) {
                logger.warn("Invoice {}: {} of {} requested purchase orders were not found",
                        invoice.getInvoiceNumber(), ids.size() - loaded.size(), ids.size());
            }
            return loaded;
        }

        String poNumber = invoice.getPoNumber();
        String vendorName = invoice.getVendor() != null ? invoice.getVendor().getName() : null;

        if (isBlank(poNumber) && isBlank(vendorName)) {
            logger.info("Invoice {} carries neither PO number nor vendor; no candidates",
                    invoice.getInvoiceNumber());
            return Collections.emptyList();
        }

        List<PurchaseOrder> found = purchaseOrderSource.findPurchaseOrdersByNumberOrVendor(poNumber, vendorName);

        List<RankedCandidate> ranked = new ArrayList<>();
        for (PurchaseOrder po : found) {
            if (po.getStatus() == PurchaseOrderStatus.CANCELLED) {
                continue;
            }
            boolean numberMatches = TextSimilarity.sameReference(po.getPoNumber(), poNumber);
            double vendorSimilarity = TextSimilarity.similarity(
                    po.getVendor() != null ? po.getVendor().getName() : null, vendorName);
            if (!numberMatches && vendorSimilarity < settings.getVendorSimilarityFloor()) {
                continue;
            }
            ranked.add(new RankedCandidate(po, numberMatches, vendorSimilarity));
        }

        List<PurchaseOrder> candidates = ranked.stream()
                .sorted(Comparator.comparing((RankedCandidate c) -> !c.numberMatches)
                        .thenComparing(c -> -c.vendorSimilarity)
                        .thenComparing(c -> c.purchaseOrder.getId()))
                .limit(settings.getCandidateWindow())
                .map(c -> c.purchaseOrder)
                .collect(Collectors.toList());

        logger.debug("Invoice {}: {} purchase orders looked up, {} kept as candidates",
                invoice.getInvoiceNumber(), found.size(), candidates.size());

        return candidates;
    }

    /**
     * One purchase order per requested id, in request order, whatever order
     * the source returned them in.
     */
    private static List<PurchaseOrder> inRequestedOrder(List<String> ids, List<PurchaseOrder> loaded) {
        Map<String, PurchaseOrder> byId = new HashMap<>();
        for (PurchaseOrder po : loaded) {
            if (po != null && po.getId() != null) {
                byId.putIfAbsent(po.getId(), po);
            }
        }
        List<PurchaseOrder> ordered = new ArrayList<>();
        for (String id : ids) {
            PurchaseOrder po = byId.get(id);
            if (po != null) {
                ordered.add(po);
            }
        }
        return ordered;
    }

    private static List<String> distinctIds(List<String> ids) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String id : ids) {
            if (!isBlank(id)) {
                distinct.add(id.trim());
            }
        }
        return new ArrayList<>(distinct);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static class RankedCandidate {
        final PurchaseOrder purchaseOrder;
        final boolean numberMatches;
        final double vendorSimilarity;

        RankedCandidate(PurchaseOrder purchaseOrder, boolean numberMatches, double vendorSimilarity) {
            this.purchaseOrder = purchaseOrder;
            this.numberMatches = numberMatches;
            this.vendorSimilarity = vendorSimilarity;
        }
    }
}
