package com.example.demo.reconciliation.repository;

import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.service.PurchaseOrderSource;
import com.example.demo.reconciliation.service.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Default {@link PurchaseOrderSource} keeping purchase orders in memory.
 * Deployments backed by a database register their own bean instead.
 */
@Repository
public class InMemoryPurchaseOrderSource implements PurchaseOrderSource {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPurchaseOrderSource.class);

    /**
     * Vendor similarity a stored PO needs to be returned by the vendor lookup.
     */
    static final double VENDOR_LOOKUP_SIMILARITY = 0.5;

    private final Map<String, PurchaseOrder> purchaseOrders = new ConcurrentHashMap<>();

    public void save(PurchaseOrder purchaseOrder) {
        purchaseOrders.put(purchaseOrder.getId(), purchaseOrder);
        logger.debug("Stored purchase order {} ({} lines)", purchaseOrder.getId(),
                purchaseOrder.getItems() == null ? 0 : purchaseOrder.getItems().size());
    }

    public Optional<PurchaseOrder> findById(String id) {
        return Optional.ofNullable(purchaseOrders.get(id));
    }

    @Override
    public List<PurchaseOrder> loadPurchaseOrders(List<String> ids) {
        List<PurchaseOrder> found = new ArrayList<>();
        for (String id : ids) {
            PurchaseOrder po = purchaseOrders.get(id);
            if (po != null) {
                found.add(po);
            }
        }
        return found;
    }

    @Override
    public List<PurchaseOrder> findPurchaseOrdersByNumberOrVendor(String poNumber, String vendorName) {
        return purchaseOrders.values().stream()
                .filter(po -> TextSimilarity.sameReference(po.getPoNumber(), poNumber)
                        || (po.getVendor() != null
                                && TextSimilarity.similarity(po.getVendor().getName(), vendorName)
                                        >= VENDOR_LOOKUP_SIMILARITY))
                .sorted(Comparator.comparing(PurchaseOrder::getId))
                .collect(Collectors.toList());
    }
}
