package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.PurchaseOrder;

import java.util.List;

/**
 * Lookup of purchase orders owned by the persistence layer. Implementations
 * may block on I/O; the reconciliation engine calls them synchronously.
 */
public interface PurchaseOrderSource {

    /**
     * Loads the purchase orders with the given ids. Unknown ids are skipped.
     *
     * @param ids ids in the order the caller wants them back
     * @return the found purchase orders, in the order of {@code ids}
     */
    List<PurchaseOrder> loadPurchaseOrders(List<String> ids);

    /**
     * Finds purchase orders whose PO number equals {@code poNumber} or whose
     * vendor name resembles {@code vendorName}. Either argument may be null.
     */
    List<PurchaseOrder> findPurchaseOrdersByNumberOrVendor(String poNumber, String vendorName);
}
