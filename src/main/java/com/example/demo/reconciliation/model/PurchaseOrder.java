package com.example.demo.reconciliation.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Purchase order as loaded from the persistence collaborator.
 */
public class PurchaseOrder {

    /**
     * Opaque id owned by the persistence collaborator.
     */
    @NotBlank(message = "Purchase order id is required")
    private String id;

    private String poNumber;

    private Party vendor;

    private PurchaseOrderStatus status = PurchaseOrderStatus.OPEN;

    @NotNull(message = "Items are required")
    @Valid
    private List<PurchaseOrderLineItem> items = new ArrayList<>();

    public PurchaseOrder() {
    }

    public PurchaseOrder(String id, String poNumber, Party vendor, List<PurchaseOrderLineItem> items) {
        this.id = id;
        this.poNumber = poNumber;
        this.vendor = vendor;
        this.items = items;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPoNumber() {
        return poNumber;
    }

    public void setPoNumber(String poNumber) {
        this.poNumber = poNumber;
    }

    public Party getVendor() {
        return vendor;
    }

    public void setVendor(Party vendor) {
        this.vendor = vendor;
    }

    public PurchaseOrderStatus getStatus() {
        return status;
    }

    public void setStatus(PurchaseOrderStatus status) {
        this.status = status;
    }

    public List<PurchaseOrderLineItem> getItems() {
        return items;
    }

    public void setItems(List<PurchaseOrderLineItem> items) {
        this.items = items;
    }
}
