package com.example.demo.reconciliation.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured invoice as produced by the extraction step.
 */
public class Invoice {

    @NotBlank(message = "Invoice number is required")
    private String invoiceNumber;

    private String invoiceDate;

    /**
     * PO number printed on the invoice. A hint for candidate lookup, not a
     * guarantee.
     */
    private String poNumber;

    private Party vendor;

    private Party customer;

    @NotNull(message = "Items are required")
    @Valid
    private List<InvoiceLineItem> items = new ArrayList<>();

    private InvoiceTotals totals;

    public Invoice() {
    }

    public Invoice(String invoiceNumber, String poNumber, Party vendor, List<InvoiceLineItem> items) {
        this.invoiceNumber = invoiceNumber;
        this.poNumber = poNumber;
        this.vendor = vendor;
        this.items = items;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public void setInvoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
    }

    public String getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(String invoiceDate) {
        this.invoiceDate = invoiceDate;
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

    public Party getCustomer() {
        return customer;
    }

    public void setCustomer(Party customer) {
        this.customer = customer;
    }

    public List<InvoiceLineItem> getItems() {
        return items;
    }

    public void setItems(List<InvoiceLineItem> items) {
        this.items = items;
    }

    public InvoiceTotals getTotals() {
        return totals;
    }

    public void setTotals(InvoiceTotals totals) {
        this.totals = totals;
    }
}
