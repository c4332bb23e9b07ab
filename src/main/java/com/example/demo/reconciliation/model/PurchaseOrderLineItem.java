package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public class PurchaseOrderLineItem {

    @NotNull(message = "Line number is required")
    private Integer lineNumber;

    private String identifier;

    private String description;

    /**
     * Optional lot pinned by the PO. When absent the lot plays no part in
     * matching.
     */
    private String lotNumber;

    @NotNull(message = "Quantity is required")
    @Min(value = 0, message = "Quantity cannot be negative")
    private Integer quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.0", message = "Unit price cannot be negative")
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal unitPrice;

    public PurchaseOrderLineItem() {
    }

    public PurchaseOrderLineItem(Integer lineNumber, String description, String identifier,
            Integer quantity, BigDecimal unitPrice) {
        this.lineNumber = lineNumber;
        this.description = description;
        this.identifier = identifier;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(Integer lineNumber) {
        this.lineNumber = lineNumber;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getLotNumber() {
        return lotNumber;
    }

    public void setLotNumber(String lotNumber) {
        this.lotNumber = lotNumber;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }
}
