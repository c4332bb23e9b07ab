package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * One product row of an extracted invoice.
 */
public class InvoiceLineItem {

    @NotNull(message = "Line number is required")
    private Integer lineNumber;

    private String description;

    /**
     * NDC or GTIN as extracted, in any of the formats the normalizer accepts.
     */
    private String identifier;

    private String lotNumber;

    /**
     * Raw expiry text, e.g. {@code 29-FEB-28}; parsed during reconciliation.
     */
    private String expiryDate;

    @NotNull(message = "Quantity is required")
    @Min(value = 0, message = "Quantity cannot be negative")
    private Integer quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.0", message = "Unit price cannot be negative")
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal unitPrice;

    @DecimalMin(value = "0.0", message = "Total price cannot be negative")
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal totalPrice;

    public InvoiceLineItem() {
    }

    public InvoiceLineItem(Integer lineNumber, String description, String identifier,
            Integer quantity, BigDecimal unitPrice) {
        this.lineNumber = lineNumber;
        this.description = description;
        this.identifier = identifier;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        if (quantity != null && unitPrice != null) {
            this.totalPrice = unitPrice.multiply(BigDecimal.valueOf(quantity));
        }
    }

    // Getters and setters
    public Integer getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(Integer lineNumber) {
        this.lineNumber = lineNumber;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getLotNumber() {
        return lotNumber;
    }

    public void setLotNumber(String lotNumber) {
        this.lotNumber = lotNumber;
    }

    public String getExpiryDate() {
        return expiryDate;
    }

    public void setExpiryDate(String expiryDate) {
        this.expiryDate = expiryDate;
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

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }
}
