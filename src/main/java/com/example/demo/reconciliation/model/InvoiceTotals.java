package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.math.BigDecimal;

public class InvoiceTotals {

    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal subtotal;

    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal total;

    public InvoiceTotals() {
    }

    public InvoiceTotals(BigDecimal subtotal, BigDecimal total) {
        this.subtotal = subtotal;
        this.total = total;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public void setSubtotal(BigDecimal subtotal) {
        this.subtotal = subtotal;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }
}
