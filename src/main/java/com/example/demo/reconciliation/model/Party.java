package com.example.demo.reconciliation.model;

/**
 * Name and address of a vendor or customer as printed on a document.
 */
public class Party {

    private String name;

    private String address;

    public Party() {
    }

    public Party(String name, String address) {
        this.name = name;
        this.address = address;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
