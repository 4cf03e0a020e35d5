package com.example.shop;

public class Order {

    private final String item;
    private final int quantity;
    private final long amount;

    public Order(String item, int quantity, long amount) {
        this.item = item;
        this.quantity = quantity;
        this.amount = amount;
    }

    public String getItem() {
        return item;
    }

    public int getQuantity() {
        return quantity;
    }

    public long getAmount() {
        return amount;
    }
}
