package com.example.shop;

final class PriceCalculator {

    private PriceCalculator() {}

    static long priceOf(String item, int quantity) {
        return unitPrice(item) * quantity;
    }

    private static long unitPrice(String item) {
        return item.length() * 10L;
    }
}
