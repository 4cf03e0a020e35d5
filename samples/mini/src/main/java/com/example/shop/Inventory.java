package com.example.shop;

import java.util.HashMap;
import java.util.Map;

public class Inventory {

    private final Map<String, Integer> stock = new HashMap<>();

    public void restock(String item, int count) {
        stock.merge(item, count, Integer::sum);
    }

    public boolean has(String item) {
        return stock.getOrDefault(item, 0) > 0;
    }

    public void take(String item, int count) {
        int left = stock.getOrDefault(item, 0) - count;
        if (left < 0) {
            throw new IllegalStateException("out of " + item);
        }
        stock.put(item, left);
    }
}
