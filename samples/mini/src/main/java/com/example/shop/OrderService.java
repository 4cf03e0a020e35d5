package com.example.shop;

import java.util.ArrayList;
import java.util.List;

public class OrderService {

    private final Inventory inventory;
    private final List<Order> orders = new ArrayList<>();

    public OrderService(Inventory inventory) {
        this.inventory = inventory;
    }

    public Order place(String item, int quantity) {
        inventory.take(item, quantity);
        Order order = new Order(item, quantity, PriceCalculator.priceOf(item, quantity));
        orders.add(order);
        return order;
    }

    public long total() {
        long sum = 0;
        for (Order o : orders) {
            sum += o.getAmount();
        }
        return sum;
    }

    public List<Order> orders() {
        return orders;
    }
}
