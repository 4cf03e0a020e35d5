package com.example.shop;

import java.util.List;

public class ShopApp {

    public static void main(String[] args) {
        Inventory inventory = new Inventory();
        inventory.restock("apple", 10);
        inventory.restock("pear", 1);

        OrderService service = new OrderService(inventory);
        for (String item : List.of("apple", "pear", "plum")) {
            if (inventory.has(item)) {
                service.place(item, 1);
            }
        }
        System.out.println(service.total());
    }
}
