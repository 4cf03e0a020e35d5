package com.example.shop;

public class ReportPrinter {

    public void print(OrderService service) {
        for (Order o : service.orders()) {
            System.out.println(o.getItem() + " x" + o.getQuantity());
        }
    }
}
