package com.flagship.order_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrderLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderLedgerApplication.class, args);
    }
}
