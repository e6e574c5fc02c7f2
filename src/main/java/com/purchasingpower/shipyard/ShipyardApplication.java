package com.purchasingpower.shipyard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShipyardApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ShipyardApplication.class, args)));
    }
}
