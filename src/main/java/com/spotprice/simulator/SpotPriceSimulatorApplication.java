package com.spotprice.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpotPriceSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpotPriceSimulatorApplication.class, args);
    }
}
