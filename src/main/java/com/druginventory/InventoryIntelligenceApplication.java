package com.druginventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InventoryIntelligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryIntelligenceApplication.class, args);
    }
}
