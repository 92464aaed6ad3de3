package com.flagship.asset_recycling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetRecyclingApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetRecyclingApplication.class, args);
    }
}
