package com.foursite.growth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrowthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrowthServiceApplication.class, args);
    }
}
