package com.bakureserve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BakuReserveConciergeApplication {
    public static void main(String[] args) {
        SpringApplication.run(BakuReserveConciergeApplication.class, args);
    }
}
