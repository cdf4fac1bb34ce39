package com.pharmaforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PharmaForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmaForecastApplication.class, args);
    }
}
