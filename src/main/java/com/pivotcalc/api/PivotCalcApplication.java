package com.pivotcalc.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.pivotcalc")
@ConfigurationPropertiesScan(basePackages = "com.pivotcalc")
public class PivotCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(PivotCalcApplication.class, args);
    }
}
