package com.powerflow.tree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PowerFlowTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PowerFlowTreeApplication.class, args);
    }
}
