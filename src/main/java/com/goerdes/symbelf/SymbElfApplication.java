package com.goerdes.symbelf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SymbElfApplication {

    public static void main(String[] args) {
        SpringApplication.run(SymbElfApplication.class, args);
    }

}
