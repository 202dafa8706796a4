package com.williamcallahan.hwcc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HwccApplication {

    public static void main(String[] args) {
        SpringApplication.run(HwccApplication.class, args);
    }

}
