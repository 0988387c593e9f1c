package com.williamcallahan.publist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PublistApplication {

    public static void main(String[] args) {
        SpringApplication.run(PublistApplication.class, args);
    }

}
