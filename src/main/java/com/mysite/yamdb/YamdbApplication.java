package com.mysite.yamdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class YamdbApplication {

    public static void main(String[] args) {
        SpringApplication.run(YamdbApplication.class, args);
    }
}
