package com.williamcallahan.gvtakeout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GvTakeoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(GvTakeoutApplication.class, args);
    }

}
