package com.williamcallahan.mathtext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MathTextApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathTextApplication.class, args);
    }

}
