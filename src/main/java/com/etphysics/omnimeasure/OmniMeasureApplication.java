package com.etphysics.omnimeasure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class OmniMeasureApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmniMeasureApplication.class, args);
    }

}
