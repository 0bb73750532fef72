package com.liveprecision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LivePrecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LivePrecisionApplication.class, args);
    }
}
