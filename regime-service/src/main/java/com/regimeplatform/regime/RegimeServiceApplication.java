package com.regimeplatform.regime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegimeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegimeServiceApplication.class, args);
    }
}
