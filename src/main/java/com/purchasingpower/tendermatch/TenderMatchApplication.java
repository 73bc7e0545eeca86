package com.purchasingpower.tendermatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TenderMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenderMatchApplication.class, args);
    }
}
