package com.kuruswap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KuruSwapApplication {

    public static void main(String[] args) {
        SpringApplication.run(KuruSwapApplication.class, args);
    }
}
