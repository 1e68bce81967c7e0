package com.nosota.mercato;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MercatoApplication {
    public static void main(String[] args) {
        SpringApplication.run(MercatoApplication.class, args);
    }
}
