package com.al.cdanormalizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CdaNormalizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CdaNormalizerApplication.class, args);
    }

}
