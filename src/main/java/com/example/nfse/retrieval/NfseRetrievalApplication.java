package com.example.nfse.retrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class NfseRetrievalApplication {

    public static void main(String[] args) {
        SpringApplication.run(NfseRetrievalApplication.class, args);
    }
}
