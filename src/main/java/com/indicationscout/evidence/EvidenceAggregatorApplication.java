package com.indicationscout.evidence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EvidenceAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvidenceAggregatorApplication.class, args);
    }
}
