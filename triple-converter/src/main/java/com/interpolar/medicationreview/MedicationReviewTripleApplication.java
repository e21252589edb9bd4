package com.interpolar.medicationreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Medication review triple converter - Spring Boot entry point
 *
 * @version 1.0.0
 */
@SpringBootApplication
public class MedicationReviewTripleApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedicationReviewTripleApplication.class, args);
    }
}
