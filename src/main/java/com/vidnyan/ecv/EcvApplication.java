package com.vidnyan.ecv;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ECV - Edit-Check Verifier
 *
 * Verifies clinical-trial edit-check rules with Z3 and generates verified test data
 * through metamorphic, symbolic, adversarial and causal techniques.
 */
@SpringBootApplication
public class EcvApplication {

    public static void main(String[] args) {
        SpringApplication.run(EcvApplication.class, args);
    }
}
