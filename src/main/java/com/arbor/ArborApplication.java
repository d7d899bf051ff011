package com.arbor;

import com.arbor.engine.EvaluationResult;
import com.arbor.lookup.LoanPurpose;
import com.arbor.lookup.TreeLookupService;
import com.arbor.spring.EnableArbor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application demonstrating Arbor usage.
 * <p>
 * With arguments {@code <tree-name> <json-inputs>} it evaluates that tree; without arguments
 * it runs a few sample lookups.
 */
@SpringBootApplication
@EnableArbor
public class ArborApplication {

    private static final Logger log = LoggerFactory.getLogger(ArborApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ArborApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TreeLookupService lookups) {
        ObjectMapper mapper = new ObjectMapper();
        return args -> {
            if (args.length >= 2) {
                EvaluationResult result = lookups.lookupJson(args[0], args[1]);
                log.info("{} -> {}", args[0], mapper.writeValueAsString(result));
                return;
            }

            log.info("=== Arbor Demo Started ===");
            log.info("Loan: {}", mapper.writeValueAsString(lookups.loan(700, 60000, 20000)));
            log.info("Loan purpose: {}",
                    mapper.writeValueAsString(lookups.loanByPurpose(LoanPurpose.CAR, 650, "US")));
            log.info("Blood pressure: {}", mapper.writeValueAsString(lookups.bloodPressure(135, 85)));
            log.info("Atrial fibrillation: {}", mapper.writeValueAsString(
                    lookups.atrialFibrillation(120, 80, 72, false, true, false, false)));
            log.info("=== Arbor Demo Completed ===");
        };
    }
}
