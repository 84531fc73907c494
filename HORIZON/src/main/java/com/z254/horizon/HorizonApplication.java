package com.z254.horizon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * HORIZON - Environmental Intelligence Layer.
 *
 * <p>HORIZON provides:
 * <ul>
 *   <li>Environmental Scanning - Structured snapshots of market, technology, regulatory and competitive signals</li>
 *   <li>Pattern Detection - Feature extraction, emergence, meta-patterns and self-similarity analysis</li>
 *   <li>Variety Monitoring - Explosion risk, cascade prediction, absorption and emergency protocols</li>
 *   <li>Adaptation - Challenge driven proposals with governed implementation tracking</li>
 * </ul>
 *
 * <p>HORIZON integrates with:
 * <ul>
 *   <li>Signal source - Raw environmental signals</li>
 *   <li>Policy authority - Adaptation approval and meta-system spawning</li>
 *   <li>Resource authority - Capacity allocation and variety redistribution</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class HorizonApplication {

    public static void main(String[] args) {
        SpringApplication.run(HorizonApplication.class, args);
    }
}
