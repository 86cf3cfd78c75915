/**
 * Main application class for the Poster Resolution Engine
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves poster URLs through a prioritized chain of external providers
 * - Enables scheduling for periodic cache maintenance
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.poster_resolution_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PosterResolutionEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(PosterResolutionEngineApplication.class, args);
    }
}
