/**
 * Main application class for the NeuroD3 dataset catalog API
 *
 * Features:
 * - Serves the unified DANDI, Kaggle, OpenNeuro and PhysioNet catalog over REST
 * - Disables SQL initialization; ingestion jobs own the schema
 */
package net.neurod3;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NeuroDatasetCatalogApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(NeuroDatasetCatalogApplication.class, args);
    }
}
