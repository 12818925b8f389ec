package org.hcpdata.extractor.engagement;

import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Main application class for the HCP Engagement Extractor.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class EngagementExtractorApplication {

    /**
     * Main method to run the HCP Engagement Extractor. Runs every source once, then exits.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EngagementExtractorApplication.class, args)));
    }

    /**
     * Wall clock that fixes the reference date of each run.
     *
     * @return the system clock in the default time zone
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
