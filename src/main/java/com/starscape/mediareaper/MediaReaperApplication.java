package com.starscape.mediareaper;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.config.IntegrationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({DeletionProperties.class, IntegrationProperties.class})
public class MediaReaperApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaReaperApplication.class, args);
    }
}
