package com.phillippitts.speakerlink;

import com.phillippitts.speakerlink.config.properties.ResolutionProperties;
import com.phillippitts.speakerlink.config.properties.TaxonomyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ResolutionProperties.class, TaxonomyProperties.class})
public class SpeakerLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakerLinkApplication.class, args);
    }
}
