package com.phillippitts.swarmcouncil;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.config.properties.ProviderProperties;
import com.phillippitts.swarmcouncil.config.properties.QualityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CouncilProperties.class,
        ProviderProperties.class,
        QualityProperties.class
})
@EnableScheduling
public class SwarmCouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwarmCouncilApplication.class, args);
    }

}
