package com.example.property;

import com.example.property.config.properties.FallbackProperties;
import com.example.property.config.properties.ListingCacheProperties;
import com.example.property.config.properties.PersistenceProperties;
import com.example.property.config.properties.PipelineProperties;
import com.example.property.config.properties.SourceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        PipelineProperties.class,
        FallbackProperties.class,
        ListingCacheProperties.class,
        SourceProperties.class,
        PersistenceProperties.class
})
public class PropertySearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertySearchApplication.class, args);
    }

}
