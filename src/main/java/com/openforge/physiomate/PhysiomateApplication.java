package com.openforge.physiomate;

import com.openforge.physiomate.knowledge.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// MilvusProperties is registered here so the retriever and the startup
// summary can read it even when the conditional MilvusConfig is skipped.
@SpringBootApplication
@EnableConfigurationProperties(MilvusProperties.class)
public class PhysiomateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhysiomateApplication.class, args);
    }
}
