package com.acmeCables.proposalEngine;

import com.acmeCables.proposalEngine.config.ProposalEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProposalEngineProperties.class)
public class ProposalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProposalEngineApplication.class, args);
    }
}
