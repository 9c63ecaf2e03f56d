package com.costwatch.analysis;

import com.costwatch.analysis.config.CostwatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(CostwatchProperties.class)
public class CostAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnalysisApplication.class, args);
    }
}
