package com.costwatch.anomaly;

import com.costwatch.anomaly.config.CostwatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CostwatchProperties.class)
public class CostwatchAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostwatchAnomalyApplication.class, args);
    }
}
