package com.pennywise_sync;

import com.pennywise_sync.config.BudgetProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BudgetProperties.class)
public class PennywiseSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PennywiseSyncApplication.class, args);
    }
}
