package com.budgetpacing;

import com.budgetpacing.config.PacingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(
        exclude = {
            org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration
                    .class
        })
@EnableScheduling
@EnableKafka
@EnableRetry
@EnableConfigurationProperties(PacingProperties.class)
public class BudgetPacingApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetPacingApplication.class, args);
    }
}
