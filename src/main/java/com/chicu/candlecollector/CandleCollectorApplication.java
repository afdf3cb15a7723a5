package com.chicu.candlecollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.chicu.candlecollector")
@ConfigurationPropertiesScan("com.chicu.candlecollector.config")
public class CandleCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandleCollectorApplication.class, args);
    }
}
