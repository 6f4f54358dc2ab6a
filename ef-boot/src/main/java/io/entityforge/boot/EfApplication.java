package io.entityforge.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.entityforge")
@EnableConfigurationProperties(EntityForgeProperties.class)
public class EfApplication {
    public static void main(String[] args) {
        SpringApplication.run(EfApplication.class, args);
    }
}
