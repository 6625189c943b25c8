package com.hospital.opd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.hospital.opd")
@EnableJpaRepositories(basePackages = "com.hospital.opd.repository")
@EntityScan(basePackages = "com.hospital.opd.entity")
@ConfigurationPropertiesScan(basePackages = "com.hospital.opd.config")
public class OpdTokenApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpdTokenApplication.class, args);
    }
}
