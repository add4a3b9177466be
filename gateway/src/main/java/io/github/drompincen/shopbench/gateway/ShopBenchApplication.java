package io.github.drompincen.shopbench.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.shopbench")
@ConfigurationPropertiesScan("io.github.drompincen.shopbench.gateway.config")
public class ShopBenchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ShopBenchApplication.class, args)));
    }
}
