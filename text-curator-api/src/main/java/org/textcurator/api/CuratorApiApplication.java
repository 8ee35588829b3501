package org.textcurator.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.textcurator.api")
public class CuratorApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CuratorApiApplication.class, args);
    }
}
