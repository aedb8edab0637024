package net.cadence.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CadenceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CadenceApplication.class, args);
    }
}
