package net.chime.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChimeApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChimeApplication.class, args);
    }
}
