package net.recache.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RecacheApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecacheApplication.class, args);
    }
}
