package eu.virtualparadox.finrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinragApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinragApplication.class, args);
    }
}
