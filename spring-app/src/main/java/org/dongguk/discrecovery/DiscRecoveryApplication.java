package org.dongguk.discrecovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiscRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscRecoveryApplication.class, args);
    }
}
