package com.zzf.clawcontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClawControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawControlApplication.class, args);
    }
}
