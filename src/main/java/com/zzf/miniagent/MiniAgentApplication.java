package com.zzf.miniagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MiniAgentApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MiniAgentApplication.class, args)));
    }
}
