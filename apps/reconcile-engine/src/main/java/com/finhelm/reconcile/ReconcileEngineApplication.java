package com.finhelm.reconcile;

import com.finhelm.reconcile.config.ReconcileProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReconcileProperties.class)
public class ReconcileEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconcileEngineApplication.class, args);
    }
}
