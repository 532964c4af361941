package com.footballtransfers;

import com.footballtransfers.infrastructure.config.TransfersProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Batch application that scrapes football transfers into per-season CSV datasets.
 */
@SpringBootApplication
@EnableConfigurationProperties(TransfersProperties.class)
public class TransferDatasetApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TransferDatasetApplication.class, args)));
    }
}
