package com.alibou.deliverychat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeliveryChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeliveryChatApplication.class, args);
    }
}
