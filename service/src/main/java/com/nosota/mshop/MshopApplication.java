package com.nosota.mshop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// Accounts live in app_user and are authenticated by bearer token, not by a UserDetailsService
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class MshopApplication {
    public static void main(String[] args) {
        SpringApplication.run(MshopApplication.class, args);
    }
}
