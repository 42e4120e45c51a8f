package com.example.privacyguard;

import com.example.privacyguard.config.PrivacyGuardProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Privacy Guard API",
                version = "0.1",
                description = "REST API for detecting and redacting faces and license plates in uploaded photos.",
                contact = @Contact(name = "Privacy Guard")))
@SpringBootApplication
@EnableConfigurationProperties(PrivacyGuardProperties.class)
public class PrivacyGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrivacyGuardApplication.class, args);
    }
}
