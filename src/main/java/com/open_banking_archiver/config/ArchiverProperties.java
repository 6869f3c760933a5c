package com.open_banking_archiver.config;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "archiver")
public class ArchiverProperties {
    // Recipient of link reminder emails
    @NotBlank
    @Email
    private String userEmail;
    @NotBlank
    @Email
    private String fromEmail;
    // Where the provider sends the end user after the bank login
    @NotBlank
    private String redirectUri = "https://www.google.com";
    @Min(1)
    private int maxHistoricalDays = 730;
    @Min(1)
    private int accessValidForDays = 90;
    // 0 runs `sync transactions` once
    @NotNull
    private Duration pollInterval = Duration.ZERO;
}
