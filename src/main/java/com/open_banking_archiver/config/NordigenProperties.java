package com.open_banking_archiver.config;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import jakarta.validation.constraints.NotBlank;

@Data
@Validated
@ConfigurationProperties(prefix = "nordigen")
public class NordigenProperties {
    @NotBlank
    private String secretId;
    @NotBlank
    private String secretKey;
    @NotBlank
    private String baseUrl = "https://ob.nordigen.com/api/v2";
    private int connectTimeoutMillis = 5000;
    private int responseTimeoutMillis = 10000;
}
