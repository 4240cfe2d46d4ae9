package com.kreasipositif.tdi17batch.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code eft} section from application.yml.
 * <p>
 * Startup fails when a required value is missing.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "eft")
public class EftProperties {

    /**
     * CAS location id the EFT and WIRE deposits are posted under. Deposits for any other
     * location belong to other programs and are skipped.
     */
    @NotBlank
    private String tdi17LocationId;
}
