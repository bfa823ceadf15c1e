package com.flagship.fx_ledger.config;

import com.flagship.fx_ledger.fx.ManualRateMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Engine settings bound from the {@code ledger.*} keys of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    @NotBlank
    @Pattern(regexp = "[A-Z]{3}")
    private String reportingCurrency = "BDT";

    /**
     * Amounts below this are treated as zero: balance checks, open items, journal lines.
     */
    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal tolerance = new BigDecimal("0.01");

    @Valid
    @NestedConfigurationProperty
    private Fx fx = new Fx();

    @Valid
    @NestedConfigurationProperty
    private Revaluation revaluation = new Revaluation();

    @Data
    public static class Fx {
        @NotNull
        private ManualRateMode manualRateMode = ManualRateMode.APPEND;
    }

    @Data
    public static class Revaluation {
        @NotBlank
        private String receivableAccountCode = "1400";
        @NotBlank
        private String receivableAccountName = "AR - Foreign Customers";
        @NotBlank
        private String bankAccountCode = "1200";
        @NotBlank
        private String bankAccountName = "Bank - Foreign Currency";
        @NotBlank
        private String gainAccountCode = "4300";
        @NotBlank
        private String gainAccountName = "Unrealized FX Gain";
        @NotBlank
        private String lossAccountCode = "5700";
        @NotBlank
        private String lossAccountName = "Unrealized FX Loss";
    }
}
