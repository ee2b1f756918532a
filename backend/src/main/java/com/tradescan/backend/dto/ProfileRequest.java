package com.tradescan.backend.dto;

import com.tradescan.backend.model.AssetType;
import com.tradescan.backend.model.params.ProfileParameters;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequest {

    @NotBlank
    @Size(max = 120)
    private String name;

    @NotNull
    private AssetType assetType;

    @NotNull
    private ProfileParameters parameters;

    private Boolean scheduleEnabled;

    @Min(1)
    @Max(1440)
    private Integer scheduleIntervalMinutes;

    private Boolean marketHoursOnly;

    private Boolean autoExecute;

    @DecimalMin("0.01")
    private BigDecimal maxOrderValue;
}
