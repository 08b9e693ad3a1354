package com.anomalywatch.scoring.api;

import com.anomalywatch.common.domain.CardTransactionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Card transaction to score")
public class CardTransactionRequest {

    @JsonProperty("amt")
    @NotNull(message = "amt is required")
    @PositiveOrZero(message = "amt must not be negative")
    @Schema(description = "Transaction amount (USD)", example = "120.5")
    private Double amount;

    @JsonProperty("lat")
    @NotNull(message = "lat is required")
    @DecimalMin(value = "-90", message = "lat must be >= -90")
    @DecimalMax(value = "90", message = "lat must be <= 90")
    @Schema(description = "Cardholder latitude", example = "40.7128")
    private Double latitude;

    @JsonProperty("long")
    @NotNull(message = "long is required")
    @DecimalMin(value = "-180", message = "long must be >= -180")
    @DecimalMax(value = "180", message = "long must be <= 180")
    @Schema(description = "Cardholder longitude", example = "-74.0060")
    private Double longitude;

    @JsonProperty("merch_lat")
    @NotNull(message = "merch_lat is required")
    @DecimalMin(value = "-90", message = "merch_lat must be >= -90")
    @DecimalMax(value = "90", message = "merch_lat must be <= 90")
    @Schema(description = "Merchant latitude", example = "40.7306")
    private Double merchantLatitude;

    @JsonProperty("merch_long")
    @NotNull(message = "merch_long is required")
    @DecimalMin(value = "-180", message = "merch_long must be >= -180")
    @DecimalMax(value = "180", message = "merch_long must be <= 180")
    @Schema(description = "Merchant longitude", example = "-73.9352")
    private Double merchantLongitude;

    @NotBlank(message = "dob is required")
    @Schema(description = "Cardholder date of birth (YYYY-MM-DD)", example = "1985-06-15")
    private String dob;

    @JsonProperty("city_pop")
    @NotNull(message = "city_pop is required")
    @PositiveOrZero(message = "city_pop must not be negative")
    @Schema(description = "City population", example = "8336817")
    private Long cityPopulation;

    public CardTransactionRecord toRecord() {
        return CardTransactionRecord.builder()
                .amount(amount)
                .latitude(latitude)
                .longitude(longitude)
                .merchantLatitude(merchantLatitude)
                .merchantLongitude(merchantLongitude)
                .dateOfBirth(dob)
                .cityPopulation(cityPopulation)
                .build();
    }
}
