package com.anomalywatch.training.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the card-domain (Sparkov) CSV. Only the columns the card model uses are bound.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CardTransactionRow {

    @JsonProperty("amt")
    private double amount;

    @JsonProperty("lat")
    private double latitude;

    @JsonProperty("long")
    private double longitude;

    @JsonProperty("merch_lat")
    private double merchantLatitude;

    @JsonProperty("merch_long")
    private double merchantLongitude;

    @JsonProperty("dob")
    private String dateOfBirth;

    @JsonProperty("city_pop")
    private long cityPopulation;

    @JsonProperty("is_fraud")
    private int isFraud;
}
