package com.anomalywatch.training.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the PaySim CSV, bound by header name.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaySimRow {

    private int step;

    private String type;

    private double amount;

    @JsonProperty("oldbalanceOrg")
    private double oldBalanceOrg;

    @JsonProperty("newbalanceOrig")
    private double newBalanceOrig;

    @JsonProperty("oldbalanceDest")
    private double oldBalanceDest;

    @JsonProperty("newbalanceDest")
    private double newBalanceDest;

    @JsonProperty("isFraud")
    private int isFraud;
}
