package com.anomalywatch.scoring.api;

import com.anomalywatch.common.domain.TransactionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
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
@Schema(description = "Payment transaction to score")
public class PaymentTransactionRequest {

    @Min(value = 1, message = "step must be at least 1")
    @Schema(description = "Time step (1 step = 1 hour)", example = "1")
    @Builder.Default
    private int step = 1;

    @NotBlank(message = "type is required")
    @Schema(description = "Transaction type (CASH_OUT, TRANSFER, PAYMENT, ...)", example = "TRANSFER",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String type;

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must not be negative")
    @Schema(description = "Transaction amount", example = "50000.0", requiredMode = Schema.RequiredMode.REQUIRED)
    private Double amount;

    @JsonProperty("oldbalanceOrg")
    @NotNull(message = "oldbalanceOrg is required")
    @PositiveOrZero(message = "oldbalanceOrg must not be negative")
    @Schema(description = "Sender balance before the transaction", example = "50000.0",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Double oldBalanceOrg;

    @JsonProperty("newbalanceOrig")
    @NotNull(message = "newbalanceOrig is required")
    @Schema(description = "Sender balance after the transaction; may be negative", example = "0.0",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Double newBalanceOrig;

    @JsonProperty("oldbalanceDest")
    @PositiveOrZero(message = "oldbalanceDest must not be negative")
    @Schema(description = "Recipient balance before the transaction", example = "0.0")
    @Builder.Default
    private Double oldBalanceDest = 0.0;

    @JsonProperty("newbalanceDest")
    @PositiveOrZero(message = "newbalanceDest must not be negative")
    @Schema(description = "Recipient balance after the transaction", example = "50000.0")
    @Builder.Default
    private Double newBalanceDest = 0.0;

    public TransactionRecord toRecord() {
        return TransactionRecord.builder()
                .step(step)
                .type(type)
                .amount(amount)
                .oldBalanceOrg(oldBalanceOrg)
                .newBalanceOrig(newBalanceOrig)
                .oldBalanceDest(oldBalanceDest == null ? 0.0 : oldBalanceDest)
                .newBalanceDest(newBalanceDest == null ? 0.0 : newBalanceDest)
                .build();
    }
}
