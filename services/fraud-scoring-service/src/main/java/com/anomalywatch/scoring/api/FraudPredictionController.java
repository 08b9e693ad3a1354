package com.anomalywatch.scoring.api;

import com.anomalywatch.scoring.model.PredictionResult;
import com.anomalywatch.scoring.registry.ModelRegistry;
import com.anomalywatch.scoring.service.CardFraudScoringService;
import com.anomalywatch.scoring.service.PaymentFraudScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thin HTTP adapter over the scoring services.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Fraud Prediction", description = "Hybrid model + rule fraud scoring")
public class FraudPredictionController {

    private final PaymentFraudScoringService paymentScoringService;
    private final CardFraudScoringService cardScoringService;
    private final ModelRegistry modelRegistry;

    @GetMapping("/")
    @Operation(summary = "Service status", description = "Status and logical names of the loaded models")
    public ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(new StatusResponse("ok", modelRegistry.loadedNames()));
    }

    @PostMapping("/predict/primary")
    @Operation(summary = "Score a payment transaction",
            description = "Champion model probability fused with the payment heuristic rules")
    @ApiResponse(responseCode = "200", description = "Transaction scored")
    @ApiResponse(responseCode = "400", description = "Invalid transaction")
    @ApiResponse(responseCode = "503", description = "Payment model or encoder not loaded")
    public ResponseEntity<PredictionResult> predictPrimary(@Valid @RequestBody PaymentTransactionRequest request) {
        return ResponseEntity.ok(paymentScoringService.score(request.toRecord()));
    }

    @PostMapping("/predict/secondary")
    @Operation(summary = "Score a card transaction",
            description = "Card-domain model probability with the merchant distance rule")
    @ApiResponse(responseCode = "200", description = "Transaction scored")
    @ApiResponse(responseCode = "400", description = "Invalid transaction")
    @ApiResponse(responseCode = "503", description = "Card-domain model not loaded")
    public ResponseEntity<PredictionResult> predictSecondary(@Valid @RequestBody CardTransactionRequest request) {
        return ResponseEntity.ok(cardScoringService.score(request.toRecord()));
    }
}
