package com.anomalywatch.training;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Model Training Service Application
 *
 * Offline batch job that builds the fraud model artifacts:
 * - Stratified sampling and feature engineering of the PaySim dataset
 * - Synthetic minority oversampling of the training split
 * - Baseline, champion and anomaly-detector training
 * - Hold-out evaluation and artifact emission
 * - Card-domain random forest training
 */
@SpringBootApplication
public class TrainingServiceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TrainingServiceApplication.class, args)));
    }
}
