package com.anomalywatch.training.data;

import lombok.Value;

@Value
public class TrainTestSplit {

    LabeledDataset train;

    LabeledDataset test;
}
