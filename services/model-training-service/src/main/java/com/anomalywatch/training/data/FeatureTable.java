package com.anomalywatch.training.data;

import com.anomalywatch.common.feature.CategoryEncoding;
import lombok.Value;

/**
 * Output of feature construction: the model-ready dataset and the encoding it was built with.
 */
@Value
public class FeatureTable {

    LabeledDataset dataset;

    CategoryEncoding encoding;
}
