package com.anomalywatch.training.data;

import com.anomalywatch.training.exception.TrainingConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TrainingDatasetLoader Tests")
class TrainingDatasetLoaderTest {

    @TempDir
    Path directory;

    private final TrainingDatasetLoader loader = new TrainingDatasetLoader();

    @Test
    @DisplayName("Should read PaySim rows by header name, ignoring extra columns")
    void shouldReadPaySimRows() throws IOException {
        // Given
        Path csv = directory.resolve("paysim.csv");
        Files.writeString(csv, String.join("\n",
                "step,type,amount,nameOrig,oldbalanceOrg,newbalanceOrig,nameDest,oldbalanceDest,newbalanceDest,isFraud,isFlaggedFraud",
                "1,TRANSFER,181.0,C1305486145,181.0,0.0,C553264065,0.0,0.0,1,0",
                "3,PAYMENT,9839.64,C1231006815,170136.0,160296.36,M1979787155,0.0,0.0,0,0"));

        // When
        List<LabeledTransaction> rows = loader.loadPaySim(csv);

        // Then
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).isFraud()).isTrue();
        assertThat(rows.get(0).getRecord().getType()).isEqualTo("TRANSFER");
        assertThat(rows.get(0).getRecord().getOldBalanceOrg()).isEqualTo(181.0);
        assertThat(rows.get(1).isFraud()).isFalse();
        assertThat(rows.get(1).getRecord().getStep()).isEqualTo(3);
        assertThat(rows.get(1).getRecord().getNewBalanceOrig()).isEqualTo(160296.36);
    }

    @Test
    @DisplayName("Should read card rows by header name")
    void shouldReadCardRows() throws IOException {
        // Given
        Path csv = directory.resolve("cards.csv");
        Files.writeString(csv, String.join("\n",
                "trans_date_trans_time,amt,lat,long,city_pop,dob,merch_lat,merch_long,is_fraud",
                "2019-01-01 00:00:18,4.97,36.0788,-81.1781,3495,1988-03-09,36.011293,-82.048315,0"));

        // When
        List<LabeledCardTransaction> rows = loader.loadCardTransactions(csv);

        // Then
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getRecord().getAmount()).isEqualTo(4.97);
        assertThat(rows.get(0).getRecord().getDateOfBirth()).isEqualTo("1988-03-09");
        assertThat(rows.get(0).getRecord().getCityPopulation()).isEqualTo(3495L);
        assertThat(rows.get(0).isFraud()).isFalse();
    }

    @Test
    @DisplayName("Should fail fast with remediation text when the dataset is absent")
    void shouldFailWhenDatasetMissing() {
        Path missing = directory.resolve("missing.csv");

        assertThatThrownBy(() -> loader.loadPaySim(missing))
                .isInstanceOf(TrainingConfigurationException.class)
                .hasMessageContaining("missing.csv")
                .hasMessageContaining("anomalywatch.training.dataset-path");
    }
}
