package com.anomalywatch.training.data;

import com.anomalywatch.common.domain.CardTransactionRecord;
import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.training.exception.TrainingConfigurationException;
import com.anomalywatch.training.exception.TrainingPipelineException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the labeled training datasets from header-driven CSV files.
 */
@Slf4j
@Component
public class TrainingDatasetLoader {

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Fails fast when a dataset file is absent.
     *
     * @throws TrainingConfigurationException with remediation instructions
     */
    public static void requireDataset(Path path, String description, String propertyName) {
        if (!Files.isRegularFile(path)) {
            throw new TrainingConfigurationException(String.format(
                    "%s not found: %s. Download the dataset CSV to that location, "
                            + "or point '%s' at an existing copy, then re-run the training job.",
                    description, path.toAbsolutePath(), propertyName));
        }
    }

    public List<LabeledTransaction> loadPaySim(Path path) {
        requireDataset(path, "PaySim dataset", "anomalywatch.training.dataset-path");
        List<LabeledTransaction> rows = read(path, PaySimRow.class, this::toLabeledTransaction);

        long fraud = rows.stream().filter(LabeledTransaction::isFraud).count();
        log.info("   Total records: {}", String.format("%,d", rows.size()));
        log.info("   Fraudulent records: {}", String.format("%,d", fraud));
        return rows;
    }

    public List<LabeledCardTransaction> loadCardTransactions(Path path) {
        requireDataset(path, "Card-domain dataset", "anomalywatch.training.card-domain.dataset-path");
        List<LabeledCardTransaction> rows = read(path, CardTransactionRow.class, this::toLabeledCardTransaction);
        log.info("   Card records: {}", String.format("%,d", rows.size()));
        return rows;
    }

    private <R, T> List<T> read(Path path, Class<R> rowType, Function<R, T> mapper) {
        log.info("Loading dataset: {}", path);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<T> rows = new ArrayList<>();
        try (MappingIterator<R> iterator = csvMapper.readerFor(rowType).with(schema).readValues(path.toFile())) {
            while (iterator.hasNext()) {
                rows.add(mapper.apply(iterator.next()));
            }
        } catch (IOException e) {
            throw new TrainingPipelineException("Failed to read dataset " + path, e);
        }
        return rows;
    }

    private LabeledTransaction toLabeledTransaction(PaySimRow row) {
        TransactionRecord record = TransactionRecord.builder()
                .step(row.getStep())
                .type(row.getType())
                .amount(row.getAmount())
                .oldBalanceOrg(row.getOldBalanceOrg())
                .newBalanceOrig(row.getNewBalanceOrig())
                .oldBalanceDest(row.getOldBalanceDest())
                .newBalanceDest(row.getNewBalanceDest())
                .build();
        return new LabeledTransaction(record, row.getIsFraud() == 1);
    }

    private LabeledCardTransaction toLabeledCardTransaction(CardTransactionRow row) {
        CardTransactionRecord record = CardTransactionRecord.builder()
                .amount(row.getAmount())
                .latitude(row.getLatitude())
                .longitude(row.getLongitude())
                .merchantLatitude(row.getMerchantLatitude())
                .merchantLongitude(row.getMerchantLongitude())
                .dateOfBirth(row.getDateOfBirth())
                .cityPopulation(row.getCityPopulation())
                .build();
        return new LabeledCardTransaction(record, row.getIsFraud() == 1);
    }
}
