package com.anomalywatch.common.feature;

import java.io.Serial;
import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Bidirectional transaction-type label to integer code mapping.
 *
 * <p>Fitted once by the trainer and stored next to the models it was used
 * with. Codes are assigned to the distinct labels in lexicographic order,
 * starting at zero. Instances are immutable.
 */
public final class CategoryEncoding implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Code used for labels that were not present when the encoding was fitted.
     */
    public static final int DEFAULT_CODE = 0;

    private final List<String> labels;
    private final Map<String, Integer> codes;

    private CategoryEncoding(List<String> labels) {
        this.labels = List.copyOf(labels);
        this.codes = IntStream.range(0, this.labels.size())
                .boxed()
                .collect(Collectors.toUnmodifiableMap(this.labels::get, Function.identity()));
    }

    public static CategoryEncoding fit(Collection<String> observedLabels) {
        Objects.requireNonNull(observedLabels, "observedLabels");
        TreeSet<String> distinct = observedLabels.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        if (distinct.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a category encoding without labels");
        }
        return new CategoryEncoding(List.copyOf(distinct));
    }

    public OptionalInt lookup(String label) {
        Integer code = label == null ? null : codes.get(label);
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    public int encodeOrDefault(String label) {
        return lookup(label).orElse(DEFAULT_CODE);
    }

    public Optional<String> decode(int code) {
        if (code < 0 || code >= labels.size()) {
            return Optional.empty();
        }
        return Optional.of(labels.get(code));
    }

    public List<String> labels() {
        return Collections.unmodifiableList(labels);
    }

    public int size() {
        return labels.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CategoryEncoding)) {
            return false;
        }
        return labels.equals(((CategoryEncoding) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return "CategoryEncoding" + codes;
    }
}
