package io.visitfile.parser.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered sequences opened by a {@code GROUP} marker.
 */
public record Group(int index, List<Parameter> parameters, List<Sequence> sequences, int lineNumber) {

    public Group {
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        sequences = List.copyOf(Objects.requireNonNull(sequences, "sequences"));
    }

    public Group(int index, List<Sequence> sequences) {
        this(index, List.of(), sequences, 0);
    }

    public Optional<Sequence> sequence(int sequenceIndex) {
        return sequences.stream()
                .filter(sequence -> sequence.index() == sequenceIndex)
                .findFirst();
    }
}
