package io.visitfile.parser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Root of the parsed visit document.
 *
 * @param id visit identifier such as {@code V00783001001}
 * @param templates APT template names listed on the file's leading comment line
 * @param parameters named parameters of the {@code VISIT} header statement
 * @param statements visit-level statements appearing before the first group
 * @param groups groups in file order
 */
public record Visit(String id,
                    List<String> templates,
                    List<Parameter> parameters,
                    List<Activity> statements,
                    List<Group> groups) {

    public static final Pattern DEFAULT_ID_PATTERN = Pattern.compile("V\\d{11}");

    public Visit {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        templates = List.copyOf(Objects.requireNonNull(templates, "templates"));
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        statements = List.copyOf(Objects.requireNonNull(statements, "statements"));
        groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    }

    public Visit(String id, List<Group> groups) {
        this(id, List.of(), List.of(), List.of(), groups);
    }

    public Optional<Group> group(int groupIndex) {
        return groups.stream()
                .filter(group -> group.index() == groupIndex)
                .findFirst();
    }

    public Optional<Sequence> sequence(int groupIndex, int sequenceIndex) {
        return group(groupIndex).flatMap(group -> group.sequence(sequenceIndex));
    }

    /**
     * Activities of all sequences in tree order.
     */
    public List<Activity> activities() {
        List<Activity> activities = new ArrayList<>();
        for (Group group : groups) {
            for (Sequence sequence : group.sequences()) {
                activities.addAll(sequence.activities());
            }
        }
        return Collections.unmodifiableList(activities);
    }

    /**
     * Visit-level statements followed by all sequence activities.
     */
    public List<Activity> allStatements() {
        List<Activity> all = new ArrayList<>(statements);
        all.addAll(activities());
        return Collections.unmodifiableList(all);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
