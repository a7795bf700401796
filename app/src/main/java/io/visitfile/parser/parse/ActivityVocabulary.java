package io.visitfile.parser.parse;

import io.visitfile.parser.model.ActivityKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keyword classification table for visit file statements.
 *
 * <p>Entries are read from properties of the form {@code activity.<KEYWORD>=<kind>} for statements inside
 * sequences and {@code visit.<KEYWORD>=<kind>} for visit-level statements preceding the first group. Kinds
 * are the {@link ActivityKind} names, case-insensitive, with {@code -} accepted for {@code _}.
 */
public final class ActivityVocabulary {

    static final String DEFAULT_RESOURCE = "/visit-vocabulary.properties";
    private static final String ACTIVITY_PREFIX = "activity.";
    private static final String VISIT_PREFIX = "visit.";

    private final Map<String, ActivityKind> activityKinds;
    private final Map<String, ActivityKind> visitStatementKinds;

    private ActivityVocabulary(Map<String, ActivityKind> activityKinds, Map<String, ActivityKind> visitStatementKinds) {
        this.activityKinds = Collections.unmodifiableMap(new LinkedHashMap<>(activityKinds));
        this.visitStatementKinds = Collections.unmodifiableMap(new LinkedHashMap<>(visitStatementKinds));
    }

    public static ActivityVocabulary defaults() {
        try (InputStream input = ActivityVocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing bundled vocabulary " + DEFAULT_RESOURCE);
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
            return fromProperties(properties);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read bundled vocabulary", ex);
        }
    }

    public static ActivityVocabulary load(Path path) {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            return fromProperties(properties);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read vocabulary file: " + path, ex);
        }
    }

    public static ActivityVocabulary fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, ActivityKind> activities = new LinkedHashMap<>();
        Map<String, ActivityKind> visitStatements = new LinkedHashMap<>();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            String value = properties.getProperty(key);
            if (key.startsWith(ACTIVITY_PREFIX)) {
                activities.put(normalize(key.substring(ACTIVITY_PREFIX.length())), ActivityKind.from(value));
            } else if (key.startsWith(VISIT_PREFIX)) {
                visitStatements.put(normalize(key.substring(VISIT_PREFIX.length())), ActivityKind.from(value));
            } else {
                throw new IllegalArgumentException("Unsupported vocabulary entry: " + key);
            }
        }
        return new ActivityVocabulary(activities, visitStatements);
    }

    public static ActivityVocabulary empty() {
        return new ActivityVocabulary(Map.of(), Map.of());
    }

    /**
     * Returns a copy with an additional activity keyword.
     */
    public ActivityVocabulary withActivity(String keyword, ActivityKind kind) {
        Map<String, ActivityKind> activities = new LinkedHashMap<>(activityKinds);
        activities.put(normalize(keyword), Objects.requireNonNull(kind, "kind"));
        return new ActivityVocabulary(activities, visitStatementKinds);
    }

    /**
     * Returns a copy with an additional visit-level statement keyword.
     */
    public ActivityVocabulary withVisitStatement(String keyword, ActivityKind kind) {
        Map<String, ActivityKind> visitStatements = new LinkedHashMap<>(visitStatementKinds);
        visitStatements.put(normalize(keyword), Objects.requireNonNull(kind, "kind"));
        return new ActivityVocabulary(activityKinds, visitStatements);
    }

    public Optional<ActivityKind> activityKind(String keyword) {
        return Optional.ofNullable(activityKinds.get(normalize(keyword)));
    }

    public Optional<ActivityKind> visitStatementKind(String keyword) {
        return Optional.ofNullable(visitStatementKinds.get(normalize(keyword)));
    }

    public Set<String> visitStatementKeywords() {
        return visitStatementKinds.keySet();
    }

    public Set<String> knownKeywords() {
        Set<String> keywords = new LinkedHashSet<>(activityKinds.keySet());
        keywords.addAll(visitStatementKinds.keySet());
        return Collections.unmodifiableSet(keywords);
    }

    private static String normalize(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword must not be blank");
        }
        return keyword.trim().toUpperCase(Locale.ROOT);
    }
}
