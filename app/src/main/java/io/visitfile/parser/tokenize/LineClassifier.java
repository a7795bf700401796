package io.visitfile.parser.tokenize;

import java.util.List;

/**
 * Classifies raw visit file lines ahead of structural parsing.
 */
public interface LineClassifier {

    List<ClassifiedLine> classify(List<String> lines);
}
