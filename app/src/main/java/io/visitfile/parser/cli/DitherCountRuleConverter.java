package io.visitfile.parser.cli;

import io.visitfile.parser.summary.DitherCountRule;
import picocli.CommandLine;

public class DitherCountRuleConverter implements CommandLine.ITypeConverter<DitherCountRule> {

    @Override
    public DitherCountRule convert(String value) {
        return DitherCountRule.from(value);
    }
}
