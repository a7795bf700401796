package io.visitfile.parser.cli;

import io.visitfile.parser.summary.Instrument;
import picocli.CommandLine;

public class InstrumentConverter implements CommandLine.ITypeConverter<Instrument> {

    @Override
    public Instrument convert(String value) {
        return Instrument.from(value);
    }
}
