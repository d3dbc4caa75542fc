package com.largomodo.debpartial;

import com.largomodo.debpartial.core.CapacitySequence;
import picocli.CommandLine;

/**
 * Converts {@code --size} and {@code --srcsize} values such as {@code CD74,0,DVD} or
 * {@code 650000000}. Unknown media names are rejected here, before anything is read.
 */
public class CapacitySequenceConverter implements CommandLine.ITypeConverter<CapacitySequence> {

    @Override
    public CapacitySequence convert(String value) {
        try {
            return CapacitySequence.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
