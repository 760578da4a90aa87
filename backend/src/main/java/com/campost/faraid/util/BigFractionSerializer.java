package com.campost.faraid.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.apache.commons.math3.fraction.BigFraction;

import java.io.IOException;

/**
 * Writes parts as "n" or "n/d".
 */
public class BigFractionSerializer extends StdSerializer<BigFraction> {

    public BigFractionSerializer() {
        super(BigFraction.class);
    }

    @Override
    public void serialize(BigFraction value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(Parts.format(value));
    }
}
