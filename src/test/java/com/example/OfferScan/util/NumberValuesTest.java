package com.example.OfferScan.util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class NumberValuesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1 234,56        | 1234.56",
            "1.234,56 zł     | 1234.56",
            "12 500 zł       | 12500",
            "1,234           | 1234",
            "350,00          | 350",
            "-15,5           | -15.5",
            "0               | 0",
            "Składka: 99 PLN | 99"
    })
    void parsesPolishAmounts(String raw, double expected) {
        assertEquals(expected, NumberValues.parseNumberValue(raw), 1e-9);
    }

    @Test
    void returnsNullWhenNothingIsNumeric() {
        assertNull(NumberValues.parseNumberValue("not a number"));
        assertNull(NumberValues.parseNumberValue(""));
        assertNull(NumberValues.parseNumberValue(null));
        assertNull(NumberValues.parseNumberValue(Double.NaN));
        assertNull(NumberValues.parseNumberValue(new Object()));
    }

    @Test
    void acceptsNumbersAndJsonNodes() {
        assertEquals(42.0, NumberValues.parseNumberValue(42));
        assertEquals(0.5, NumberValues.parseNumberValue(JsonNodeFactory.instance.numberNode(0.5)));
        assertEquals(120.5, NumberValues.parseNumberValue(JsonNodeFactory.instance.textNode("120,50 zł")));
        assertNull(NumberValues.parseNumberValue(JsonNodeFactory.instance.nullNode()));
        assertNull(NumberValues.parseNumberValue(MissingNode.getInstance()));
    }

    @Test
    void zeroIsARealValue() {
        assertEquals(0.0, NumberValues.parseOptional("0,00 zł").getAsDouble());
    }
}
