package com.flagship.pawnshop.report;

import com.flagship.pawnshop.exception.BusinessValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ExportFormatTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"csv", "CSV", " csv "})
    void csvIsTheDefault(String value) {
        assertEquals(ExportFormat.CSV, ExportFormat.parse(value));
    }

    @Test
    void jsonIsCaseInsensitive() {
        assertEquals(ExportFormat.JSON, ExportFormat.parse("Json"));
    }

    @Test
    void otherFormatsAreRejected() {
        BusinessValidationException e = assertThrows(BusinessValidationException.class,
            () -> ExportFormat.parse("xlsx"));
        assertEquals("export_format", e.getRule());
    }
}
