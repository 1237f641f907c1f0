package com.flagship.pawnshop.report;

import com.flagship.pawnshop.config.JacksonConfig;
import com.flagship.pawnshop.report.dto.TransactionExportRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExportWriterTest {

    private final ExportWriter writer = new ExportWriter(new JacksonConfig().csvMapper(),
        Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("CSV export has a header row and a timestamped attachment name")
    void writesCsvAttachment() {
        TransactionExportRow row = new TransactionExportRow("T-ABC123", Instant.parse("2024-06-14T09:30:00Z"),
            "SALE", "COMPLETED", new BigDecimal("250.00"), "CASH", null, "N/A", "N/A", "N/A");

        ResponseEntity<String> response = writer.csv("transaction_report", List.of(row), TransactionExportRow.class);

        String[] lines = response.getBody().split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("\"Transaction Code\"") || lines[0].startsWith("Transaction Code"));
        assertTrue(lines[0].contains("Payment Method"));
        assertTrue(lines[1].startsWith("T-ABC123,2024-06-14T09:30:00Z,SALE,COMPLETED,250.00,CASH,"));
        assertTrue(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION)
            .contains("transaction_report_20240615_100000.csv"));
        assertEquals("text", response.getHeaders().getContentType().getType());
        assertEquals("csv", response.getHeaders().getContentType().getSubtype());
    }

    @Test
    void emptyExportStillHasHeader() {
        ResponseEntity<String> response = writer.csv("loan_report", List.of(), TransactionExportRow.class);

        assertTrue(response.getBody().contains("Transaction Code"));
        assertEquals(1, response.getBody().trim().split("\n").length);
    }
}
