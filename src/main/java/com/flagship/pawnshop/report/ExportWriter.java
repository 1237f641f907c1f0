package com.flagship.pawnshop.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders export rows as a CSV attachment named {@code <base>_yyyyMMdd_HHmmss.csv}.
 * Column order and headers come from the row type's Jackson annotations.
 */
@Component
@RequiredArgsConstructor
public class ExportWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final CsvMapper csvMapper;
    private final Clock clock;

    public <T> ResponseEntity<String> csv(String baseName, List<T> rows, Class<T> rowType) {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        String body;
        try {
            body = csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render " + baseName + " export", e);
        }

        String filename = baseName + "_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".csv";
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(filename).build().toString())
            .body(body);
    }
}
