package com.flagship.pawnshop.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Optional body of the cancel and complete endpoints.
 */
@Value
public class TransactionNoteRequest {

    @JsonProperty("notes")
    String notes;
}
