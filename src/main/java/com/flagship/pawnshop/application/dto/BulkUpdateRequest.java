package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class BulkUpdateRequest {

    @NotEmpty(message = "At least one application id is required")
    @JsonProperty("application_ids")
    List<UUID> applicationIds;

    @Valid
    @NotNull(message = "Update data is required")
    @JsonProperty("update_data")
    ApplicationUpdateRequest updateData;
}
