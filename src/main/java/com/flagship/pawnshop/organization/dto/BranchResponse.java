package com.flagship.pawnshop.organization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.organization.BranchEntity;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BranchResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("address")
    String address;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("email")
    String email;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BranchResponse from(BranchEntity branch) {
        return new BranchResponse(branch.getId(), branch.getName(), branch.getAddress(),
            branch.getPhone(), branch.getEmail(), branch.getCreatedAt());
    }
}
