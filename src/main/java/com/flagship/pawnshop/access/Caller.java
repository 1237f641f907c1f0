package com.flagship.pawnshop.access;

import lombok.Value;

import java.util.UUID;

/**
 * The authenticated user behind the current request, as seen by the access control table.
 */
@Value
public class Caller {
    UUID userId;
    String username;
    String roleName;
}
