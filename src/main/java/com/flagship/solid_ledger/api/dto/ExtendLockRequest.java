package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for moving the unlock block later.
 */
@Value
public class ExtendLockRequest {

    @NotNull(message = "Unlock block is required")
    @JsonProperty("unlock_block")
    Long unlockBlock;
}
