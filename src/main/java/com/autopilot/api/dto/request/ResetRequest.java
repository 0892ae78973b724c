package com.autopilot.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of POST /risk/accounts/{id}/reset. {@code confirm} must be exactly "CONFIRM". */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetRequest {

    @NotBlank
    private String confirm;

    private String requestedBy;
}
