package com.autopilot.api.dto.request;

import com.autopilot.domain.enums.StopOrigin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of POST /emergency-stop. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyStopRequestDto {

    @NotBlank
    @Size(max = 500)
    private String reason;

    /** DASHBOARD when omitted. */
    private StopOrigin origin;
}
