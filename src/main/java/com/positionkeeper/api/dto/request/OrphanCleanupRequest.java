package com.positionkeeper.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrphanCleanupRequest {

    @NotBlank
    private String credentialId;

    @NotBlank
    private String market;
}
