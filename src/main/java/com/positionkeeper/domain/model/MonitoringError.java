package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.ErrorSeverity;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringError {

    private LocalDateTime timestamp;
    private ErrorSeverity severity;

    /** Position the error concerns, or a component name for cycle-level errors. */
    private String source;

    private String message;
}
