package battetl.transform.dto;

import battetl.transform.util.CorrelationIdUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error body returned by the transform endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponseDto {

    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;

    /**
     * Error for the current request, stamped now.
     */
    public ErrorResponseDto(String error, String message) {
        this(error, message, CorrelationIdUtil.getCurrentCorrelationId(), LocalDateTime.now());
    }
}
