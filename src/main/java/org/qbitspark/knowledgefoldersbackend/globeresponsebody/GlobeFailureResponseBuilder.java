package org.qbitspark.knowledgefoldersbackend.globeresponsebody;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GlobeFailureResponseBuilder {

    private boolean success;
    private HttpStatus httpStatus;
    private String message;
    private LocalDateTime actionTime;
    private Object data;

    public static GlobeFailureResponseBuilder failure(HttpStatus status, String message, Object data) {
        return GlobeFailureResponseBuilder.builder()
                .success(false)
                .httpStatus(status)
                .message(message)
                .actionTime(LocalDateTime.now())
                .data(data)
                .build();
    }
}
