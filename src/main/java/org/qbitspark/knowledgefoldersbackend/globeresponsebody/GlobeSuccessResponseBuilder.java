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
public class GlobeSuccessResponseBuilder {

    private boolean success;
    private HttpStatus httpStatus;
    private String message;
    private LocalDateTime actionTime;
    private Object data;

    public static GlobeSuccessResponseBuilder success(String message, Object data) {
        return GlobeSuccessResponseBuilder.builder()
                .success(true)
                .httpStatus(HttpStatus.OK)
                .message(message)
                .actionTime(LocalDateTime.now())
                .data(data)
                .build();
    }
}
