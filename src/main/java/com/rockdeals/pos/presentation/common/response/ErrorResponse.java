package com.rockdeals.pos.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 *
 * details: 부족 금액(shortfall), 재고(available) 등 예외별 부가 정보. 없으면 생략
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("details")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> details;

    public static ErrorResponse of(String errorCode, String errorMessage) {
        return of(errorCode, errorMessage, null);
    }

    public static ErrorResponse of(String errorCode, String errorMessage, Map<String, Object> details) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId("req-" + UUID.randomUUID().toString().substring(0, 12))
                .details(details)
                .build();
    }
}
