package com.positionkeeper.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope applied to every engine REST body by {@code ApiResponseAdvice}. List
 * bodies (active positions, time boxes) also report their {@code count}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.count = data instanceof Collection<?> collection ? collection.size() : null;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
