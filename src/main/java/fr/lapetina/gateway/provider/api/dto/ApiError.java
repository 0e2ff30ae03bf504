package fr.lapetina.gateway.provider.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON error body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String error, String details) {

    public static ApiError of(String error) {
        return new ApiError(error, null);
    }
}
