package com.eyelevel.catalogingestion.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Envelope for every REST response, successful or not. The client library unwraps the same
 * structure, hence the Jackson-aware builder.
 **/
@Getter
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> error(String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    /**
     * Builds an error envelope whose payload is a technical detail string.
     */
    @SuppressWarnings("unchecked")
    public static <T> ApiResponse<T> error(String displayMessage, String detail) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).response((T) detail).showMessage(true)
                          .build();
    }
}
