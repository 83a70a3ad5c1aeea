package com.lynkvertx.navarch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking a vessel or its offset table before it is stored.
 * Errors block the save; warnings describe gaps the geometry model fills by interpolation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResultDTO {

    private boolean valid;

    @Builder.Default
    private List<ValidationError> errors = new ArrayList<>();

    @Builder.Default
    private List<ValidationError> warnings = new ArrayList<>();

    /**
     * One finding. {@code row} is the position of the entry in the submitted list, or the
     * station index for offsets; {@code column} is the waterline index of an offset.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ValidationError {
        private String field;
        private String message;
        private Integer row;
        private Integer column;

        public ValidationError(String field, String message) {
            this(field, message, null, null);
        }
    }
}
