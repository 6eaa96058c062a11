package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Enum constant that is addressed by a lower-case name in operation requests.
 */
public interface WireNamed {

    String wireName();

    /**
     * Resolve a request value to its constant, case-insensitively.
     *
     * @param what parameter name used in the error message
     */
    static <E extends Enum<E> & WireNamed> E parse(Class<E> type, String value, String what) {
        if (value != null) {
            for (E constant : type.getEnumConstants()) {
                if (constant.wireName().equalsIgnoreCase(value.trim())) {
                    return constant;
                }
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(WireNamed::wireName)
                .collect(Collectors.joining(", "));
        throw new ValidationException("Invalid " + what + ": " + value + " (expected one of " + allowed + ")");
    }
}
