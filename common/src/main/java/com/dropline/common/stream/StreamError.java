package com.dropline.common.stream;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamError {

    public static final String MALFORMED_FRAME = "MALFORMED_FRAME";
    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";
    public static final String ACCESS_DENIED = "ACCESS_DENIED";
    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";

    private String code;
    private String message;
}
