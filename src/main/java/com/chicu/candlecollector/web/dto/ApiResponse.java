package com.chicu.candlecollector.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ApiResponse {
    private String status;
    private String message;

    public static ApiResponse accepted(String msg) {
        return new ApiResponse("accepted", msg);
    }

    public static ApiResponse rejected(String msg) {
        return new ApiResponse("rejected", msg);
    }
}
