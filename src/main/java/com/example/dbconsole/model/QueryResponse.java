package com.example.dbconsole.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON envelope returned to the console: {@code data} on success, {@code error} on failure.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {
    private boolean success;
    private String data;
    private String error;

    public static QueryResponse success(String data) {
        return new QueryResponse(true, data, null);
    }

    public static QueryResponse error(String error) {
        return new QueryResponse(false, null, error);
    }
}
