package com.yava.intent.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Spreadsheet rows already reduced to typed cells, keyed by column header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkUploadRequest {
    @NotNull(message = "Rows are required")
    private List<Map<String, Object>> rows;
}
