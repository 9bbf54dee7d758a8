package com.qqsuccubus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON wire shape of a {@link NormalizedTable}.
 * <pre>
 * {"columns": ["200", "503"], "index": [1705677240000], "data": [[12.0, 1.0]]}
 * </pre>
 * Index entries are minute-bucket starts in epoch milliseconds (UTC).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableFrame {
    private List<String> columns;
    private List<Long> index;
    private List<List<Double>> data;
}
