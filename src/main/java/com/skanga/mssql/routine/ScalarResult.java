package com.skanga.mssql.routine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single value returned by a scalar function, null when the function returned SQL NULL.
 */
public record ScalarResult(Object result) implements RoutineResult {

    @Override
    public Map<String, Object> toData() {
        Map<String, Object> dataMap = new LinkedHashMap<>();
        dataMap.put("result", result);
        return dataMap;
    }
}
