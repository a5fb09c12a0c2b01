package com.skanga.mssql.routine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outputs of a stored procedure call.
 *
 * @param returnValue      the integer return code
 * @param resultSets       non-empty row sets in the order they were produced
 * @param outputParameters output parameter values by name, including {@code @RETURN_VALUE}
 */
public record ProcedureResult(Object returnValue,
                              List<List<Map<String, Object>>> resultSets,
                              Map<String, Object> outputParameters) implements RoutineResult {
    public static final String RETURN_VALUE_NAME = "@RETURN_VALUE";

    public ProcedureResult {
        resultSets = List.copyOf(resultSets);
        outputParameters = Collections.unmodifiableMap(new LinkedHashMap<>(outputParameters));
    }

    /**
     * Builds the payload: {@code return_value} always; {@code result_set} for one row set or
     * {@code result_sets} for several; {@code output_parameters} only when the procedure declared
     * outputs beyond the return code.
     */
    @Override
    public Map<String, Object> toData() {
        Map<String, Object> dataMap = new LinkedHashMap<>();
        dataMap.put("return_value", returnValue);

        if (resultSets.size() == 1) {
            dataMap.put("result_set", resultSets.get(0));
        } else if (resultSets.size() > 1) {
            dataMap.put("result_sets", resultSets);
        }

        if (outputParameters.size() > 1) {
            dataMap.put("output_parameters", outputParameters);
        }
        return dataMap;
    }
}
