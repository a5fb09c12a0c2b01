package com.skanga.mssql.routine;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decodes caller-supplied parameter text into an insertion-ordered map of classified values.
 * <p>
 * Numbers are classified by the first representation that holds them without loss:
 * 32-bit int, 64-bit long, {@code DECIMAL(38,10)}, then double. Strings in ISO-8601
 * local date-time form become temporal values; other strings stay text. Nested objects
 * and arrays are carried as their JSON text.
 */
public class ParameterDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ParameterDecoder.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);

    static final int DECIMAL_MAX_SCALE = 10;
    static final int DECIMAL_MAX_INTEGER_DIGITS = 28;

    private static final Pattern DATE_TIME_SHAPE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}.*");

    /**
     * Decodes parameter text. Null, blank and the JSON literal {@code null} all mean "no parameters".
     *
     * @param parameterText JSON object text such as {@code {"@amount": 100.00}}
     * @return ordered map from parameter name to decoded value
     * @throws MalformedParametersException if the text is not a well-formed JSON object
     */
    public Map<String, ParameterValue> decode(String parameterText) throws MalformedParametersException {
        if (parameterText == null || parameterText.isBlank()) {
            return Collections.emptyMap();
        }
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(parameterText);
        } catch (JsonProcessingException e) {
            throw new MalformedParametersException(e.getOriginalMessage(), e);
        }
        return decode(rootNode);
    }

    /**
     * Decodes an already parsed JSON node, which must be an object (or null/missing).
     *
     * @param parametersNode the parameters object
     * @return ordered map from parameter name to decoded value
     * @throws MalformedParametersException if the node is not a JSON object
     */
    public Map<String, ParameterValue> decode(JsonNode parametersNode) throws MalformedParametersException {
        if (parametersNode == null || parametersNode.isNull() || parametersNode.isMissingNode()) {
            return Collections.emptyMap();
        }
        if (!parametersNode.isObject()) {
            throw new MalformedParametersException(
                    "expected a JSON object of parameter names to values but found " + parametersNode.getNodeType());
        }

        Map<String, ParameterValue> decodedValues = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fieldIterator = parametersNode.fields();
        while (fieldIterator.hasNext()) {
            Map.Entry<String, JsonNode> currField = fieldIterator.next();
            decodedValues.put(currField.getKey(), decodeValue(currField.getKey(), currField.getValue()));
        }
        logger.debug("Decoded {} routine parameters", decodedValues.size());
        return decodedValues;
    }

    /**
     * Classifies a single JSON value.
     */
    public ParameterValue decodeValue(String key, JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull() || valueNode.isMissingNode()) {
            return ParameterValue.ofNull(key);
        }
        if (valueNode.isBoolean()) {
            return ParameterValue.ofBoolean(key, valueNode.booleanValue());
        }
        if (valueNode.isIntegralNumber()) {
            if (valueNode.canConvertToInt()) {
                return ParameterValue.ofInt(key, valueNode.intValue());
            }
            if (valueNode.canConvertToLong()) {
                return ParameterValue.ofLong(key, valueNode.longValue());
            }
            return decodeDecimal(key, new BigDecimal(valueNode.bigIntegerValue()));
        }
        if (valueNode.isNumber()) {
            return decodeDecimal(key, valueNode.decimalValue());
        }
        if (valueNode.isTextual()) {
            return decodeText(key, valueNode.textValue());
        }
        return ParameterValue.ofText(key, valueNode.toString());
    }

    private static ParameterValue decodeDecimal(String key, BigDecimal decimalValue) {
        if (fitsDecimal(decimalValue)) {
            return ParameterValue.ofDecimal(key, decimalValue);
        }
        return ParameterValue.ofDouble(key, decimalValue.doubleValue());
    }

    /**
     * True when the value can be stored in {@code DECIMAL(38,10)} without rounding.
     */
    static boolean fitsDecimal(BigDecimal decimalValue) {
        int integerDigits = decimalValue.precision() - decimalValue.scale();
        return decimalValue.scale() <= DECIMAL_MAX_SCALE && integerDigits <= DECIMAL_MAX_INTEGER_DIGITS;
    }

    private static ParameterValue decodeText(String key, String textValue) {
        if (DATE_TIME_SHAPE.matcher(textValue).matches()) {
            try {
                return ParameterValue.ofTemporal(key,
                        LocalDateTime.parse(textValue, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            } catch (DateTimeParseException e) {
                // Offsets and other near misses are bound as text
                logger.trace("Parameter {} looks temporal but is not a local date-time: {}", key, e.getMessage());
            }
        }
        return ParameterValue.ofText(key, textValue);
    }
}
