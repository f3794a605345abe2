package org.pncover.json;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.pncover.exceptions.InputException;

/**
 * JSON validation utilities
 */
public class JsonValidator {

    /**
     * Parse a JSON document whose top level must be an object.
     * json-simple is lenient about separators: a missing comma between array
     * elements is accepted, so the dimension checks downstream still apply.
     */
    public static JSONObject parseObject(String jsonString) throws InputException {
        if (jsonString == null || jsonString.trim().isEmpty()) {
            throw new InputException("Net input is empty");
        }

        Object parsed;
        try {
            parsed = new JSONParser().parse(jsonString);
        } catch (ParseException e) {
            throw new InputException(getValidationError(e), e, jsonString, e.getPosition());
        }

        if (!(parsed instanceof JSONObject)) {
            throw new InputException("Net input is not a JSON object");
        }
        return (JSONObject) parsed;
    }

    /**
     * Get detailed validation error for debugging
     */
    public static String getValidationError(ParseException e) {
        return String.format("JSON Parse Error at position %d: %s", e.getPosition(), e);
    }

    /**
     * Validate that JSON contains required fields
     */
    public static void requireFields(JSONObject json, String... requiredFields) throws InputException {
        for (String field : requiredFields) {
            if (!json.containsKey(field) || json.get(field) == null) {
                throw new InputException("Missing required field '" + field + "'", field);
            }
        }
    }
}
