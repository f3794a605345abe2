package org.pncover.json;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.pncover.exceptions.InputException;

/**
 * Typed access to the integer vectors and matrices of a net document.
 *
 * json-simple hands back Long for every integral number and Double for
 * anything with a fraction or exponent; only values that fit an int exactly
 * are accepted.
 */
public class JsonArrayReader {

    private JsonArrayReader() {
    }

    public static JSONArray getArray(JSONObject json, String field) throws InputException {
        Object value = json.get(field);
        if (!(value instanceof JSONArray)) {
            throw new InputException("Field '" + field + "' must be an array", field);
        }
        return (JSONArray) value;
    }

    public static int getInt(JSONObject json, String field) throws InputException {
        Object value = json.get(field);
        if (value == null) {
            throw new InputException("Missing required field '" + field + "'", field);
        }
        return toInt(value, field);
    }

    public static int[] getIntArray(JSONObject json, String field) throws InputException {
        return toIntArray(getArray(json, field), field);
    }

    /**
     * Reads a rectangular matrix. Every row must have the same length.
     */
    public static int[][] getIntMatrix(JSONObject json, String field) throws InputException {
        JSONArray rows = getArray(json, field);
        int[][] matrix = new int[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            Object row = rows.get(r);
            if (!(row instanceof JSONArray)) {
                throw new InputException("Row " + r + " of '" + field + "' must be an array", field);
            }
            matrix[r] = toIntArray((JSONArray) row, field + "[" + r + "]");
            if (r > 0 && matrix[r].length != matrix[0].length) {
                throw new InputException("Row " + r + " of '" + field + "' has " + matrix[r].length
                        + " columns, expected " + matrix[0].length, field);
            }
        }
        return matrix;
    }

    public static int[] toIntArray(JSONArray array, String field) throws InputException {
        int[] values = new int[array.size()];
        for (int i = 0; i < array.size(); i++) {
            values[i] = toInt(array.get(i), field + "[" + i + "]");
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    public static JSONArray toJsonArray(int[] values) {
        JSONArray array = new JSONArray();
        for (int value : values) {
            array.add(Long.valueOf(value));
        }
        return array;
    }

    @SuppressWarnings("unchecked")
    public static JSONArray toJsonMatrix(int[][] matrix) {
        JSONArray rows = new JSONArray();
        for (int[] row : matrix) {
            rows.add(toJsonArray(row));
        }
        return rows;
    }

    private static int toInt(Object value, String field) throws InputException {
        if (value instanceof Long) {
            long l = (Long) value;
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new InputException("Value " + l + " of '" + field + "' is out of range", field);
            }
            return (int) l;
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                return (int) d;
            }
        }
        throw new InputException("Value '" + value + "' of '" + field + "' is not an integer", field);
    }
}
