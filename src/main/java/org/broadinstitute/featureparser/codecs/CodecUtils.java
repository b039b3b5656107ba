package org.broadinstitute.featureparser.codecs;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.broadinstitute.featureparser.exceptions.UserException;

import java.util.ArrayList;
import java.util.List;

/**
 * Column parsing shared by the line decoders and the format taster.
 */
public final class CodecUtils {
    public static final String COLUMN_DELIMITER = "\t";

    private static final Splitter COLUMN_SPLITTER = Splitter.on(COLUMN_DELIMITER);
    private static final Splitter LIST_SPLITTER = Splitter.on(',');

    private CodecUtils(){}

    public static List<String> splitColumns(final String line) {
        return COLUMN_SPLITTER.splitToList(line);
    }

    /**
     * @return true for a non-negative base-10 integer
     */
    public static boolean isInteger(final String value) {
        return NumberUtils.isDigits(value);
    }

    /**
     * @return true for any number, including signed and scientific notation
     */
    public static boolean isNumber(final String value) {
        return NumberUtils.isCreatable(value);
    }

    /**
     * @return true for a comma separated list of non-negative integers, optionally with a trailing comma
     */
    public static boolean isIntegerList(final String value) {
        final String stripped = StringUtils.removeEnd(value, ",");
        if (stripped.isEmpty()) {
            return false;
        }
        for (final String item : LIST_SPLITTER.split(stripped)) {
            if (!isInteger(item)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true for the strand values {@code +}, {@code -} and {@code .}
     */
    public static boolean isStrand(final String value) {
        return "+".equals(value) || "-".equals(value) || ".".equals(value);
    }

    /**
     * Parses a non-negative integer column.
     * @throws UserException.MalformedLine if the value is not an integer
     */
    public static int parseInteger(final List<String> columns, final int index, final String columnName,
                                   final int lineNumber, final String line) {
        return parseInteger(columns.get(index), columnName + " in column " + (index + 1), lineNumber, line);
    }

    /**
     * Parses a non-negative integer value.
     * @throws UserException.MalformedLine if the value is not an integer
     */
    public static int parseInteger(final String value, final String columnName, final int lineNumber, final String line) {
        if (!isInteger(value)) {
            throw new UserException.MalformedLine(lineNumber, line,
                    String.format("%s must be a non-negative integer but was '%s'", columnName, value));
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new UserException.MalformedLine(lineNumber, line, columnName + " is out of range: " + value, e);
        }
    }

    /**
     * Parses a numeric column, returning {@code null} for an empty or {@code .} value.
     * @throws UserException.MalformedLine if the value is not a number
     */
    public static Double parseOptionalDouble(final String value, final String columnName,
                                             final int lineNumber, final String line) {
        if (value == null || value.isEmpty() || ".".equals(value)) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (final NumberFormatException e) {
            throw new UserException.MalformedLine(lineNumber, line, columnName + " must be numeric but was '" + value + "'", e);
        }
    }

    /**
     * Parses a comma separated integer list. One trailing comma is tolerated, every other element must be an integer.
     * @throws UserException.MalformedLine if an element is not an integer
     */
    public static List<Integer> parseIntegerList(final String value, final String columnName,
                                                 final int lineNumber, final String line) {
        final String stripped = StringUtils.removeEnd(value, ",");
        final List<Integer> result = new ArrayList<>();
        if (stripped.isEmpty()) {
            return result;
        }
        for (final String item : LIST_SPLITTER.split(stripped)) {
            if (!isInteger(item)) {
                throw new UserException.MalformedLine(lineNumber, line,
                        String.format("%s must be a comma separated list of integers but was '%s'", columnName, value));
            }
            try {
                result.add(Integer.parseInt(item));
            } catch (final NumberFormatException e) {
                throw new UserException.MalformedLine(lineNumber, line, columnName + " has an out of range value " + item, e);
            }
        }
        return result;
    }
}
