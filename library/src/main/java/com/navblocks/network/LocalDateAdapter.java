package com.navblocks.network;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Converts between {@link LocalDate} and the ISO date strings NAV uses on both
 * the OData and the SOAP surface. Values that don't parse are read as null.
 */
public class LocalDateAdapter implements JsonAdapter<LocalDate> {

    @Override
    public LocalDate deserialize(final JsonElement jsonElement) {
        if (jsonElement == null || !jsonElement.isJsonPrimitive())
            return null;

        return parse(jsonElement.getAsString());
    }

    @Override
    public JsonElement serialize(final LocalDate value) {
        return new JsonPrimitive(format(value));
    }

    /**
     * @param date The date to format. May be null.
     * @return The date as {@code yyyy-MM-dd}, or null for a null date.
     */
    public static String format(final LocalDate date) {
        return date == null ? null : date.toString();
    }

    /**
     * @param value The text to parse. May be null.
     * @return The parsed date, or null if the text is blank or not a date.
     */
    public static LocalDate parse(final String value) {
        if (value == null || value.trim().isEmpty())
            return null;

        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

}
