package com.containermgmt.streamagent.store;

import com.containermgmt.streamagent.exception.FatalStoreException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a file event payload onto the columns of the {@code files} table.
 * Missing fields get the scanner's defaults; present but malformed values fail
 * the batch as bad data.
 */
@Component
public class FilePayloadMapper {

    /** Payload-derived columns, in the order {@link #toColumnValues} returns them. */
    public static final List<String> COLUMNS = List.of(
            "path", "dir", "name", "ext", "file_type",
            "size", "fsize_du",
            "mtime", "atime", "ctime",
            "nlinks", "inode", "dev",
            "owner", "group_name", "uid", "gid", "file_mode",
            "algo", "hash");

    public List<Object> toColumnValues(String entityId, Map<String, Object> payload) {
        List<Object> values = new ArrayList<>(COLUMNS.size());

        values.add(getString(payload, "path"));
        values.add(orDefault(getString(payload, "dir"), ""));
        values.add(orDefault(getString(payload, "name"), ""));
        values.add(getString(payload, "ext"));
        values.add(orDefault(getString(payload, "type"), "file"));

        values.add(orDefault(getLong(entityId, payload, "size"), 0L));
        values.add(orDefault(getLong(entityId, payload, "fsize_du"), 0L));

        values.add(orDefault(getDouble(entityId, payload, "mtime"), 0.0d));
        values.add(orDefault(getDouble(entityId, payload, "atime"), 0.0d));
        values.add(orDefault(getDouble(entityId, payload, "ctime"), 0.0d));

        values.add(orDefault(getInteger(entityId, payload, "nlinks"), 1));
        values.add(getLong(entityId, payload, "inode"));
        values.add(getLong(entityId, payload, "dev"));

        values.add(getString(payload, "owner"));
        values.add(getString(payload, "group"));
        values.add(getInteger(entityId, payload, "uid"));
        values.add(getInteger(entityId, payload, "gid"));
        values.add(getInteger(entityId, payload, "mode"));

        values.add(getString(payload, "algo"));
        values.add(getString(payload, "hash"));

        return values;
    }

    // --- Helper methods ---

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private String getString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    private Long getLong(String entityId, Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        try {
            return toBigDecimal(value).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw malformed(entityId, key, value, e);
        }
    }

    private Integer getInteger(String entityId, Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        try {
            return toBigDecimal(value).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw malformed(entityId, key, value, e);
        }
    }

    private Double getDouble(String entityId, Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        try {
            return toBigDecimal(value).doubleValue();
        } catch (NumberFormatException e) {
            throw malformed(entityId, key, value, e);
        }
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number || value instanceof CharSequence) {
            return new BigDecimal(value.toString().trim());
        }
        throw new NumberFormatException("not a number: " + value.getClass().getSimpleName());
    }

    private static FatalStoreException malformed(String entityId, String key, Object value, Exception cause) {
        return new FatalStoreException(
                "Malformed payload for entity " + entityId + ": field '" + key + "' = " + value, cause);
    }
}
