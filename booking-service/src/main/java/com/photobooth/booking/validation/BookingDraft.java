package com.photobooth.booking.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loosely typed booking form as submitted by a client. Several fields have aliases
 * ({@code fullName|firstName+lastName|name}, {@code durationMinutes|duration}, ...);
 * the accessors resolve them in priority order and return the raw value untouched.
 */
public class BookingDraft {

    private final Map<String, Object> fields;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public BookingDraft(Map<String, Object> fields) {
        this.fields = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
    }

    public static BookingDraft of(Map<String, Object> fields) {
        return new BookingDraft(fields);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public Object fullName() {
        return fields.get("fullName");
    }

    public Object firstName() {
        return fields.get("firstName");
    }

    public Object lastName() {
        return fields.get("lastName");
    }

    public Object name() {
        return fields.get("name");
    }

    public Object email() {
        return fields.get("email");
    }

    public Object phone() {
        return fields.get("phone");
    }

    public Object start() {
        return fields.get("start");
    }

    public Object end() {
        return fields.get("end");
    }

    public Object date() {
        return fields.get("date");
    }

    public Object time() {
        return fields.get("time");
    }

    public Object duration() {
        return firstPresent("durationMinutes", "duration");
    }

    public Object guests() {
        return firstPresent("guests", "guestCount");
    }

    public Object packageId() {
        return fields.get("packageId");
    }

    public Object packageName() {
        return fields.get("packageName");
    }

    public Object venue() {
        return fields.get("venue");
    }

    public Object address() {
        return fields.get("address");
    }

    public Object notes() {
        return fields.get("notes");
    }

    public Object terms() {
        return firstPresent("termsAccepted", "agreeToTerms");
    }

    public Object customer() {
        return fields.get("customer");
    }

    public Object price() {
        return fields.get("price");
    }

    public Object status() {
        return fields.get("status");
    }

    public Object statusReason() {
        return fields.get("statusReason");
    }

    private Object firstPresent(String key, String alias) {
        Object value = fields.get(key);
        return value != null ? value : fields.get(alias);
    }
}
