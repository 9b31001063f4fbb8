package tech.homeport.secrets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SecretEncoding {
    PLAIN("plain"),
    BASE64("base64");

    private final String value;

    SecretEncoding(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SecretEncoding parse(String value) {
        return "base64".equals(value) ? BASE64 : PLAIN;
    }
}
