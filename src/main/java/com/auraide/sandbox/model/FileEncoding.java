package com.auraide.sandbox.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * How file content travels as text. {@code BINARY} content is carried base64-encoded
 * on text channels, like {@code BASE64}.
 */
public enum FileEncoding {

    UTF_8("utf-8"),
    BASE64("base64"),
    BINARY("binary");

    private final String wireName;

    FileEncoding(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FileEncoding fromWire(String value) {
        if (value == null) {
            return UTF_8;
        }
        for (FileEncoding encoding : values()) {
            if (encoding.wireName.equalsIgnoreCase(value) || encoding.name().equalsIgnoreCase(value)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unknown encoding: " + value);
    }

    public byte[] decode(String content) {
        if (content == null) {
            return new byte[0];
        }
        return this == UTF_8
                ? content.getBytes(StandardCharsets.UTF_8)
                : Base64.getDecoder().decode(content);
    }

    public String encode(byte[] content) {
        return this == UTF_8
                ? new String(content, StandardCharsets.UTF_8)
                : Base64.getEncoder().encodeToString(content);
    }
}
