package com.example.hookhub.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A single header line. Repeated names are kept as separate instances.
 */
@Value
public class HttpHeader {
    String name;
    String value;

    @JsonCreator
    public HttpHeader(@JsonProperty("name") String name, @JsonProperty("value") String value) {
        this.name = name;
        this.value = value;
    }
}
