package com.opentoclose.client.common.apiclient.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Headers added to every request sent by an {@link com.opentoclose.client.common.apiclient.ApiClient}.
 */
@Getter
@Setter
public class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    /**
     * Adds a header and returns this configuration.
     *
     * @param name  the header name.
     * @param value the header value.
     *
     * @return this configuration.
     */
    public HeaderConfig add(String name, String value) {
        Header header = new Header();
        header.setName(name);
        header.setValue(value);
        headers.add(header);
        return this;
    }

    /**
     * Represents a single header with a name and a value.
     */
    @Getter
    @Setter
    public static class Header {

        private String name;
        private String value;
    }
}
