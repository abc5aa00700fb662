package com.eyelevel.catalogingestion.common.apiclient.model;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Static headers added to every request of a client. Subclasses define which headers those are.
 */
@Getter
@Setter
public abstract class HeaderConfig {

    private List<Header> headers;

    @Getter
    @Setter
    public static class Header {

        private String name;
        private String value;
    }
}
