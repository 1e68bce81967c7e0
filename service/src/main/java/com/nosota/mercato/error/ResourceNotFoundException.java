package com.nosota.mercato.error;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends MarketplaceException {

    private final String resource;
    private final Object id;

    public ResourceNotFoundException(String resource, Object id) {
        super(String.format("%s not found: %s", resource, id));
        this.resource = resource;
        this.id = id;
    }
}
