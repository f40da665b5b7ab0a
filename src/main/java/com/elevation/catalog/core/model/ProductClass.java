package com.elevation.catalog.core.model;

/**
 * Classes of elevation products tracked by the catalog.
 * Each class is unified and resolved independently of the others.
 */
public enum ProductClass {
    SCENE("scenes"),
    STRIP("strips"),
    MOSAIC("mosaics");

    private final String kind;

    ProductClass(String kind) {
        this.kind = kind;
    }

    /**
     * Token used for this class in collection ids and catalog paths.
     */
    public String getKind() {
        return kind;
    }

    public static ProductClass fromKind(String kind) {
        for (ProductClass productClass : values()) {
            if (productClass.kind.equalsIgnoreCase(kind)) {
                return productClass;
            }
        }
        throw new IllegalArgumentException("Unknown product kind: " + kind);
    }
}
