package com.unhuman.iconforge.model;

/**
 * Device family an icon slot belongs to, named as the asset catalog spells it
 */
public enum IconIdiom {
    IPHONE("iphone"),
    IPAD("ipad"),
    IOS_MARKETING("ios-marketing");

    private final String catalogName;

    IconIdiom(String catalogName) {
        this.catalogName = catalogName;
    }

    public String getCatalogName() {
        return catalogName;
    }

    @Override
    public String toString() {
        return catalogName;
    }
}
