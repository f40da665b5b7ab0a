package com.elevation.catalog.config;

import java.util.Set;

/**
 * Options shared by the item and tree builders: publication policy and href bases.
 */
public class CatalogOptions {

    public static final String DEFAULT_BASE_URL = "https://pgc-opendata-dems.s3.us-west-2.amazonaws.com";
    public static final String DEFAULT_S3_BASE_URL = "s3://pgc-opendata-dems";
    public static final String DEFAULT_ROOT_CATALOG_FILE = "pgc-data-stac.json";

    private final String baseUrl;
    private final String s3BaseUrl;
    private final String rootCatalogFile;
    private final String rootCatalogId;
    private final String rootCatalogTitle;
    private final String itemStacVersion;
    private final String nodeStacVersion;
    private final Set<String> publicLicenseClasses;
    private final String license;
    private final String constellation;

    private CatalogOptions(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.s3BaseUrl = builder.s3BaseUrl;
        this.rootCatalogFile = builder.rootCatalogFile;
        this.rootCatalogId = builder.rootCatalogId;
        this.rootCatalogTitle = builder.rootCatalogTitle;
        this.itemStacVersion = builder.itemStacVersion;
        this.nodeStacVersion = builder.nodeStacVersion;
        this.publicLicenseClasses = Set.copyOf(builder.publicLicenseClasses);
        this.license = builder.license;
        this.constellation = builder.constellation;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getS3BaseUrl() {
        return s3BaseUrl;
    }

    public String getRootCatalogFile() {
        return rootCatalogFile;
    }

    public String getRootCatalogId() {
        return rootCatalogId;
    }

    public String getRootCatalogTitle() {
        return rootCatalogTitle;
    }

    public String getItemStacVersion() {
        return itemStacVersion;
    }

    public String getNodeStacVersion() {
        return nodeStacVersion;
    }

    public Set<String> getPublicLicenseClasses() {
        return publicLicenseClasses;
    }

    public String getLicense() {
        return license;
    }

    public String getConstellation() {
        return constellation;
    }

    public boolean isPublic(String licenseClass) {
        return licenseClass != null && publicLicenseClasses.contains(licenseClass);
    }

    public static CatalogOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String s3BaseUrl = DEFAULT_S3_BASE_URL;
        private String rootCatalogFile = DEFAULT_ROOT_CATALOG_FILE;
        private String rootCatalogId = "pgc-data-stac";
        private String rootCatalogTitle = "PGC Data Catalog";
        private String itemStacVersion = "1.1.0";
        private String nodeStacVersion = "1.1.0";
        private Set<String> publicLicenseClasses = Set.of("public");
        private String license = "CC-BY-4.0";
        private String constellation = "maxar";

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = trimSlash(requireText(baseUrl, "baseUrl"));
            return this;
        }

        public Builder s3BaseUrl(String s3BaseUrl) {
            this.s3BaseUrl = trimSlash(requireText(s3BaseUrl, "s3BaseUrl"));
            return this;
        }

        public Builder rootCatalogFile(String rootCatalogFile) {
            requireText(rootCatalogFile, "rootCatalogFile");
            if (!rootCatalogFile.endsWith(".json") || rootCatalogFile.contains("/")) {
                throw new IllegalArgumentException("rootCatalogFile must be a plain .json file name");
            }
            this.rootCatalogFile = rootCatalogFile;
            return this;
        }

        public Builder rootCatalog(String id, String title) {
            this.rootCatalogId = requireText(id, "rootCatalogId");
            this.rootCatalogTitle = requireText(title, "rootCatalogTitle");
            return this;
        }

        public Builder itemStacVersion(String itemStacVersion) {
            this.itemStacVersion = requireText(itemStacVersion, "itemStacVersion");
            return this;
        }

        public Builder nodeStacVersion(String nodeStacVersion) {
            this.nodeStacVersion = requireText(nodeStacVersion, "nodeStacVersion");
            return this;
        }

        public Builder publicLicenseClasses(Set<String> publicLicenseClasses) {
            if (publicLicenseClasses == null || publicLicenseClasses.isEmpty()) {
                throw new IllegalArgumentException("publicLicenseClasses must not be empty");
            }
            this.publicLicenseClasses = publicLicenseClasses;
            return this;
        }

        public Builder license(String license) {
            this.license = requireText(license, "license");
            return this;
        }

        public Builder constellation(String constellation) {
            this.constellation = constellation;
            return this;
        }

        public CatalogOptions build() {
            return new CatalogOptions(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value;
        }

        private static String trimSlash(String url) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }
}
