package com.sattline.lint.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Settings read from a TOML file. Fields left out of the file stay {@code null} so command line
 * options can tell "not configured" from an explicit value.
 */
public final class LintConfig {

    @JsonProperty("root")
    public String root;

    @JsonProperty("mode")
    public String mode;

    @JsonProperty("ignore_vendor")
    public Boolean ignoreVendor;

    @JsonProperty("scan_root_only")
    public Boolean scanRootOnly;

    @JsonProperty("programs_dir")
    public String programsDir;

    @JsonProperty("libs_dirs")
    public List<String> libsDirs;

    @JsonProperty("vendor_dir")
    public String vendorDir;

    @JsonProperty("strict")
    public Boolean strict;

    @JsonProperty("debug")
    public Boolean debug;

    public static LintConfig empty() {
        return new LintConfig();
    }
}
