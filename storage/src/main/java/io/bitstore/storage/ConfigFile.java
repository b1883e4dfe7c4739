package io.bitstore.storage;

/** JSON shape of .bit/config.json. Absent fields keep their defaults. */
public class ConfigFile {
    public Integer maxChainLength;
    public String compression;
}
