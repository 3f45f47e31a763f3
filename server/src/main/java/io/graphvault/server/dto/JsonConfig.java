package io.graphvault.server.dto;

/**
 * Optional JSON config file ({@code --config}). Unset fields keep their defaults;
 * CLI flags override anything set here.
 */
public class JsonConfig {
    public String snapshotDir;
    public Integer maxRetained;
    public Integer httpPort;
    public String neo4jUri;
    public String neo4jUser;
    public String neo4jPassword;
    public String naturalKey;
    public Long minNewNodes;
    public Long minNewRelationships;
    public Double percentGrowth;
}
