package net.spookly.routeusage.model;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class PathRule {
    String path;
    BackendRef backend;
}
