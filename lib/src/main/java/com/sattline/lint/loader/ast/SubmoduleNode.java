package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

public final class SubmoduleNode {
    private final String name;
    private final TypeReference type;
    private final List<ParameterConnectionNode> connections;
    private final SourceLocation location;

    public SubmoduleNode(
            String name,
            TypeReference type,
            List<ParameterConnectionNode> connections,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.connections = List.copyOf(connections);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public TypeReference getType() {
        return type;
    }

    public List<ParameterConnectionNode> getConnections() {
        return connections;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
