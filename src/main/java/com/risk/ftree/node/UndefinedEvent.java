package com.risk.ftree.node;

import com.risk.ftree.api.Node;
import com.risk.ftree.api.NodeKind;

/**
 * A referenced event whose definition is not part of the model.
 * Gates export it as an untyped {@code <event name="..."/>} reference.
 */
public final class UndefinedEvent extends Node {

    public UndefinedEvent(String name) {
        super(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNDEFINED;
    }
}
