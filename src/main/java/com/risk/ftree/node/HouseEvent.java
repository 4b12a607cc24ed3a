package com.risk.ftree.node;

import com.risk.ftree.api.Node;
import com.risk.ftree.api.NodeKind;
import com.risk.ftree.util.XmlText;

/**
 * Leaf node with a fixed boolean state, used as a model constant or switch.
 */
public final class HouseEvent extends Node {
    private final boolean state;

    public HouseEvent(String name, boolean state) {
        super(name);
        this.state = state;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HOUSE_EVENT;
    }

    public boolean state() {
        return state;
    }

    /** The MEF constant token, "true" or "false". */
    public String stateToken() {
        return Boolean.toString(state);
    }

    /** Produces the OpenPSA MEF XML definition of the house event. */
    public String toXml() {
        return "<define-house-event name=\"" + XmlText.escape(name()) + "\">\n"
                + "<constant value=\"" + stateToken() + "\"/>\n"
                + "</define-house-event>\n";
    }

    /** Produces the shorthand definition of the house event. */
    public String toShorthand() {
        return "s(" + name() + ") = " + stateToken() + "\n";
    }
}
