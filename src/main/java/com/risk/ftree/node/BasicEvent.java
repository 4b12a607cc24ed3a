package com.risk.ftree.node;

import com.risk.ftree.api.Node;
import com.risk.ftree.api.NodeKind;
import com.risk.ftree.util.XmlText;

/**
 * Leaf node carrying a failure probability.
 *
 * <p>
 * The probability is expected in [0, 1] but is not validated here; model
 * validation belongs to the caller. It stays mutable so CCF adjustments can
 * update it in place without disturbing the node's identity or parents.
 *
 * <p>
 * Exports write the probability with {@link Double#toString(double)}: 0.01
 * stays {@code 0.01}, while 1e-5 becomes {@code 1.0E-5}. Both are valid
 * xsd:double lexical forms.
 */
public final class BasicEvent extends Node {
    private double probability;

    public BasicEvent(String name, double probability) {
        super(name);
        this.probability = probability;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BASIC_EVENT;
    }

    public double probability() {
        return probability;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    /** Produces the OpenPSA MEF XML definition of the basic event. */
    public String toXml() {
        return "<define-basic-event name=\"" + XmlText.escape(name()) + "\">\n"
                + "<float value=\"" + probability + "\"/>\n"
                + "</define-basic-event>\n";
    }

    /** Produces the shorthand definition of the basic event. */
    public String toShorthand() {
        return "p(" + name() + ") = " + probability + "\n";
    }
}
