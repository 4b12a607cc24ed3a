package com.risk.ftree.node;

import com.risk.ftree.api.CcfModel;
import com.risk.ftree.util.XmlText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Group of basic events sharing a common-cause failure model.
 *
 * <p>
 * The group is not part of the gate graph: it only references its member
 * basic events. Membership is expected to be exclusive (a basic event in at
 * most one group) but is not enforced here.
 *
 * <p>
 * Factors are per-level multipliers consumed from level 2; level 1 is
 * implicit. Probability and factors are written with
 * {@link Double#toString(double)}, as for {@link BasicEvent}.
 */
public final class CcfGroup {
    private final String name;
    private final List<BasicEvent> members = new ArrayList<>();
    private Double probability;
    private CcfModel model;
    private List<Double> factors;

    public CcfGroup(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public void addMember(BasicEvent member) {
        members.add(Objects.requireNonNull(member, "member"));
    }

    public List<BasicEvent> members() {
        return Collections.unmodifiableList(members);
    }

    /** Baseline failure probability of the group; null until set. */
    public Double probability() {
        return probability;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    public CcfModel model() {
        return model;
    }

    public void setModel(CcfModel model) {
        this.model = model;
    }

    /** Factors from level 2 upwards; null until set. */
    public List<Double> factors() {
        return factors;
    }

    public void setFactors(List<Double> factors) {
        this.factors = List.copyOf(factors);
    }

    /**
     * Produces the OpenPSA MEF XML definition of the CCF group.
     *
     * @throws IllegalStateException if the model is not MGL, or the
     *                               probability or factors are missing.
     */
    public String toXml() {
        if (model != CcfModel.MGL)
            throw new IllegalStateException("CCF group " + name + ": unsupported model " + model);
        if (probability == null || factors == null)
            throw new IllegalStateException("CCF group " + name + " is missing its probability or factors");

        StringBuilder sb = new StringBuilder(256);
        sb.append("<define-CCF-group name=\"").append(XmlText.escape(name)).append("\" model=\"")
                .append(model.token()).append("\">\n<members>\n");
        for (BasicEvent member : members)
            sb.append("<basic-event name=\"").append(XmlText.escape(member.name())).append("\"/>\n");
        sb.append("</members>\n<distribution>\n<float value=\"").append(probability.doubleValue())
                .append("\"/>\n</distribution>\n<factors>\n");
        int level = 2;
        for (double factor : factors) {
            sb.append("<factor level=\"").append(level++).append("\">\n")
                    .append("<float value=\"").append(factor).append("\"/>\n</factor>\n");
        }
        return sb.append("</factors>\n</define-CCF-group>\n").toString();
    }

    @Override
    public String toString() {
        return "CcfGroup(" + name + ")";
    }
}
