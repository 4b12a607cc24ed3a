package com.risk.ftree.io;

import com.risk.ftree.FaultTree;
import com.risk.ftree.api.CcfModel;
import com.risk.ftree.api.Node;
import com.risk.ftree.api.Operator;
import com.risk.ftree.dsl.FaultTreeBuilder;
import com.risk.ftree.node.BasicEvent;
import com.risk.ftree.node.Gate;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link FaultTreeDefinition} into a {@link FaultTree}.
 *
 * <p>
 * Definitions may reference gates before they are declared, so compilation
 * runs in two passes: every event and gate is declared first, then gate
 * arguments are wired by name. A name that matches no declaration becomes an
 * {@link com.risk.ftree.node.UndefinedEvent}, shared by every gate that
 * references it.
 */
@Log4j2
public final class FaultTreeCompiler {

    /**
     * Compiles the definition into a fault tree.
     *
     * @throws IllegalArgumentException on missing fields, unknown operator or
     *                                  model tokens, duplicate names, or CCF
     *                                  members that are not basic events.
     * @throws IllegalStateException    if the gates contain a cycle or a gate
     *                                  lists the same argument twice.
     */
    public FaultTree compile(FaultTreeDefinition def) {
        FaultTreeDefinition.FaultTreeInfo info = def.getFaultTree();
        if (info == null)
            throw new IllegalArgumentException("Missing 'faultTree' key");
        if (info.getName() == null)
            throw new IllegalArgumentException("Fault tree definition has no name");
        FaultTreeBuilder builder = FaultTree.builder(info.getName());

        // 1. Declare events
        for (FaultTreeDefinition.BasicEventDef bd : orEmpty(info.getBasicEvents())) {
            if (bd.getProbability() == null)
                throw new IllegalArgumentException("Basic event " + bd.getName() + " has no probability");
            builder.basicEvent(bd.getName(), bd.getProbability());
        }
        for (FaultTreeDefinition.HouseEventDef hd : orEmpty(info.getHouseEvents())) {
            if (hd.getState() == null)
                throw new IllegalArgumentException("House event " + hd.getName() + " has no state");
            builder.houseEvent(hd.getName(), hd.getState());
        }

        // 2. Declare gates without arguments
        List<FaultTreeDefinition.GateDef> gateDefs = orEmpty(info.getGates());
        for (FaultTreeDefinition.GateDef gd : gateDefs) {
            Operator operator = Operator.fromString(gd.getOperator());
            if (operator.requiresThreshold()) {
                if (gd.getK() == null)
                    throw new IllegalArgumentException("Gate " + gd.getName() + " needs 'k' for atleast");
                builder.atleast(gd.getName(), gd.getK());
            } else {
                if (gd.getK() != null)
                    throw new IllegalArgumentException(
                            "Gate " + gd.getName() + ": 'k' is only valid for atleast");
                builder.gate(gd.getName(), operator);
            }
        }

        // 3. Wire arguments by name
        for (FaultTreeDefinition.GateDef gd : gateDefs) {
            Gate gate = builder.getNode(gd.getName());
            for (String argName : orEmpty(gd.getArguments())) {
                Node arg = builder.getNode(argName);
                if (arg == null) {
                    log.debug("Gate {} references undefined event {}", gd.getName(), argName);
                    arg = builder.undefinedEvent(argName);
                }
                gate.addArgument(arg);
            }
        }

        // 4. CCF groups over declared basic events
        for (FaultTreeDefinition.CcfGroupDef cd : orEmpty(info.getCcfGroups())) {
            if (cd.getProbability() == null)
                throw new IllegalArgumentException("CCF group " + cd.getName() + " has no probability");
            List<String> memberNames = orEmpty(cd.getMembers());
            BasicEvent[] members = new BasicEvent[memberNames.size()];
            for (int i = 0; i < members.length; i++) {
                if (!(builder.getNode(memberNames.get(i)) instanceof BasicEvent member))
                    throw new IllegalArgumentException(
                            "CCF group " + cd.getName() + " member is not a basic event: " + memberNames.get(i));
                members[i] = member;
            }
            builder.ccfGroup(cd.getName(), CcfModel.fromString(cd.getModel()), cd.getProbability(),
                    orEmpty(cd.getFactors()), members);
        }

        FaultTree tree = builder.build();
        log.debug("Compiled {}: {} gates, {} undefined events", tree.name(), tree.gates().size(),
                tree.undefinedEvents().size());
        return tree;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
