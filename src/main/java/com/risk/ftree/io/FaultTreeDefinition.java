package com.risk.ftree.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a fault tree model.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FaultTreeDefinition {
    private FaultTreeInfo faultTree;

    /** The model: name plus gate, event and CCF group definitions. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class FaultTreeInfo {
        private String name;
        private List<GateDef> gates;
        private List<BasicEventDef> basicEvents;
        private List<HouseEventDef> houseEvents;
        private List<CcfGroupDef> ccfGroups;
    }

    /** Definition of a gate; arguments are node names. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GateDef {
        private String name, operator;
        private Integer k;
        private List<String> arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BasicEventDef {
        private String name;
        private Double probability;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class HouseEventDef {
        private String name;
        private Boolean state;
    }

    /** Definition of a CCF group; members are basic event names. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CcfGroupDef {
        private String name, model;
        private Double probability;
        private List<String> members;
        private List<Double> factors;
    }
}
