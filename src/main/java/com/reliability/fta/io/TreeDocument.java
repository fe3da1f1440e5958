package com.reliability.fta.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import lombok.Data;

/**
 * POJO representation of a saved analysis: {@code {title, date, mode, tree}}.
 *
 * Gates and relations bind as plain strings and ids accept numbers; the
 * reader normalizes and validates after binding.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "title", "date", "mode", "tree" })
public final class TreeDocument {
    private String title, date, mode;
    private NodeDef tree;

    /** Definition of a single node and its owned subtree. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "id", "name", "type", "probability", "logicGate", "notes", "children", "links",
            "calculatedProbability" })
    public static final class NodeDef {
        private String id;
        // Absent means "Node_{id}", explicit null means empty
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private String name;
        private String type;
        // Absent means 1.0; explicit null does not coerce
        @JsonSetter(nulls = Nulls.FAIL)
        private Double probability;
        private String logicGate;
        private String notes;
        private List<NodeDef> children;
        private List<LinkDef> links;
        private Double calculatedProbability;
    }

    /** Definition of a cross-link. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class LinkDef {
        @JsonProperty("target_id")
        private String targetId;
        private String relation;

        public LinkDef() {
        }

        public LinkDef(String targetId, String relation) {
            this.targetId = targetId;
            this.relation = relation;
        }
    }
}
