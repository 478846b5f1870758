package com.flowgraph.analyzer.cfg;

import com.google.gson.annotations.SerializedName;

public enum CfgNodeKind {
    @SerializedName("entry")     ENTRY("entry"),
    @SerializedName("exit")      EXIT("exit"),
    @SerializedName("statement") STATEMENT("statement"),
    @SerializedName("branch")    BRANCH("branch"),
    @SerializedName("loop")      LOOP("loop"),
    @SerializedName("return")    RETURN("return");

    private final String wireName;

    CfgNodeKind(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in graph attributes and JSON. */
    public String wireName() {
        return wireName;
    }

    /** Decision nodes counted by cyclomatic complexity. */
    public boolean isDecision() {
        return this == BRANCH || this == LOOP;
    }
}
