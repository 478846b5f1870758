package com.flowgraph.analyzer.cfg;

import com.google.gson.annotations.SerializedName;

public enum CfgEdgeKind {
    @SerializedName("normal")    NORMAL("normal"),
    @SerializedName("true")      TRUE("true"),
    @SerializedName("false")     FALSE("false"),
    @SerializedName("back_edge") BACK_EDGE("back_edge"),
    @SerializedName("loop_exit") LOOP_EXIT("loop_exit"),
    @SerializedName("return")    RETURN("return");

    private final String wireName;

    CfgEdgeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
