package com.morris.intent;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public enum Verb {
    // variables
    SET("set"),
    ENSURE("ensure"),
    WRITEOUT("writeout"),
    DERIVE("derive"),
    FREEZE("freeze"),
    UNFREEZE("unfreeze"),
    DELETE("delete"),
    SHOW("show"),
    ENV("env"),

    // transactions
    CRAFT("craft"),
    FORGE("forge"),
    SMELT("smelt"),
    TEMPER("temper"),
    INSPECT("inspect"),
    ANNEAL("anneal"),
    QUENCH("quench"),
    TRANSACTION("transaction"),
    WHAT_IF("what-if"),
    HISTORY("history"),

    // propagation
    PROPAGATION("propagation"),
    STRATEGY("strategy"),
    FLUSH("flush"),
    GRAPH("graph"),

    // json
    PARSE_JSON("parse-json"),
    TO_JSON("to-json"),
    FROM_JSON("from-json"),
    JSON_GET("json-get"),
    JSON_SET("json-set"),

    // collections
    COLLECTION("collection"),
    DICTIONARY("dictionary"),

    // persistence
    SAVE("save"),
    LOAD("load");

    private static final Map<String, Verb> BY_KEYWORD = new HashMap<>();

    static {
        for (Verb v : values()) BY_KEYWORD.put(v.keyword, v);
    }

    public final String keyword;

    Verb(String keyword) {
        this.keyword = keyword;
    }

    /** Looks up a verb by its keyword; underscores are accepted in place of dashes. */
    public static Verb fromKeyword(String keyword) {
        if (keyword == null) throw new IllegalArgumentException("Missing verb");
        Verb v = BY_KEYWORD.get(keyword.trim().toLowerCase(Locale.ROOT).replace('_', '-'));
        if (v == null) throw new IllegalArgumentException("Unknown verb: " + keyword);
        return v;
    }
}
