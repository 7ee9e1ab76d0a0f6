package com.morris.intent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.morris.core.transaction.ScenarioOutcome;
import com.morris.core.transaction.Transaction;
import com.morris.core.transaction.TransactionEngine;
import com.morris.core.transaction.TransactionLogEntry;
import com.morris.core.transaction.TransactionPreview;

/**
 * craft, forge, smelt, temper, inspect, anneal, quench, transaction, what-if, history.
 */
public final class TransactionVerbs {

    private TransactionVerbs() {}

    public static void register(IntentDispatcher d) {
        d.register(Verb.CRAFT, (s, i) -> {
            Transaction tx = s.transactions().craft(i.param("name", i.target()));
            return IntentResult.ok("Crafting " + tx.id() + (tx.name() == null ? "" : " (" + tx.name() + ")"));
        });
        d.register(Verb.FORGE, (s, i) -> {
            List<String> applied = s.transactions().forge();
            return IntentResult.ok("Forged " + applied.size() + " change(s)", applied);
        });
        d.register(Verb.SMELT, (s, i) -> {
            s.transactions().smelt();
            return IntentResult.ok("Smelted; changes discarded");
        });
        d.register(Verb.TEMPER, TransactionVerbs::temper);
        d.register(Verb.INSPECT, (s, i) -> {
            TransactionEngine t = s.transactions();
            return IntentResult.ok(t.inspect().describe(s.config().clock().instant()).trim());
        });
        d.register(Verb.ANNEAL, (s, i) -> {
            List<String> applied = s.transactions().anneal(i.intParam("steps", 1));
            int left = s.transactions().active().changeCount();
            return IntentResult.ok("Annealed " + applied.size() + " change(s), " + left + " pending", applied);
        });
        d.register(Verb.QUENCH, (s, i) -> {
            List<String> applied = s.transactions().quench();
            return IntentResult.ok("Quenched " + applied.size() + " change(s)", applied);
        });
        d.register(Verb.TRANSACTION, (s, i) -> IntentResult.ok(s.transactions().status()));
        d.register(Verb.WHAT_IF, TransactionVerbs::whatIf);
        d.register(Verb.HISTORY, (s, i) -> {
            List<String> lines = new ArrayList<>();
            for (TransactionLogEntry e : s.transactions().history(i.intParam("limit", 10))) lines.add(e.toString());
            return IntentResult.ok(lines.size() + " transaction(s)", lines);
        });
    }

    static IntentResult temper(Session s, Intent i) {
        TransactionPreview p = s.transactions().temper();
        List<String> lines = new ArrayList<>();
        for (String line : p.render().split("\n")) {
            if (!line.isEmpty()) lines.add(line.trim());
        }
        return IntentResult.ok(p.isSafe() ? "Transaction looks safe" : "Transaction has conflicts", lines);
    }

    /** Every parameter is a hypothetical {@code name = expression}. */
    static IntentResult whatIf(Session s, Intent i) {
        Map<String, String> texts = new LinkedHashMap<>(i.params());
        if (i.target() != null && texts.containsKey("value")) {
            texts.put(i.target(), texts.remove("value"));
        }
        if (texts.isEmpty()) throw new IllegalArgumentException("what-if requires at least one hypothetical value");
        ScenarioOutcome o = s.transactions().whatIf(s.scenario(texts));
        List<String> lines = new ArrayList<>();
        for (String line : o.render().split("\n")) {
            if (!line.isEmpty()) lines.add(line.trim());
        }
        return IntentResult.ok(o.affected.size() + " variable(s) affected", lines);
    }
}
