package com.morris.intent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.morris.core.parser.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IntentDispatcherTest {

    private IntentDispatcher dispatcher;
    private Session session;

    @BeforeEach
    void setUp() {
        dispatcher = IntentDispatcher.standard();
        session = new Session();
    }

    private IntentResult run(Verb verb, String target, String... kv) {
        return run(session, verb, target, kv);
    }

    private IntentResult run(Session s, Verb verb, String target, String... kv) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) params.put(kv[i], kv[i + 1]);
        return dispatcher.dispatch(s, Intent.of(verb, target, params));
    }

    private IntentResult set(String name, String value) {
        return run(Verb.SET, name, "value", value);
    }

    @Test
    void set_stores_and_propagates() {
        IntentResult a = set("a", "5");
        assertTrue(a.success);
        assertEquals("a = 5", a.message);
        assertEquals(Value.integer(5), a.value);

        assertEquals("b = 6", set("b", "a + 1").message);

        IntentResult again = set("a", "10");
        assertEquals(List.of("updated a, b"), again.details);
        assertEquals(Value.integer(11), session.value("b"));
    }

    @Test
    void declared_type_converts_the_value() {
        IntentResult r = run(Verb.SET, "n", "value", "3.7", "type", "int");
        assertEquals("n = 3", r.message);
        assertEquals(Value.integer(3), session.value("n"));
    }

    @Test
    void ensure_leaves_existing_variables_alone() {
        set("a", "1");
        IntentResult r = run(Verb.ENSURE, "a", "value", "2");
        assertEquals("a already exists", r.message);
        assertEquals(Value.integer(1), session.value("a"));

        assertEquals("c = 3", run(Verb.ENSURE, "c", "value", "3").message);
    }

    @Test
    void failures_carry_the_error_kind() {
        IntentResult parse = set("x", "y = 1");
        assertFalse(parse.success);
        assertTrue(parse.message.startsWith("Parse error: "), parse.message);
        assertTrue(parse.message.contains("use '=='"), parse.message);

        assertEquals("Evaluation error: Variable not found: nope", set("y", "nope + 1").message);

        set("a", "1");
        run(Verb.FREEZE, "a");
        assertTrue(set("a", "2").message.startsWith("Graph error: "));

        assertTrue(run(Verb.FORGE, null).message.startsWith("Transaction error: "));
        assertEquals("Invalid intent: set requires parameter 'value'", run(Verb.SET, "a").message);
        assertEquals("Invalid intent: Invalid variable name: 9lives", set("9lives", "1").message);
    }

    @Test
    void freeze_unfreeze_delete() {
        set("a", "1");
        assertEquals("Froze a", run(Verb.FREEZE, "a").message);
        assertFalse(run(Verb.DELETE, "a").success);
        assertEquals("Unfroze a", run(Verb.UNFREEZE, "a").message);
        assertEquals("Deleted a", run(Verb.DELETE, "a").message);
        assertFalse(session.environment().contains("a"));
    }

    @Test
    void show_and_env_describe_variables() {
        set("a", "1");
        set("b", "a + 1");

        IntentResult show = run(Verb.SHOW, "b");
        assertTrue(show.message.startsWith("b = 2"), show.message);
        assertTrue(show.details.contains("depends on: a"));
        assertTrue(run(Verb.SHOW, "a").details.contains("dependents: b"));

        IntentResult env = run(Verb.ENV, null);
        assertEquals("2 variable(s)", env.message);
        assertEquals(2, env.details.size());
    }

    @Test
    void transaction_verbs_buffer_and_commit() {
        set("a", "1");
        assertTrue(run(Verb.CRAFT, null, "name", "batch").message.startsWith("Crafting "));

        IntentResult staged = set("a", "2");
        assertTrue(staged.message.startsWith("Staged "), staged.message);
        assertEquals(Value.integer(1), session.environment().getValue("a"));

        String status = run(Verb.TRANSACTION, null).message;
        assertTrue(status.endsWith("Crafting (1 changes)"), status);
        assertEquals("Transaction looks safe", run(Verb.TEMPER, null).message);
        assertTrue(run(Verb.INSPECT, null).message.contains("Name: batch"));

        IntentResult forged = run(Verb.FORGE, null);
        assertEquals("Forged 1 change(s)", forged.message);
        assertEquals(List.of("a"), forged.details);
        assertEquals(Value.integer(2), session.value("a"));
        assertEquals("No active transaction", run(Verb.TRANSACTION, null).message);
        assertEquals("1 transaction(s)", run(Verb.HISTORY, null).message);
    }

    @Test
    void smelt_and_anneal_through_intents() {
        set("a", "1");
        run(Verb.CRAFT, null);
        set("a", "9");
        assertEquals("Smelted; changes discarded", run(Verb.SMELT, null).message);
        assertEquals(Value.integer(1), session.value("a"));

        run(Verb.CRAFT, null);
        set("p", "1");
        set("q", "2");
        IntentResult annealed = run(Verb.ANNEAL, null, "steps", "1");
        assertEquals("Annealed 1 change(s), 1 pending", annealed.message);
        assertEquals(Value.integer(1), session.value("p"));
        assertEquals("Quenched 1 change(s)", run(Verb.QUENCH, null).message);
        assertEquals(Value.integer(2), session.value("q"));
    }

    @Test
    void what_if_reports_predictions_without_writing() {
        set("a", "1");
        set("b", "a * 2");

        IntentResult r = run(Verb.WHAT_IF, null, "a", "5");
        assertEquals("2 variable(s) affected", r.message);
        assertTrue(r.details.contains("b: 2 -> 10 (recomputed)"), r.details.toString());
        assertEquals(Value.integer(1), session.value("a"));
        assertEquals(Value.integer(2), session.value("b"));

        assertEquals("2 variable(s) affected", run(Verb.WHAT_IF, "a", "value", "7").message);
        assertFalse(run(Verb.WHAT_IF, null).success);
    }

    @Test
    void writeout_renders_templates() {
        set("name", "\"World\"");
        IntentResult r = run(Verb.WRITEOUT, null, "template", "Hello $name, {1 + 1}!");
        assertEquals("Hello World, 2!", r.message);

        IntentResult withParam = run(Verb.WRITEOUT, null, "template", "Hi ${who}", "who", "Ann");
        assertEquals("Hi Ann", withParam.message);
    }

    @Test
    void derive_types_string_values() {
        set("s", "\"42\"");
        IntentResult r = run(Verb.DERIVE, "s");
        assertEquals(Value.integer(42), r.value);
        assertEquals(Value.integer(42), session.value("s"));

        set("t", "\"1\"");
        assertEquals(Value.floating(1.0), run(Verb.DERIVE, "t", "as", "float").value);

        set("w", "\"word\"");
        assertEquals("w unchanged: \"word\"", run(Verb.DERIVE, "w").message);
    }

    @Test
    void json_verbs_read_and_write_paths() {
        IntentResult parsed = run(Verb.PARSE_JSON, "j", "json", "{\"user\":{\"tags\":[\"x\",\"y\"]}}");
        assertTrue(parsed.success, parsed.message);
        assertEquals(Value.Type.JSON, session.value("j").type);

        assertEquals(Value.string("y"), run(Verb.JSON_GET, "j", "path", "user.tags.1").value);

        run(Verb.JSON_SET, "j", "path", "user.name", "value", "\"Ann\"");
        assertEquals(Value.string("Ann"), run(Verb.JSON_GET, "j", "path", "user.name").value);
        assertEquals(Value.Type.JSON, session.value("j").type);

        run(Verb.JSON_GET, "j", "path", "user.tags.0", "into", "first");
        assertEquals(Value.string("x"), session.value("first"));

        assertTrue(run(Verb.JSON_GET, "j", "path", "user.age").message
                .startsWith("Evaluation error: Path segment 'age' not found"));
        assertTrue(run(Verb.PARSE_JSON, "bad", "json", "{oops").message.startsWith("Evaluation error: Invalid JSON"));
    }

    @Test
    void to_json_and_from_json() {
        set("l", "[1, 2]");
        IntentResult json = run(Verb.TO_JSON, "l", "into", "lj");
        assertEquals(Value.Type.JSON, json.value.type);
        assertEquals("[1,2]", json.value.toString());

        run(Verb.FROM_JSON, "lj", "into", "back");
        assertEquals(Value.list(List.of(Value.integer(1), Value.integer(2))), session.value("back"));

        set("n", "3");
        assertTrue(run(Verb.FROM_JSON, "n").message.startsWith("Evaluation error: from-json requires"));
    }

    @Test
    void collection_ops_write_back() {
        set("l", "[1, 2]");
        run(Verb.COLLECTION, "l", "op", "push", "item", "3");
        assertEquals(Value.list(List.of(Value.integer(1), Value.integer(2), Value.integer(3))), session.value("l"));

        run(Verb.COLLECTION, "l", "op", "pop");
        assertEquals(Value.integer(2), run(Verb.COLLECTION, "l", "op", "len").value);
        assertEquals("Invalid intent: Unknown collection op: shuffle",
                run(Verb.COLLECTION, "l", "op", "shuffle").message);
    }

    @Test
    void dictionary_ops_write_back() {
        set("d", "{\"a\": 1}");
        run(Verb.DICTIONARY, "d", "op", "set", "key", "b", "value", "2");
        assertEquals(Value.bool(true), run(Verb.DICTIONARY, "d", "op", "has", "key", "b").value);
        assertEquals(Value.list(List.of(Value.string("a"), Value.string("b"))),
                run(Verb.DICTIONARY, "d", "op", "keys").value);

        run(Verb.DICTIONARY, "d", "op", "remove", "key", "a");
        assertEquals(Value.integer(1), run(Verb.DICTIONARY, "d", "op", "len").value);
        assertEquals(Value.integer(2), run(Verb.DICTIONARY, "d", "op", "get", "key", "b").value);
        assertEquals("Evaluation error: Key 'z' not found in dictionary",
                run(Verb.DICTIONARY, "d", "op", "get", "key", "z").message);
    }

    @Test
    void strategy_and_flush() {
        set("a", "1");
        set("b", "a + 1");
        assertEquals("Strategy Lazy", run(Verb.STRATEGY, null, "mode", "lazy").message);

        IntentResult queued = set("a", "2");
        assertEquals(List.of("queued a"), queued.details);
        assertEquals(Value.integer(2), session.value("b"));

        assertEquals("Flushed: updated a, b", run(Verb.FLUSH, null).message);
        assertEquals(Value.integer(3), session.value("b"));
        assertEquals("Nothing queued", run(Verb.FLUSH, null).message);
        assertEquals("Strategy Lazy", run(Verb.STRATEGY, null).message);
        assertEquals("Strategy Lazy", run(Verb.PROPAGATION, null).message);
    }

    @Test
    void save_and_load_move_state_between_sessions() {
        set("a", "1");
        set("b", "a + 1");
        run(Verb.FREEZE, "a");

        IntentResult saved = run(Verb.SAVE, null);
        assertEquals("Saved 2 variable(s)", saved.message);

        Session other = new Session();
        IntentResult loaded = run(other, Verb.LOAD, null, "json", saved.value.asString());
        assertEquals("Loaded 2 variable(s)", loaded.message);
        assertEquals(Value.integer(2), other.value("b"));
        assertTrue(other.variable("a").isConstant());
        assertTrue(other.variable("b").isComputed());
        assertFalse(run(other, Verb.SET, "a", "value", "5").success);
    }

    @Test
    void intent_json_form() {
        Intent i = Intent.fromJson("{\"verb\":\"set\",\"target\":\"a\",\"params\":{\"value\":5}}");
        assertEquals(Verb.SET, i.verb());
        assertEquals("a", i.target());
        assertEquals("5", i.param("value"));
        assertEquals("a = 5", dispatcher.dispatch(session, i).message);

        assertThrows(IllegalArgumentException.class, () -> Intent.fromJson("[1]"));
        assertThrows(IllegalArgumentException.class,
                () -> Intent.fromJson("{\"verb\":\"set\",\"params\":[1]}"));
    }

    @Test
    void verb_keywords() {
        assertEquals(Verb.WHAT_IF, Verb.fromKeyword("what_if"));
        assertEquals(Verb.PARSE_JSON, Verb.fromKeyword(" Parse-JSON "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Verb.fromKeyword("jump"));
        assertEquals("Unknown verb: jump", e.getMessage());
    }

    @Test
    void handlers_register_once() {
        IntentDispatcher d = new IntentDispatcher();
        d.register(Verb.SET, (s, i) -> IntentResult.ok("one"));
        assertThrows(IllegalStateException.class, () -> d.register(Verb.SET, (s, i) -> IntentResult.ok("two")));
        assertEquals("No handler for verb: env", d.dispatch(session, Intent.of(Verb.ENV)).message);
        assertTrue(IntentDispatcher.standard().verbs().containsAll(List.of(Verb.values())));
    }
}
