package com.morris.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morris.core.MorrisConfig;
import com.morris.core.error.MorrisError;
import com.morris.core.parser.ValueCodec;
import com.morris.debug.Debug;
import com.morris.intent.Intent;
import com.morris.intent.IntentDispatcher;
import com.morris.intent.IntentResult;
import com.morris.intent.Session;
import com.morris.persistence.StateStore;

/**
 * Line-oriented JSON front end. One intent per input line, one response per output line.
 *
 * Request:  {"verb":"set","target":"a","params":{"value":"5"}}
 * Response: {"ok":true,"message":"a = 5","value":{"type":"int","value":5},"details":[]}
 *
 * Flags:
 *   --config=/path/morris.properties   (default: morris.properties on the classpath, if any)
 *   --state=/path/state.json           (loaded at start when present, saved on EOF)
 */
public final class MorrisCli {

    private static final String TAG = "cli";

    private final ObjectMapper om = ValueCodec.mapper();
    private final Session session;
    private final IntentDispatcher dispatcher;

    public MorrisCli(Session session, IntentDispatcher dispatcher) {
        this.session = session;
        this.dispatcher = dispatcher;
    }

    public static void main(String[] args) throws IOException {
        Debug.useSlf4j();
        Map<String, String> flags = parseArgs(args);

        MorrisConfig config = MorrisConfig.fromProperties(loadProperties(flags.get("config")));
        MorrisCli cli = new MorrisCli(new Session(config), IntentDispatcher.standard());

        Path state = flags.containsKey("state") ? Path.of(flags.get("state")) : null;
        if (state != null && Files.exists(state)) {
            StateStore.fromJson(Files.readString(state, StandardCharsets.UTF_8)).restoreInto(cli.session);
        }

        cli.run(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);

        if (state != null) {
            Files.writeString(state, new StateStore().capture(cli.session.environment()).toJson(),
                    StandardCharsets.UTF_8);
            Debug.get().i(TAG, "State written to " + state);
        }
    }

    /** Processes lines until EOF. Blank lines and lines starting with '#' are ignored. */
    public void run(Reader input, PrintStream out) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            out.println(om.writeValueAsString(process(trimmed)));
            out.flush();
        }
    }

    public ObjectNode process(String line) {
        IntentResult result;
        try {
            result = dispatcher.dispatch(session, Intent.fromJson(line));
        } catch (MorrisError e) {
            result = IntentResult.failure(e.describe());
        } catch (IllegalArgumentException e) {
            result = IntentResult.failure("Invalid intent: " + e.getMessage());
        }
        return toJson(result);
    }

    ObjectNode toJson(IntentResult r) {
        ObjectNode resp = om.createObjectNode();
        resp.put("ok", r.success);
        resp.put("message", r.message);
        if (r.value != null) resp.set("value", ValueCodec.toTagged(r.value));
        ArrayNode details = resp.putArray("details");
        for (String d : r.details) details.add(d);
        return resp;
    }

    public Session session() {
        return session;
    }

    private static Properties loadProperties(String path) throws IOException {
        Properties props = new Properties();
        if (path != null) {
            try (Reader r = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
                props.load(r);
            }
            return props;
        }
        try (InputStream in = MorrisCli.class.getClassLoader().getResourceAsStream("morris.properties")) {
            if (in != null) props.load(in);
        }
        return props;
    }

    /**
     * Minimal arg parser:
     *   --config=/path/morris.properties --state=/path/state.json
     */
    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }
}
