package com.morris.core.parser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.morris.core.error.EvaluationError;
import com.morris.core.error.ParseError;

/**
 * Text interpolation used by string literals and writeout.
 *
 * Forms:
 *   {expr}            evaluate expr against the environment
 *   $name, ${name}    parameter first, then environment
 *   {{ }}             literal braces
 *   \{ \} \$ \\       escaped characters
 *
 * A name that cannot be resolved is an error; nothing is ever silently replaced by "".
 */
public final class Template {

    private Template() {}

    public static boolean isTemplate(String text) {
        return text.indexOf('$') >= 0 || text.indexOf('{') >= 0 || text.indexOf('}') >= 0;
    }

    public static String render(String template, VariableResolver env) {
        return render(template, Collections.emptyMap(), env);
    }

    public static String render(String template, Map<String, String> params, VariableResolver env) {
        return render(template, params, env, Builtins.standard());
    }

    /** Renders with {@code builtins} serving the function calls inside {@code {expr}} parts. */
    public static String render(String template, Map<String, String> params, VariableResolver env, Builtins builtins) {
        Map<String, String> p = params == null ? Collections.emptyMap() : params;
        VariableResolver resolver = env == null ? VariableResolver.empty() : env;

        StringBuilder out = new StringBuilder(template.length());
        int n = template.length();
        int i = 0;
        while (i < n) {
            char c = template.charAt(i);
            char next = i + 1 < n ? template.charAt(i + 1) : '\0';

            if (c == '\\' && "${}\\".indexOf(next) >= 0 && i + 1 < n) {
                out.append(next);
                i += 2;
                continue;
            }

            if (c == '{') {
                if (next == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = closingBrace(template, i);
                String content = template.substring(i + 1, close).trim();
                if (content.isEmpty()) throw new ParseError("Empty expression in {}");

                String param = p.get(content);
                if (param != null) {
                    out.append(param);
                } else {
                    out.append(new Interpreter(resolver, builtins).evaluate(Parser.parse(content)).toString());
                }
                i = close + 1;
                continue;
            }

            if (c == '}' && next == '}') {
                out.append('}');
                i += 2;
                continue;
            }

            if (c == '$' && next == '{') {
                int close = template.indexOf('}', i + 2);
                if (close < 0) throw new ParseError("Unclosed ${ in template");
                String name = template.substring(i + 2, close).trim();
                if (name.isEmpty()) throw new ParseError("Empty parameter name in ${}");
                out.append(lookup(name, p, resolver));
                i = close + 1;
                continue;
            }

            if (c == '$' && isNameStart(next)) {
                int end = i + 1;
                while (end < n && isNamePart(template.charAt(end))) end++;
                out.append(lookup(template.substring(i + 1, end), p, resolver));
                i = end;
                continue;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Names a template would read from the environment. Parameters are not known here,
     * so {@code $name} references are reported as well.
     */
    public static Set<String> referencedNames(String template) {
        Set<String> names = new LinkedHashSet<>();
        int n = template.length();
        int i = 0;
        while (i < n) {
            char c = template.charAt(i);
            char next = i + 1 < n ? template.charAt(i + 1) : '\0';

            if (c == '\\' && "${}\\".indexOf(next) >= 0 && i + 1 < n) {
                i += 2;
            } else if (c == '{' && next == '{') {
                i += 2;
            } else if (c == '{') {
                int close = closingBrace(template, i);
                String content = template.substring(i + 1, close).trim();
                if (content.isEmpty()) throw new ParseError("Empty expression in {}");
                names.addAll(VariableCollector.collect(Parser.parse(content)));
                i = close + 1;
            } else if (c == '$' && next == '{') {
                int close = template.indexOf('}', i + 2);
                if (close < 0) throw new ParseError("Unclosed ${ in template");
                names.add(template.substring(i + 2, close).trim());
                i = close + 1;
            } else if (c == '$' && isNameStart(next)) {
                int end = i + 1;
                while (end < n && isNamePart(template.charAt(end))) end++;
                names.add(template.substring(i + 1, end));
                i = end;
            } else {
                i++;
            }
        }
        return names;
    }

    private static String lookup(String name, Map<String, String> params, VariableResolver env) {
        String param = params.get(name);
        if (param != null) return param;
        Value v = env.lookup(name);
        if (v == null) throw new EvaluationError("Parameter '" + name + "' not provided");
        return v.toString();
    }

    /** Index of the '}' closing the '{' at {@code open}, honouring nesting and quotes. */
    private static int closingBrace(String template, int open) {
        int depth = 1;
        boolean inQuote = false;
        for (int j = open + 1; j < template.length(); j++) {
            char ch = template.charAt(j);
            if (inQuote) {
                if (ch == '\\') j++;
                else if (ch == '"') inQuote = false;
            } else if (ch == '"') {
                inQuote = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) return j;
            }
        }
        throw new ParseError("Unclosed { in template");
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
