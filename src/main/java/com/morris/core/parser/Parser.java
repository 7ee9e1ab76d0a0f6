package com.morris.core.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.morris.core.error.ParseError;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Expr.Operator;

/**
 * Hand-written precedence parser over raw expression text.
 *
 * Each level looks for its operator at top level only (outside string literals and any
 * (), [] or {} nesting) and splits there; otherwise it defers to the next tighter level:
 *
 *   conditional ( | )  ->  or  ->  and  ->  not  ->  comparison  ->  + -  ->  * /  ->  unary -  ->  atom
 *
 * Binary operators split on their rightmost occurrence so that chains associate to the left.
 */
public final class Parser {

    private static final Pattern INT_LITERAL = Pattern.compile("-?\\d+");
    private static final Pattern FLOAT_LITERAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CALL_HEAD = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
    private static final Pattern DICT_KEY = Pattern.compile("[A-Za-z0-9_\\-]+");
    private static final Pattern EXPONENT_PREFIX = Pattern.compile("\\d+\\.?\\d*[eE]|\\.\\d+[eE]");

    // characters after which '-' or '+' is a sign, not a binary operator
    private static final String OPERAND_BREAKERS = "+-*/(<>=!,[{:|";

    private Parser() {}

    public static ExprInterface parse(String input) {
        if (input == null || input.trim().isEmpty()) {
            throw new ParseError("Empty expression");
        }
        String s = input.trim();
        checkBalanced(s);
        return parseExpression(s);
    }

    // -------------------------
    // Levels
    // -------------------------

    private static ExprInterface parseExpression(String s) {
        s = s.trim();
        if (s.isEmpty()) throw new ParseError("Empty expression");

        List<String> branches = splitTopLevel(s, '|');
        if (branches.size() > 1) {
            return parseConditional(branches);
        }
        return parseOr(s);
    }

    private static ExprInterface parseConditional(List<String> parts) {
        List<Expr.Branch> branches = new ArrayList<>(parts.size());
        for (String part : parts) {
            String b = part.trim();
            if (b.isEmpty()) throw new ParseError("Empty branch in conditional expression");
            branches.add(parseBranch(b));
        }
        return new Expr.Conditional(branches);
    }

    private static Expr.Branch parseBranch(String b) {
        int when = findWord(b, "when", false);
        if (when >= 0) {
            String value = b.substring(0, when).trim();
            String guard = b.substring(when + 4).trim();
            if (value.isEmpty()) throw new ParseError("Missing value before 'when'");
            if (guard.isEmpty()) throw new ParseError("Missing condition after 'when'");
            return new Expr.Branch(parseOr(value), parseOr(guard));
        }

        for (String keyword : new String[] { "otherwise", "else" }) {
            if (b.equalsIgnoreCase(keyword)) {
                throw new ParseError("Missing value for '" + keyword + "' branch");
            }
            if (startsWithWord(b, keyword)) {
                return new Expr.Branch(parseOr(b.substring(keyword.length())), null);
            }
            int last = findWord(b, keyword, true);
            if (last > 0 && b.substring(last + keyword.length()).trim().isEmpty()) {
                return new Expr.Branch(parseOr(b.substring(0, last)), null);
            }
        }

        return new Expr.Branch(parseOr(b), null);
    }

    private static ExprInterface parseOr(String s) {
        s = s.trim();
        int pos = findWord(s, "or", true);
        if (pos >= 0) {
            String left = s.substring(0, pos).trim();
            String right = s.substring(pos + 2).trim();
            if (left.isEmpty() || right.isEmpty()) throw new ParseError("Incomplete 'or' expression");
            return new Expr.Binary(parseOr(left), Operator.OR, parseAnd(right));
        }
        return parseAnd(s);
    }

    private static ExprInterface parseAnd(String s) {
        s = s.trim();
        int pos = findWord(s, "and", true);
        if (pos >= 0) {
            String left = s.substring(0, pos).trim();
            String right = s.substring(pos + 3).trim();
            if (left.isEmpty() || right.isEmpty()) throw new ParseError("Incomplete 'and' expression");
            return new Expr.Binary(parseAnd(left), Operator.AND, parseNot(right));
        }
        return parseNot(s);
    }

    private static ExprInterface parseNot(String s) {
        s = s.trim();
        if (startsWithWord(s, "not")) {
            String rest = s.substring(3).trim();
            if (rest.isEmpty()) throw new ParseError("Missing operand after 'not'");
            return new Expr.Not(parseNot(rest));
        }
        return parseComparison(s);
    }

    private static ExprInterface parseComparison(String s) {
        s = s.trim();
        boolean[] top = topLevel(s);
        for (int i = 0; i < s.length(); i++) {
            if (!top[i]) continue;
            char c = s.charAt(i);
            char next = i + 1 < s.length() ? s.charAt(i + 1) : '\0';

            Operator op = null;
            int width = 2;
            if (c == '>' && next == '=') op = Operator.GREATER_EQUAL;
            else if (c == '<' && next == '=') op = Operator.LESS_EQUAL;
            else if (c == '=' && next == '=') op = Operator.EQUAL;
            else if (c == '!' && next == '=') op = Operator.NOT_EQUAL;
            else if (c == '>') { op = Operator.GREATER; width = 1; }
            else if (c == '<') { op = Operator.LESS; width = 1; }
            else if (c == '=') throw new ParseError("Unexpected '=' in expression (use '==' to compare)");

            if (op == null) continue;

            String left = s.substring(0, i).trim();
            String right = s.substring(i + width).trim();
            if (left.isEmpty() || right.isEmpty()) {
                throw new ParseError("Incomplete comparison around '" + op.symbol + "'");
            }
            return new Expr.Binary(parseAdditive(left), op, parseAdditive(right));
        }
        return parseAdditive(s);
    }

    private static ExprInterface parseAdditive(String s) {
        s = s.trim();
        boolean[] top = topLevel(s);
        for (int i = s.length() - 1; i > 0; i--) {
            char c = s.charAt(i);
            if (!top[i] || (c != '+' && c != '-')) continue;
            if (!isBinaryAt(s, i)) continue;

            String left = s.substring(0, i).trim();
            String right = s.substring(i + 1).trim();
            if (right.isEmpty()) throw new ParseError("Incomplete expression around '" + c + "'");
            Operator op = c == '+' ? Operator.ADD : Operator.SUBTRACT;
            return new Expr.Binary(parseAdditive(left), op, parseMultiplicative(right));
        }
        return parseMultiplicative(s);
    }

    private static ExprInterface parseMultiplicative(String s) {
        s = s.trim();
        boolean[] top = topLevel(s);
        for (int i = s.length() - 1; i >= 0; i--) {
            char c = s.charAt(i);
            if (!top[i] || (c != '*' && c != '/')) continue;

            String left = s.substring(0, i).trim();
            String right = s.substring(i + 1).trim();
            if (left.isEmpty() || right.isEmpty()) {
                throw new ParseError("Incomplete expression around '" + c + "'");
            }
            Operator op = c == '*' ? Operator.MULTIPLY : Operator.DIVIDE;
            return new Expr.Binary(parseMultiplicative(left), op, parseUnary(right));
        }
        return parseUnary(s);
    }

    private static ExprInterface parseUnary(String s) {
        s = s.trim();
        if (s.startsWith("-")) {
            String rest = s.substring(1).trim();
            if (rest.isEmpty()) throw new ParseError("Incomplete expression around '-'");
            if (INT_LITERAL.matcher(rest).matches() || FLOAT_LITERAL.matcher(rest).matches()) {
                return parseAtom("-" + rest);
            }
            return new Expr.Binary(new Expr.Literal(Value.integer(0)), Operator.SUBTRACT, parseUnary(rest));
        }
        return parseAtom(s);
    }

    // -------------------------
    // Atoms
    // -------------------------

    private static ExprInterface parseAtom(String s) {
        s = s.trim();
        if (s.isEmpty()) throw new ParseError("Empty expression");
        int last = s.length() - 1;

        if (s.charAt(0) == '(' && matchingClose(s, 0) == last) {
            String inner = s.substring(1, last).trim();
            if (inner.isEmpty()) throw new ParseError("Empty parentheses");
            return parseExpression(inner);
        }

        if (s.charAt(0) == '"' && closingQuote(s, 0) == last) {
            String body = s.substring(1, last);
            // template rendering resolves its own backslash escapes
            return Expr.Literal.template(unescape(body, Template.isTemplate(body)));
        }

        if (INT_LITERAL.matcher(s).matches()) {
            try {
                return new Expr.Literal(Value.integer(Long.parseLong(s)));
            } catch (NumberFormatException e) {
                throw new ParseError("Integer literal out of range: " + s, e);
            }
        }
        if (FLOAT_LITERAL.matcher(s).matches()) {
            return new Expr.Literal(Value.floating(Double.parseDouble(s)));
        }
        if (s.equals("true")) return new Expr.Literal(Value.bool(true));
        if (s.equals("false")) return new Expr.Literal(Value.bool(false));

        if (s.charAt(0) == '[' && matchingClose(s, 0) == last) {
            return parseList(s.substring(1, last));
        }
        if (s.charAt(0) == '{' && matchingClose(s, 0) == last) {
            return parseDict(s.substring(1, last));
        }

        // container[index]
        if (s.charAt(last) == ']') {
            int open = matchingOpen(s, last);
            if (open > 0) {
                String container = s.substring(0, open).trim();
                String index = s.substring(open + 1, last).trim();
                if (index.isEmpty()) throw new ParseError("Empty index in '" + s + "'");
                return new Expr.Index(parseAtom(container), parseExpression(index));
            }
        }

        int dot = firstMethodDot(s);
        if (dot > 0) {
            return parseMethodChain(s.substring(0, dot), s.substring(dot + 1), s);
        }

        Matcher head = CALL_HEAD.matcher(s);
        if (head.lookingAt() && s.charAt(last) == ')') {
            int open = head.end() - 1;
            if (matchingClose(s, open) == last) {
                String name = head.group(1);
                return new Expr.Call(name, parseArgs(s.substring(open + 1, last), name));
            }
        }

        if (IDENTIFIER.matcher(s).matches()) {
            return new Expr.Variable(s);
        }

        throw new ParseError("Invalid expression: '" + s + "'");
    }

    private static ExprInterface parseList(String inner) {
        if (inner.trim().isEmpty()) return new Expr.ListLiteral(List.of());
        List<ExprInterface> items = new ArrayList<>();
        for (String part : splitTopLevel(inner, ',')) {
            if (part.trim().isEmpty()) throw new ParseError("Empty element in list literal");
            items.add(parseExpression(part));
        }
        return new Expr.ListLiteral(items);
    }

    private static ExprInterface parseDict(String inner) {
        Map<String, ExprInterface> entries = new LinkedHashMap<>();
        if (inner.trim().isEmpty()) return new Expr.DictLiteral(entries);

        for (String part : splitTopLevel(inner, ',')) {
            String entry = part.trim();
            if (entry.isEmpty()) throw new ParseError("Empty entry in dict literal");

            List<String> kv = splitTopLevel(entry, ':');
            if (kv.size() < 2) {
                throw new ParseError("Expected 'key: value' in dict literal, got '" + entry + "'");
            }
            String rawKey = kv.get(0).trim();
            String rawValue = entry.substring(kv.get(0).length() + 1).trim();
            if (rawValue.isEmpty()) throw new ParseError("Missing value for key " + rawKey);

            String key;
            if (rawKey.length() >= 2 && rawKey.charAt(0) == '"' && closingQuote(rawKey, 0) == rawKey.length() - 1) {
                key = unescape(rawKey.substring(1, rawKey.length() - 1));
            } else if (DICT_KEY.matcher(rawKey).matches()) {
                key = rawKey;
            } else {
                throw new ParseError("Invalid dict key: " + rawKey);
            }
            entries.put(key, parseExpression(rawValue));
        }
        return new Expr.DictLiteral(entries);
    }

    /** receiver.m1(args).m2(args)... ; segments without parentheses are zero-arg calls. */
    private static ExprInterface parseMethodChain(String receiverText, String chain, String whole) {
        ExprInterface receiver = parseAtom(receiverText);
        for (String segment : splitTopLevel(chain, '.')) {
            String seg = segment.trim();
            if (IDENTIFIER.matcher(seg).matches()) {
                receiver = new Expr.MethodCall(receiver, seg, List.of());
                continue;
            }
            Matcher head = CALL_HEAD.matcher(seg);
            int last = seg.length() - 1;
            if (!head.lookingAt() || seg.isEmpty() || seg.charAt(last) != ')'
                    || matchingClose(seg, head.end() - 1) != last) {
                throw new ParseError("Invalid method call in '" + whole + "'");
            }
            String name = head.group(1);
            receiver = new Expr.MethodCall(receiver, name,
                    parseArgs(seg.substring(head.end(), last), name));
        }
        return receiver;
    }

    private static List<ExprInterface> parseArgs(String inner, String callee) {
        List<ExprInterface> args = new ArrayList<>();
        if (inner.trim().isEmpty()) return args;
        for (String part : splitTopLevel(inner, ',')) {
            if (part.trim().isEmpty()) throw new ParseError("Empty argument in call to " + callee);
            args.add(parseExpression(part));
        }
        return args;
    }

    // -------------------------
    // Scanning helpers
    // -------------------------

    /**
     * For every index, whether that character sits outside string literals and all brackets.
     * Bracket characters count as top level when they open or close a top-level group.
     */
    static boolean[] topLevel(String s) {
        boolean[] top = new boolean[s.length()];
        boolean inQuote = false;
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inQuote) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inQuote = false;
                }
                continue;
            }
            switch (c) {
                case '"':
                    inQuote = true;
                    break;
                case '(': case '[': case '{':
                    top[i] = depth == 0;
                    depth++;
                    break;
                case ')': case ']': case '}':
                    depth--;
                    top[i] = depth == 0;
                    break;
                default:
                    top[i] = depth == 0;
            }
        }
        return top;
    }

    static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<>();
        boolean[] top = topLevel(s);
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            if (top[i] && s.charAt(i) == separator) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    /** Position of a top-level, whole-word, case-insensitive keyword; -1 when absent. */
    static int findWord(String s, String word, boolean rightmost) {
        boolean[] top = topLevel(s);
        int found = -1;
        int n = word.length();
        for (int i = 0; i + n <= s.length(); i++) {
            if (!top[i] || !s.regionMatches(true, i, word, 0, n)) continue;
            boolean startOk = i == 0 || !isWordChar(s.charAt(i - 1));
            boolean endOk = i + n == s.length() || !isWordChar(s.charAt(i + n));
            if (startOk && endOk) {
                if (!rightmost) return i;
                found = i;
            }
        }
        return found;
    }

    private static boolean startsWithWord(String s, String word) {
        int n = word.length();
        return s.length() > n
                && s.regionMatches(true, 0, word, 0, n)
                && !isWordChar(s.charAt(n));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /** Whether the '+' or '-' at {@code i} joins two operands rather than signing a number. */
    private static boolean isBinaryAt(String s, int i) {
        int j = i - 1;
        while (j >= 0 && Character.isWhitespace(s.charAt(j))) j--;
        if (j < 0) return false;
        char p = s.charAt(j);
        if (OPERAND_BREAKERS.indexOf(p) >= 0) return false;

        if ((p == 'e' || p == 'E') && j == i - 1) {
            int k = j;
            while (k > 0 && (Character.isDigit(s.charAt(k - 1)) || s.charAt(k - 1) == '.')) k--;
            boolean tokenStart = k == 0 || !isWordChar(s.charAt(k - 1));
            if (tokenStart && EXPONENT_PREFIX.matcher(s.substring(k, j + 1)).matches()) return false;
        }

        String before = s.substring(0, j + 1).toLowerCase(Locale.ROOT);
        for (String kw : new String[] { "and", "or", "not", "when" }) {
            if (before.endsWith(kw)) {
                int start = before.length() - kw.length();
                if (start == 0 || !isWordChar(before.charAt(start - 1))) return false;
            }
        }
        return true;
    }

    /** First top-level '.' that is not inside a number; -1 when none. */
    private static int firstMethodDot(String s) {
        boolean[] top = topLevel(s);
        for (int i = 1; i < s.length() - 1; i++) {
            if (!top[i] || s.charAt(i) != '.') continue;
            if (INT_LITERAL.matcher(s.substring(0, i).trim()).matches()) continue;
            return i;
        }
        return -1;
    }

    private static int closingQuote(String s, int open) {
        for (int i = open + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    static int matchingClose(String s, int open) {
        int depth = 0;
        boolean inQuote = false;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inQuote) {
                if (c == '\\') i++;
                else if (c == '"') inQuote = false;
                continue;
            }
            if (c == '"') inQuote = true;
            else if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    static int matchingOpen(String s, int close) {
        Deque<Integer> opens = new ArrayDeque<>();
        boolean inQuote = false;
        for (int i = 0; i <= close && i < s.length(); i++) {
            char c = s.charAt(i);
            if (inQuote) {
                if (c == '\\') i++;
                else if (c == '"') inQuote = false;
                continue;
            }
            if (c == '"') inQuote = true;
            else if (c == '(' || c == '[' || c == '{') opens.push(i);
            else if (c == ')' || c == ']' || c == '}') {
                if (opens.isEmpty()) return -1;
                int open = opens.pop();
                if (i == close) return open;
            }
        }
        return -1;
    }

    private static void checkBalanced(String s) {
        Deque<Character> stack = new ArrayDeque<>();
        boolean inQuote = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inQuote) {
                if (c == '\\') i++;
                else if (c == '"') inQuote = false;
                continue;
            }
            switch (c) {
                case '"':
                    inQuote = true;
                    break;
                case '(': stack.push(')'); break;
                case '[': stack.push(']'); break;
                case '{': stack.push('}'); break;
                case ')': case ']': case '}':
                    if (stack.isEmpty() || stack.pop() != c) {
                        throw new ParseError("Unbalanced delimiters: unexpected '" + c + "' at position " + i);
                    }
                    break;
                default:
                    break;
            }
        }
        if (inQuote) throw new ParseError("Unterminated string literal");
        if (!stack.isEmpty()) throw new ParseError("Unbalanced delimiters: missing '" + stack.peek() + "'");
    }

    private static String unescape(String body) {
        return unescape(body, false);
    }

    /** Resolves {@code \"} and, unless {@code keepBackslashPairs}, {@code \\}. Other escapes are left as written. */
    private static String unescape(String body, boolean keepBackslashPairs) {
        if (body.indexOf('\\') < 0) return body;
        StringBuilder out = new StringBuilder(body.length());
        int n = body.length();
        for (int i = 0; i < n; i++) {
            char c = body.charAt(i);
            char next = i + 1 < n ? body.charAt(i + 1) : '\0';
            if (c == '\\' && next == '"') {
                out.append('"');
                i++;
            } else if (c == '\\' && next == '\\') {
                out.append(keepBackslashPairs ? "\\\\" : "\\");
                i++;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
