package com.dslforge.core.parser;

import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.VarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Line-oriented parser for the workflow DSL.
 *
 * <p>Walks the source one line at a time with an explicit stack of open
 * {@code IF}/{@code FOR} blocks. Parsing never aborts: every structural problem
 * becomes a {@link Defect} and parsing continues with the next line, so one
 * pass reports the complete picture.
 *
 * <h2>Block recovery</h2>
 * <ul>
 *   <li>A close whose block is further down the stack closes that block; the
 *       blocks above it are reported as {@code UnclosedBlock} at their opening line.</li>
 *   <li>A close with no open block of its kind is an {@code UnexpectedClose}.</li>
 *   <li>Blocks still open at end of input are {@code UnclosedBlock}. Their last
 *       branch runs to the end of input and the block is marked not closed.</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParseResult result = new DslParser().parse("""
 *     IF {{x}} > 5
 *         CALL notify({{x}})
 *     ENDIF
 *     """);
 * }</pre>
 */
public class DslParser {

    private static final Logger log = LoggerFactory.getLogger(DslParser.class);

    private static final int TAB_WIDTH = 4;

    private final ExpressionParser expressionParser;

    public DslParser() {
        this(new ExpressionParser());
    }

    public DslParser(ExpressionParser expressionParser) {
        this.expressionParser = expressionParser;
    }

    /**
     * Parses DSL text.
     *
     * @param dslText DSL source
     * @return statements plus every structural defect
     */
    public ParseResult parse(String dslText) {
        if (dslText == null || dslText.isBlank()) {
            return ParseResult.empty();
        }

        ParseState state = new ParseState();
        String[] lines = dslText.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.trim();
            if (trimmed.isEmpty() || DslPatterns.COMMENT.matcher(trimmed).matches()) {
                continue;
            }
            SourceSpan span = SourceSpan.of(i + 1, indentationOf(line) + 1);
            parseLine(trimmed, span, state);
        }

        while (!state.stack.isEmpty()) {
            state.closeTopUnclosed();
        }

        List<Defect> defects = new ArrayList<>(state.defects);
        defects.sort(null);
        log.debug("Parsed {} top-level statements with {} defects", state.root.size(), defects.size());
        return new ParseResult(state.root, defects);
    }

    private void parseLine(String line, SourceSpan span, ParseState state) {
        Matcher keyword = DslPatterns.LEADING_KEYWORD.matcher(line);
        if (!keyword.find()) {
            parseAssignment(line, span, state);
            return;
        }

        switch (keyword.group(1)) {
            case "DEFINE" -> parseDefine(line, span, state);
            case "CALL" -> parseCallStatement(line, span, state);
            case "IF" -> parseIf(line, span, state);
            case "ELIF" -> parseElif(line, span, state);
            case "ELSE" -> parseElse(line, span, state);
            case "ENDIF" -> parseClose(line, span, state, BlockKind.IF);
            case "FOR" -> parseFor(line, span, state);
            case "ENDFOR" -> parseClose(line, span, state, BlockKind.FOR);
            case "END" -> parseEnd(line, span, state);
            case "RETURN" -> parseReturn(line, span, state);
            default -> state.malformed(span, line, "Unknown statement keyword '" + keyword.group(1) + "'");
        }
    }

    private void parseDefine(String line, SourceSpan span, ParseState state) {
        Matcher matcher = DslPatterns.DEFINE.matcher(line);
        if (!matcher.matches()) {
            state.malformed(span, line, "Expected DEFINE {{name}}: Type [= value]");
            return;
        }
        String name = matcher.group(1).trim();
        String typeName = matcher.group(2);
        Optional<VarType> type = VarType.fromName(typeName);
        if (type.isEmpty()) {
            state.defects.add(Defect.of(DefectKind.TYPE_MISMATCH, span, name,
                "Unknown type '" + typeName + "' for variable '" + name + "'"));
        }
        Expression initialValue = matcher.group(3) == null ? null : expression(matcher.group(3), span, state);
        state.add(new Define(span, name, type.orElse(VarType.ANY), initialValue));
    }

    private void parseAssignment(String line, SourceSpan span, ParseState state) {
        Matcher matcher = DslPatterns.ASSIGN.matcher(line);
        if (!matcher.matches()) {
            state.malformed(span, line, "Line is not a DSL statement");
            return;
        }
        String target = matcher.group(1).trim();
        Expression value = expression(matcher.group(2), span, state);
        if (value instanceof CallExpression call) {
            state.add(new CallStatement(span, target, call));
        } else {
            state.add(new Assign(span, target, value));
        }
    }

    private void parseCallStatement(String line, SourceSpan span, ParseState state) {
        Expression value = expression(line, span, state);
        if (value instanceof CallExpression call) {
            state.add(new CallStatement(span, null, call));
        }
    }

    private void parseIf(String line, SourceSpan span, ParseState state) {
        Matcher matcher = DslPatterns.IF.matcher(line);
        if (!matcher.matches()) {
            state.malformed(span, line, "Expected IF condition");
            return;
        }
        state.open(Frame.forIf(span, expression(stripColon(matcher.group(1)), span, state)));
    }

    private void parseElif(String line, SourceSpan span, ParseState state) {
        Matcher matcher = DslPatterns.ELIF.matcher(line);
        if (!matcher.matches()) {
            state.malformed(span, line, "Expected ELIF condition");
            return;
        }
        Frame frame = state.unwindTo(BlockKind.IF);
        if (frame == null) {
            state.malformed(span, line, "ELIF without a matching IF");
            return;
        }
        if (frame.elseBranch != null) {
            state.malformed(span, line, "ELIF after ELSE");
            return;
        }
        frame.addElif(span, expression(stripColon(matcher.group(1)), span, state));
    }

    private void parseElse(String line, SourceSpan span, ParseState state) {
        if (!DslPatterns.ELSE.matcher(line).matches()) {
            state.malformed(span, line, "Expected ELSE on its own line");
            return;
        }
        Frame frame = state.unwindTo(BlockKind.IF);
        if (frame == null) {
            state.malformed(span, line, "ELSE without a matching IF");
            return;
        }
        if (frame.elseBranch != null) {
            state.malformed(span, line, "Second ELSE in the same IF");
            return;
        }
        frame.startElse();
    }

    private void parseFor(String line, SourceSpan span, ParseState state) {
        Matcher matcher = DslPatterns.FOR.matcher(line);
        if (!matcher.matches()) {
            state.malformed(span, line, "Expected FOR {{item}} IN iterable");
            return;
        }
        String loopVar = matcher.group(1).trim();
        state.open(Frame.forLoop(span, loopVar, expression(stripColon(matcher.group(2)), span, state)));
    }

    private void parseEnd(String line, SourceSpan span, ParseState state) {
        if (DslPatterns.ENDIF.matcher(line).matches()) {
            parseClose(line, span, state, BlockKind.IF);
        } else if (DslPatterns.ENDFOR.matcher(line).matches()) {
            parseClose(line, span, state, BlockKind.FOR);
        } else {
            state.malformed(span, line, "Expected ENDIF or ENDFOR");
        }
    }

    private void parseClose(String line, SourceSpan span, ParseState state, BlockKind kind) {
        if (!(kind == BlockKind.IF ? DslPatterns.ENDIF : DslPatterns.ENDFOR).matcher(line).matches()) {
            state.malformed(span, line, "Expected " + kind.closeKeyword + " on its own line");
            return;
        }
        Frame frame = state.unwindTo(kind);
        if (frame == null) {
            state.defects.add(Defect.of(DefectKind.UNEXPECTED_CLOSE, span, kind.closeKeyword,
                kind.closeKeyword + " without a matching " + kind.openKeyword));
            return;
        }
        state.closeTop(true);
    }

    private void parseReturn(String line, SourceSpan span, ParseState state) {
        Matcher matcher = DslPatterns.RETURN.matcher(line);
        if (!matcher.matches()) {
            state.malformed(span, line, "Expected RETURN [expression]");
            return;
        }
        Expression value = matcher.group(1) == null ? null : expression(matcher.group(1), span, state);
        state.add(new ReturnStatement(span, value));
    }

    private Expression expression(String text, SourceSpan span, ParseState state) {
        Expression expression = expressionParser.parse(text);
        if (expression instanceof RawExpression raw) {
            state.defects.add(Defect.of(DefectKind.UNPARSABLE_CALL_EXPRESSION, span, raw.text(),
                "Cannot parse expression: " + raw.text()));
        }
        return expression;
    }

    private static String stripColon(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(":") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static int indentationOf(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    private enum BlockKind {
        IF("IF", "ENDIF"),
        FOR("FOR", "ENDFOR");

        private final String openKeyword;
        private final String closeKeyword;

        BlockKind(String openKeyword, String closeKeyword) {
            this.openKeyword = openKeyword;
            this.closeKeyword = closeKeyword;
        }
    }

    /**
     * An open block being filled.
     */
    private static final class Frame {
        private final BlockKind kind;
        private final SourceSpan span;
        private final Expression head;
        private final String loopVar;
        private final List<Statement> body = new ArrayList<>();
        private final List<ElifDraft> elifs = new ArrayList<>();
        private List<Statement> elseBranch;
        private List<Statement> target = body;

        private Frame(BlockKind kind, SourceSpan span, Expression head, String loopVar) {
            this.kind = kind;
            this.span = span;
            this.head = head;
            this.loopVar = loopVar;
        }

        static Frame forIf(SourceSpan span, Expression condition) {
            return new Frame(BlockKind.IF, span, condition, null);
        }

        static Frame forLoop(SourceSpan span, String loopVar, Expression iterable) {
            return new Frame(BlockKind.FOR, span, iterable, loopVar);
        }

        void addElif(SourceSpan elifSpan, Expression condition) {
            ElifDraft draft = new ElifDraft(elifSpan, condition, new ArrayList<>());
            elifs.add(draft);
            target = draft.body();
        }

        void startElse() {
            elseBranch = new ArrayList<>();
            target = elseBranch;
        }

        Statement build(boolean closed) {
            if (kind == BlockKind.FOR) {
                return new ForStatement(span, loopVar, head, body, closed);
            }
            List<ElifBranch> branches = elifs.stream()
                .map(draft -> new ElifBranch(draft.span(), draft.condition(), draft.body()))
                .toList();
            return new IfStatement(span, head, body, branches, elseBranch, closed);
        }
    }

    private record ElifDraft(SourceSpan span, Expression condition, List<Statement> body) {
    }

    /**
     * Mutable state of one {@link #parse(String)} call.
     */
    private static final class ParseState {
        private final List<Statement> root = new ArrayList<>();
        private final List<Frame> stack = new ArrayList<>();
        private final List<Defect> defects = new ArrayList<>();

        void add(Statement statement) {
            current().add(statement);
        }

        List<Statement> current() {
            return stack.isEmpty() ? root : stack.get(stack.size() - 1).target;
        }

        void open(Frame frame) {
            stack.add(frame);
        }

        /**
         * Closes every block above the nearest open block of the given kind as unclosed.
         *
         * @return that block, now on top of the stack, or null if none is open
         */
        Frame unwindTo(BlockKind kind) {
            int index = -1;
            for (int i = stack.size() - 1; i >= 0; i--) {
                if (stack.get(i).kind == kind) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                return null;
            }
            while (stack.size() - 1 > index) {
                closeTopUnclosed();
            }
            return stack.get(index);
        }

        void closeTopUnclosed() {
            Frame frame = stack.get(stack.size() - 1);
            defects.add(Defect.of(DefectKind.UNCLOSED_BLOCK, frame.span, frame.kind.openKeyword,
                frame.kind.openKeyword + " block opened at line " + frame.span.line()
                    + " has no matching " + frame.kind.closeKeyword));
            closeTop(false);
        }

        void closeTop(boolean closed) {
            Frame frame = stack.remove(stack.size() - 1);
            add(frame.build(closed));
        }

        void malformed(SourceSpan span, String line, String message) {
            defects.add(Defect.of(DefectKind.MALFORMED_STATEMENT, span, line, message + ": " + line));
        }
    }
}
