/*
 * Copyright 2024-2025, Seqera Labs
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package nixfmt.parser;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import nixfmt.ast.ApplyExpression;
import nixfmt.ast.AssertExpression;
import nixfmt.ast.AttrPath;
import nixfmt.ast.BinaryExpression;
import nixfmt.ast.BinaryOperator;
import nixfmt.ast.Binding;
import nixfmt.ast.ConstantExpression;
import nixfmt.ast.EnvPathExpression;
import nixfmt.ast.Expression;
import nixfmt.ast.FunctionExpression;
import nixfmt.ast.HasAttrExpression;
import nixfmt.ast.IfExpression;
import nixfmt.ast.InheritBinding;
import nixfmt.ast.KeyName;
import nixfmt.ast.LetExpression;
import nixfmt.ast.ListExpression;
import nixfmt.ast.NamedBinding;
import nixfmt.ast.NamedParameter;
import nixfmt.ast.Parameter;
import nixfmt.ast.PathExpression;
import nixfmt.ast.SelectExpression;
import nixfmt.ast.SetExpression;
import nixfmt.ast.SetParameter;
import nixfmt.ast.StringExpression;
import nixfmt.ast.StringPart;
import nixfmt.ast.UnaryExpression;
import nixfmt.ast.UnaryOperator;
import nixfmt.ast.VariableExpression;
import nixfmt.ast.WithExpression;
import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static nixfmt.parser.NixParser.*;

/**
 * Transform a Nix parse tree into an expression tree.
 *
 * Comments are discarded by the lexer, so the resulting tree only
 * carries the semantic content of the source.
 */
public class NixAstBuilder {

    private static final Logger log = LoggerFactory.getLogger(NixAstBuilder.class);

    private final String sourceName;
    private final NixLexer lexer;
    private final NixParser parser;
    private final List<SyntaxException> errors = new ArrayList<>();

    public NixAstBuilder(String sourceName, String contents) {
        this.sourceName = sourceName;
        this.lexer = new NixLexer(CharStreams.fromString(contents, sourceName));
        this.parser = new NixParser(new CommonTokenStream(lexer));

        lexer.removeErrorListeners();
        lexer.addErrorListener(createANTLRErrorListener());
    }

    public Expression buildAST() {
        var ctx = buildCST();
        if( !errors.isEmpty() )
            throw errors.get(0);
        return compilationUnit(ctx);
    }

    private CompilationUnitContext buildCST() {
        var tokenStream = parser.getInputStream();
        try {
            return buildCST(PredictionMode.SLL);
        }
        catch( ParseCancellationException e ) {
            // if some syntax error occurred in the lexer, no need to retry the powerful LL mode
            if( !errors.isEmpty() )
                throw errors.get(0);

            log.debug("SLL parsing failed for {}, retrying with LL", sourceName);
            tokenStream.seek(0);
            parser.reset();
            return buildCST(PredictionMode.LL);
        }
    }

    private CompilationUnitContext buildCST(PredictionMode predictionMode) {
        parser.getInterpreter().setPredictionMode(predictionMode);
        parser.removeErrorListeners();

        if( predictionMode == PredictionMode.SLL ) {
            parser.setErrorHandler(new BailErrorStrategy());
        }
        else {
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.addErrorListener(createANTLRErrorListener());
        }

        return parser.compilationUnit();
    }

    private Expression compilationUnit(CompilationUnitContext ctx) {
        return expression(ctx.expression());
    }

    /// EXPRESSIONS

    private Expression expression(ExpressionContext ctx) {
        if( ctx instanceof FunctionExprAltContext fac )
            return lambda(fac.lambda());

        if( ctx instanceof AssertExprAltContext aac )
            return new AssertExpression(expression(aac.condition), expression(aac.body));

        if( ctx instanceof WithExprAltContext wac )
            return new WithExpression(expression(wac.environment), expression(wac.body));

        if( ctx instanceof LetExprAltContext lac )
            return new LetExpression(bindings(lac.binding()), expression(lac.body));

        if( ctx instanceof IfExprAltContext iac )
            return new IfExpression(expression(iac.condition), expression(iac.thenBranch), expression(iac.elseBranch));

        if( ctx instanceof OpExprAltContext oac )
            return opExpression(oac.opExpression());

        throw createParsingFailedException("Invalid expression: " + ctx.getText(), ctx);
    }

    private Expression lambda(LambdaContext ctx) {
        if( ctx instanceof NamedLambdaAltContext nac )
            return new FunctionExpression(new NamedParameter(nac.ID().getText()), expression(nac.body));

        if( ctx instanceof SetLambdaAltContext sac ) {
            var alias = sac.alias != null ? sac.alias.getText() : null;
            return new FunctionExpression(formals(sac.formals(), alias), expression(sac.body));
        }

        if( ctx instanceof AliasedSetLambdaAltContext aac )
            return new FunctionExpression(formals(aac.formals(), aac.alias.getText()), expression(aac.body));

        throw createParsingFailedException("Invalid function: " + ctx.getText(), ctx);
    }

    private Parameter formals(FormalsContext ctx, String alias) {
        var formals = ctx.formal().stream()
            .map(this::formal)
            .toList();
        return new SetParameter(formals, ctx.ELLIPSIS() != null, alias);
    }

    private SetParameter.Formal formal(FormalContext ctx) {
        var defaultValue = ctx.defaultValue != null ? expression(ctx.defaultValue) : null;
        return new SetParameter.Formal(ctx.ID().getText(), defaultValue);
    }

    private Expression opExpression(OpExpressionContext ctx) {
        if( ctx instanceof ApplyExprAltContext aac )
            return applyExpression(aac.applyExpression());

        if( ctx instanceof NegateExprAltContext nac )
            return new UnaryExpression(UnaryOperator.NEGATE, opExpression(nac.opExpression()));

        if( ctx instanceof NotExprAltContext nac )
            return new UnaryExpression(UnaryOperator.NOT, opExpression(nac.opExpression()));

        if( ctx instanceof HasAttrExprAltContext hac )
            return new HasAttrExpression(opExpression(hac.opExpression()), attrPath(hac.attrPath()));

        if( ctx instanceof ConcatExprAltContext cac )
            return binary(cac.left, cac.op.getText(), cac.right);

        if( ctx instanceof MultDivExprAltContext mac )
            return binary(mac.left, mac.op.getText(), mac.right);

        if( ctx instanceof AddSubExprAltContext aac )
            return binary(aac.left, aac.op.getText(), aac.right);

        if( ctx instanceof UpdateExprAltContext uac )
            return binary(uac.left, uac.op.getText(), uac.right);

        if( ctx instanceof RelationalExprAltContext rac )
            return binary(rac.left, rac.op.getText(), rac.right);

        if( ctx instanceof EqualityExprAltContext eac )
            return binary(eac.left, eac.op.getText(), eac.right);

        if( ctx instanceof LogicalAndExprAltContext lac )
            return binary(lac.left, lac.op.getText(), lac.right);

        if( ctx instanceof LogicalOrExprAltContext loc )
            return binary(loc.left, loc.op.getText(), loc.right);

        if( ctx instanceof ImplExprAltContext iac )
            return binary(iac.left, iac.op.getText(), iac.right);

        throw createParsingFailedException("Invalid operator expression: " + ctx.getText(), ctx);
    }

    private Expression binary(OpExpressionContext left, String symbol, OpExpressionContext right) {
        return new BinaryExpression(BinaryOperator.fromSymbol(symbol), opExpression(left), opExpression(right));
    }

    private Expression applyExpression(ApplyExpressionContext ctx) {
        var operands = ctx.selectExpression();
        var result = selectExpression(operands.get(0));
        for( int i = 1; i < operands.size(); i++ )
            result = new ApplyExpression(result, selectExpression(operands.get(i)));
        return result;
    }

    private Expression selectExpression(SelectExpressionContext ctx) {
        var base = simpleExpression(ctx.simpleExpression());
        if( ctx.attrPath() == null )
            return base;
        var defaultValue = ctx.defaultValue != null ? selectExpression(ctx.defaultValue) : null;
        return new SelectExpression(base, attrPath(ctx.attrPath()), defaultValue);
    }

    private Expression simpleExpression(SimpleExpressionContext ctx) {
        if( ctx instanceof VariableExprAltContext vac )
            return variable(vac.ID().getText());

        if( ctx instanceof IntegerExprAltContext iac )
            return integer(iac);

        if( ctx instanceof FloatExprAltContext fac )
            return new ConstantExpression(ConstantExpression.Kind.FLOAT, fac.FLOAT().getText());

        if( ctx instanceof UriExprAltContext uac )
            return new ConstantExpression(ConstantExpression.Kind.URI, uac.URI().getText());

        if( ctx instanceof PathExprAltContext pac )
            return new PathExpression(pac.getText());

        if( ctx instanceof EnvPathExprAltContext eac ) {
            var text = eac.SPATH().getText();
            return new EnvPathExpression(text.substring(1, text.length() - 1));
        }

        if( ctx instanceof StringExprAltContext sac )
            return string(sac.string());

        if( ctx instanceof IndStringExprAltContext iac )
            return indString(iac.indString());

        if( ctx instanceof ParenExprAltContext pac )
            return expression(pac.expression());

        if( ctx instanceof SetExprAltContext sac )
            return new SetExpression(sac.REC() != null, bindings(sac.binding()));

        if( ctx instanceof ListExprAltContext lac ) {
            var elements = lac.selectExpression().stream()
                .map(this::selectExpression)
                .toList();
            return new ListExpression(elements);
        }

        throw createParsingFailedException("Invalid expression: " + ctx.getText(), ctx);
    }

    private Expression variable(String name) {
        return switch( name ) {
            case "true" -> ConstantExpression.ofBoolean(true);
            case "false" -> ConstantExpression.ofBoolean(false);
            case "null" -> ConstantExpression.ofNull();
            default -> new VariableExpression(name);
        };
    }

    private Expression integer(IntegerExprAltContext ctx) {
        var text = ctx.INT().getText();
        try {
            Long.parseLong(text);
        }
        catch( NumberFormatException e ) {
            throw createParsingFailedException("Integer literal out of range: " + text, ctx);
        }
        return new ConstantExpression(ConstantExpression.Kind.INTEGER, text);
    }

    /// BINDINGS

    private List<Binding> bindings(List<BindingContext> ctxs) {
        return ctxs.stream()
            .map(this::binding)
            .toList();
    }

    private Binding binding(BindingContext ctx) {
        if( ctx instanceof NamedBindingAltContext nac )
            return new NamedBinding(attrPath(nac.attrPath()), expression(nac.expression()));

        if( ctx instanceof InheritBindingAltContext iac ) {
            var source = iac.source != null ? expression(iac.source) : null;
            var names = iac.attrName().stream()
                .map(this::attrName)
                .toList();
            return new InheritBinding(source, names);
        }

        throw createParsingFailedException("Invalid binding: " + ctx.getText(), ctx);
    }

    private AttrPath attrPath(AttrPathContext ctx) {
        var keys = ctx.attrName().stream()
            .map(this::attrName)
            .toList();
        return new AttrPath(keys);
    }

    private KeyName attrName(AttrNameContext ctx) {
        if( ctx instanceof IdentifierAttrAltContext iac )
            return new KeyName.Static(iac.ID().getText());

        if( ctx instanceof OrAttrAltContext )
            return new KeyName.Static("or");

        if( ctx instanceof StringAttrAltContext sac )
            return new KeyName.Quoted(string(sac.string()));

        if( ctx instanceof IndStringAttrAltContext iac )
            return new KeyName.Quoted(indString(iac.indString()));

        if( ctx instanceof InterpolatedAttrAltContext iac )
            return new KeyName.Interpolated(expression(iac.expression()));

        throw createParsingFailedException("Invalid attribute name: " + ctx.getText(), ctx);
    }

    /// STRINGS

    private StringExpression string(StringContext ctx) {
        var parts = new StringPartsBuilder();
        for( var part : ctx.stringPart() ) {
            if( part instanceof StringTextAltContext || part instanceof StringDollarAltContext )
                parts.text(part.getText());
            else if( part instanceof StringEscapeAltContext )
                parts.text(unescape(part.getText().charAt(1)));
            else if( part instanceof StringInterpAltContext sic )
                parts.interpolation(expression(sic.expression()));
            else
                throw createParsingFailedException("Invalid string: " + ctx.getText(), ctx);
        }
        return new StringExpression(StringExpression.Quoting.QUOTED, parts.build());
    }

    private static String unescape(char c) {
        return switch( c ) {
            case 'n' -> "\n";
            case 'r' -> "\r";
            case 't' -> "\t";
            default -> String.valueOf(c);
        };
    }

    private StringExpression indString(IndStringContext ctx) {
        var segments = new ArrayList<IndentedSegment>();
        for( var part : ctx.indStringPart() ) {
            if( part instanceof IndStringTextAltContext )
                segments.add(IndentedSegment.raw(part.getText()));
            else if( part instanceof IndStringEscapeAltContext )
                segments.add(IndentedSegment.literal(indEscape(part.getText())));
            else if( part instanceof IndStringInterpAltContext iic )
                segments.add(IndentedSegment.interpolation(expression(iic.expression())));
            else
                throw createParsingFailedException("Invalid indented string: " + ctx.getText(), ctx);
        }
        return new StringExpression(StringExpression.Quoting.INDENTED, stripIndentation(segments));
    }

    private static String indEscape(String text) {
        if( "'''".equals(text) )
            return "''";
        if( "''$".equals(text) )
            return "$";
        // ''\x
        return unescape(text.charAt(3));
    }

    /**
     * Remove the indentation common to all non-blank lines of an
     * indented string, then drop a trailing line made only of spaces.
     * Escapes and interpolations count as line content.
     */
    static List<StringPart> stripIndentation(List<IndentedSegment> segments) {
        // determine the minimum indentation
        var minIndent = Integer.MAX_VALUE;
        var atStartOfLine = true;
        var curIndent = 0;
        for( var segment : segments ) {
            if( !segment.isRaw() ) {
                if( atStartOfLine ) {
                    minIndent = Math.min(minIndent, curIndent);
                    atStartOfLine = false;
                }
                continue;
            }
            for( var c : segment.text().toCharArray() ) {
                if( atStartOfLine ) {
                    if( c == ' ' ) {
                        curIndent++;
                    }
                    else if( c == '\n' ) {
                        curIndent = 0;
                    }
                    else {
                        minIndent = Math.min(minIndent, curIndent);
                        atStartOfLine = false;
                    }
                }
                else if( c == '\n' ) {
                    atStartOfLine = true;
                    curIndent = 0;
                }
            }
        }

        // strip the indentation
        var parts = new StringPartsBuilder();
        atStartOfLine = true;
        var curDropped = 0;
        for( int i = 0; i < segments.size(); i++ ) {
            var segment = segments.get(i);
            if( segment.expression() != null ) {
                atStartOfLine = false;
                parts.interpolation(segment.expression());
                continue;
            }
            if( !segment.isRaw() ) {
                atStartOfLine = false;
                parts.text(segment.text());
                continue;
            }
            var builder = new StringBuilder();
            for( var c : segment.text().toCharArray() ) {
                if( atStartOfLine ) {
                    if( c == ' ' ) {
                        if( curDropped++ >= minIndent )
                            builder.append(c);
                    }
                    else if( c == '\n' ) {
                        curDropped = 0;
                        builder.append(c);
                    }
                    else {
                        atStartOfLine = false;
                        curDropped = 0;
                        builder.append(c);
                    }
                }
                else {
                    builder.append(c);
                    if( c == '\n' ) {
                        atStartOfLine = true;
                        curDropped = 0;
                    }
                }
            }
            var text = builder.toString();
            if( i == segments.size() - 1 ) {
                var n = text.lastIndexOf('\n');
                if( n >= 0 && text.substring(n + 1).chars().allMatch(c -> c == ' ') )
                    text = text.substring(0, n + 1);
            }
            parts.text(text);
        }
        return parts.build();
    }

    /**
     * A piece of indented string content: raw source text subject to
     * indentation stripping, the literal value of an escape, or an
     * interpolated expression.
     */
    record IndentedSegment(String text, boolean isRaw, Expression expression) {

        static IndentedSegment raw(String text) {
            return new IndentedSegment(text, true, null);
        }

        static IndentedSegment literal(String text) {
            return new IndentedSegment(text, false, null);
        }

        static IndentedSegment interpolation(Expression expression) {
            return new IndentedSegment(null, false, expression);
        }
    }

    /**
     * Accumulates string parts, merging adjacent text and dropping
     * empty text.
     */
    private static class StringPartsBuilder {

        private final List<StringPart> parts = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();

        void text(String text) {
            pending.append(text);
        }

        void interpolation(Expression expression) {
            flush();
            parts.add(new StringPart.Interpolation(expression));
        }

        List<StringPart> build() {
            flush();
            return parts;
        }

        private void flush() {
            if( pending.length() > 0 ) {
                parts.add(new StringPart.Text(pending.toString()));
                pending.setLength(0);
            }
        }
    }

    /// HELPERS

    private SyntaxException createParsingFailedException(String msg, ParserRuleContext ctx) {
        return new SyntaxException(msg,
            sourceName,
            ctx.start.getLine(),
            ctx.start.getCharPositionInLine() + 1);
    }

    private ANTLRErrorListener createANTLRErrorListener() {
        return new ANTLRErrorListener() {
            @Override
            public void syntaxError(Recognizer recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e) {
                errors.add(new SyntaxException(msg, sourceName, line, charPositionInLine + 1, e));
            }

            @Override
            public void reportAmbiguity(Parser recognizer, DFA dfa, int startIndex, int stopIndex, boolean exact, BitSet ambigAlts, ATNConfigSet configs) {}

            @Override
            public void reportAttemptingFullContext(Parser recognizer, DFA dfa, int startIndex, int stopIndex, BitSet conflictingAlts, ATNConfigSet configs) {}

            @Override
            public void reportContextSensitivity(Parser recognizer, DFA dfa, int startIndex, int stopIndex, int prediction, ATNConfigSet configs) {}
        };
    }
}
