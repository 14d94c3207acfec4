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
package nixfmt.control;

import java.util.List;
import java.util.function.Function;

import nixfmt.ast.ApplyExpression;
import nixfmt.ast.AssertExpression;
import nixfmt.ast.AttrPath;
import nixfmt.ast.BinaryExpression;
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
import nixfmt.ast.VariableExpression;
import nixfmt.ast.WithExpression;
import nixfmt.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Check that formatted output means the same as its input by parsing
 * it again and comparing the two trees.
 *
 * <p>Trees are compared structurally, except that a quoted and an
 * indented string with the same parts are considered equal.
 */
public class EquivalenceChecker {

    private static final Logger log = LoggerFactory.getLogger(EquivalenceChecker.class);

    private final SourceParser parser;

    public EquivalenceChecker(SourceParser parser) {
        this.parser = parser;
    }

    public EquivalenceChecker() {
        this(new SourceParser());
    }

    public static boolean equivalent(Expression a, Expression b) {
        return normalize(a).equals(normalize(b));
    }

    /**
     * Whether the rendered text parses into a tree equivalent to the
     * original one. Output that fails to parse is never equivalent.
     */
    public boolean verify(Expression original, String renderedText) {
        try {
            return equivalent(original, parser.parse("<formatted>", renderedText));
        }
        catch( SyntaxException e ) {
            log.debug("Formatted output does not parse: {}", e.getLocatedMessage());
            return false;
        }
    }

    /**
     * Like {@link #verify} but raise an error describing both trees
     * when they differ.
     *
     * @throws VerificationException
     */
    public void check(String sourceName, Expression original, String renderedText) {
        Expression rendered;
        try {
            rendered = parser.parse(sourceName + " (formatted)", renderedText);
        }
        catch( SyntaxException e ) {
            throw new VerificationException(sourceName, original.toString(), e.getLocatedMessage(), e);
        }
        if( !equivalent(original, rendered) )
            throw new VerificationException(sourceName, original.toString(), rendered.toString());
        log.debug("Verified formatting of {}", sourceName);
    }

    // normalization

    /**
     * Rewrite a tree so that every string is quoted.
     */
    static Expression normalize(Expression node) {
        if( node instanceof ConstantExpression
                || node instanceof VariableExpression
                || node instanceof PathExpression
                || node instanceof EnvPathExpression )
            return node;

        if( node instanceof StringExpression se )
            return normalizeString(se);

        if( node instanceof ListExpression le )
            return new ListExpression(map(le.elements(), EquivalenceChecker::normalize));

        if( node instanceof SetExpression se )
            return new SetExpression(se.recursive(), map(se.bindings(), EquivalenceChecker::normalizeBinding));

        if( node instanceof UnaryExpression ue )
            return new UnaryExpression(ue.operator(), normalize(ue.operand()));

        if( node instanceof BinaryExpression be )
            return new BinaryExpression(be.operator(), normalize(be.left()), normalize(be.right()));

        if( node instanceof SelectExpression se ) {
            var defaultValue = se.hasDefault() ? normalize(se.defaultValue()) : null;
            return new SelectExpression(normalize(se.base()), normalizePath(se.path()), defaultValue);
        }

        if( node instanceof HasAttrExpression hae )
            return new HasAttrExpression(normalize(hae.base()), normalizePath(hae.path()));

        if( node instanceof FunctionExpression fe )
            return new FunctionExpression(normalizeParameter(fe.parameter()), normalize(fe.body()));

        if( node instanceof ApplyExpression ae )
            return new ApplyExpression(normalize(ae.function()), normalize(ae.argument()));

        if( node instanceof LetExpression le )
            return new LetExpression(map(le.bindings(), EquivalenceChecker::normalizeBinding), normalize(le.body()));

        if( node instanceof IfExpression ie )
            return new IfExpression(normalize(ie.condition()), normalize(ie.thenBranch()), normalize(ie.elseBranch()));

        if( node instanceof WithExpression we )
            return new WithExpression(normalize(we.scope()), normalize(we.body()));

        if( node instanceof AssertExpression ae )
            return new AssertExpression(normalize(ae.condition()), normalize(ae.body()));

        throw new IllegalStateException("Unknown expression: " + node);
    }

    private static StringExpression normalizeString(StringExpression node) {
        var parts = map(node.parts(), part -> part instanceof StringPart.Interpolation ip
            ? new StringPart.Interpolation(normalize(ip.expression()))
            : part);
        return new StringExpression(StringExpression.Quoting.QUOTED, parts);
    }

    private static Binding normalizeBinding(Binding node) {
        if( node instanceof NamedBinding nb )
            return new NamedBinding(normalizePath(nb.path()), normalize(nb.value()));

        if( node instanceof InheritBinding ib ) {
            var source = ib.hasSource() ? normalize(ib.source()) : null;
            return new InheritBinding(source, map(ib.names(), EquivalenceChecker::normalizeKey));
        }

        throw new IllegalStateException("Unknown binding: " + node);
    }

    private static AttrPath normalizePath(AttrPath path) {
        return new AttrPath(map(path.keys(), EquivalenceChecker::normalizeKey));
    }

    private static KeyName normalizeKey(KeyName key) {
        if( key instanceof KeyName.Quoted qk )
            return new KeyName.Quoted(normalizeString(qk.string()));
        if( key instanceof KeyName.Interpolated ik )
            return new KeyName.Interpolated(normalize(ik.expression()));
        return key;
    }

    private static Parameter normalizeParameter(Parameter node) {
        if( node instanceof NamedParameter )
            return node;

        if( node instanceof SetParameter sp ) {
            var formals = map(sp.formals(), formal -> new SetParameter.Formal(
                formal.name(),
                formal.hasDefault() ? normalize(formal.defaultValue()) : null));
            return new SetParameter(formals, sp.variadic(), sp.alias());
        }

        throw new IllegalStateException("Unknown parameter: " + node);
    }

    private static <T,R> List<R> map(List<T> values, Function<T,R> mapper) {
        return values.stream().map(mapper).toList();
    }
}
