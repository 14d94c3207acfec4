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
package nixfmt.formatter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

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
import nixfmt.ast.UnaryExpression;
import nixfmt.ast.VariableExpression;
import nixfmt.ast.WithExpression;

/**
 * Transform an expression tree into formatted source code.
 *
 * <p>Each construct is laid out on one line when it fits within the
 * line width, otherwise its children are broken over indented lines.
 * Parentheses are inserted only where the priority of a child
 * requires them.
 */
public class Formatter {

    private final FormattingOptions options;

    private final StringFormatter strings;

    // width of the text that follows the current expression on its line
    private int suffix = 0;

    public Formatter(FormattingOptions options) {
        this.options = options;
        this.strings = new StringFormatter(this);
    }

    public String format(Expression node) {
        var out = new RenderingLayout(options.maxWidth());
        visit(out, node);
        return out.toString();
    }

    // expressions

    /**
     * Lay out an expression that is followed on its line by
     * {@code trailing} characters of closing punctuation.
     */
    public void visit(Layout out, Expression node, int trailing) {
        var saved = suffix;
        suffix = trailing;
        try {
            visit(out, node);
        }
        finally {
            suffix = saved;
        }
    }

    public void visit(Layout out, Expression node) {
        if( node instanceof ConstantExpression ce )
            out.text(ce.text());

        else if( node instanceof StringExpression se )
            strings.visitString(out, se);

        else if( node instanceof VariableExpression ve )
            out.text(ve.name());

        else if( node instanceof PathExpression pe )
            out.text(pe.path());

        else if( node instanceof EnvPathExpression epe )
            out.text("<" + epe.path() + ">");

        else if( node instanceof ListExpression le )
            visitList(out, le);

        else if( node instanceof SetExpression se )
            visitSet(out, se);

        else if( node instanceof UnaryExpression ue )
            visitUnary(out, ue);

        else if( node instanceof BinaryExpression be )
            visitBinary(out, be);

        else if( node instanceof SelectExpression se )
            visitSelect(out, se);

        else if( node instanceof HasAttrExpression hae )
            visitHasAttr(out, hae);

        else if( node instanceof FunctionExpression fe )
            visitFunction(out, fe);

        else if( node instanceof ApplyExpression ae )
            visitApply(out, ae);

        else if( node instanceof LetExpression le )
            visitLet(out, le);

        else if( node instanceof IfExpression ie )
            visitIf(out, ie);

        else if( node instanceof WithExpression we )
            visitScoped(out, "with", we.scope(), we.body());

        else if( node instanceof AssertExpression ae )
            visitScoped(out, "assert", ae.condition(), ae.body());

        else
            throw new IllegalStateException("Unknown expression: " + node);
    }

    protected void visitList(Layout out, ListExpression node) {
        if( node.elements().isEmpty() ) {
            out.text("[]");
            return;
        }
        var items = new ArrayList<Consumer<Layout>>();
        for( var element : node.elements() )
            items.add(o -> visitParenthesized(o, Priorities.isLooserOrEqual(Priorities.of(element), Priorities.APPLY), element, 0));

        out.tryOneLine(suffix, (o, oneLine) -> {
            o.text("[");
            sequence(o, oneLine, items);
            o.text("]");
        });
    }

    protected void visitSet(Layout out, SetExpression node) {
        if( node.recursive() )
            out.text("rec ");
        if( node.bindings().isEmpty() ) {
            out.text("{}");
            return;
        }
        var items = bindings(node.bindings());
        out.tryOneLine(suffix, (o, oneLine) -> {
            o.text("{");
            sequence(o, oneLine, items);
            o.text("}");
        });
    }

    protected void visitUnary(Layout out, UnaryExpression node) {
        var context = Priorities.of(node.operator());
        var operand = node.operand();
        out.text(node.operator().symbol());
        visitParenthesized(out, Priorities.isLooser(Priorities.of(operand), context), operand, suffix);
    }

    protected void visitBinary(Layout out, BinaryExpression node) {
        var context = Priorities.of(node.operator());
        visitOperand(out, context, true, node.left());
        out.text(" " + node.operator().symbol() + " ");
        visitOperand(out, context, false, node.right());
    }

    protected void visitSelect(Layout out, SelectExpression node) {
        visitSelectOperand(out, node.base());
        out.text(".");
        visitAttrPath(out, node.path());
        if( node.hasDefault() ) {
            var defaultValue = node.defaultValue();
            out.text(" or ");
            visitParenthesized(out, Priorities.isLooser(Priorities.of(defaultValue), Priorities.SELECT), defaultValue, suffix);
        }
    }

    /**
     * Numbers and literal paths absorb a following dot when they are
     * lexed, so they are parenthesized in front of a selection too.
     */
    private void visitSelectOperand(Layout out, Expression node) {
        var parens = Priorities.isLooserOrEqual(Priorities.of(node), Priorities.SELECT)
            || node instanceof PathExpression
            || node instanceof ConstantExpression ce && isNumber(ce);
        visitParenthesized(out, parens, node, 0);
    }

    private static boolean isNumber(ConstantExpression node) {
        return node.kind() == ConstantExpression.Kind.INTEGER || node.kind() == ConstantExpression.Kind.FLOAT;
    }

    protected void visitHasAttr(Layout out, HasAttrExpression node) {
        var base = node.base();
        visitParenthesized(out, Priorities.isLooserOrEqual(Priorities.of(base), Priorities.HAS_ATTR), base, 0);
        out.text(" ? ");
        visitAttrPath(out, node.path());
    }

    protected void visitFunction(Layout out, FunctionExpression node) {
        visitParameter(out, node.parameter());
        out.text(": ");
        visit(out, node.body());
    }

    protected void visitApply(Layout out, ApplyExpression node) {
        var function = node.function();
        var argument = node.argument();
        visitParenthesized(out, Priorities.isLooser(Priorities.of(function), Priorities.APPLY), function, 0);
        out.text(" ");
        visitParenthesized(out, Priorities.isLooserOrEqual(Priorities.of(argument), Priorities.APPLY), argument, suffix);
    }

    protected void visitLet(Layout out, LetExpression node) {
        var items = bindings(node.bindings());
        out.tryOneLine(suffix, (o, oneLine) -> {
            o.text("let");
            sequence(o, oneLine, items);
            o.text("in ");
            visit(o, node.body());
        });
    }

    protected void visitIf(Layout out, IfExpression node) {
        out.tryOneLine(suffix, (o, oneLine) -> {
            o.text("if ");
            visit(o, node.condition(), oneLine ? 0 : " then".length());
            if( oneLine ) {
                o.text(" then ");
                visit(o, node.thenBranch(), 0);
                o.text(" else ");
                visit(o, node.elseBranch());
                return;
            }
            o.text(" then");
            o.indent(() -> {
                o.newline();
                visit(o, node.thenBranch(), 0);
            });
            o.newline();
            o.text("else");
            if( node.elseBranch() instanceof IfExpression ) {
                o.text(" ");
                visit(o, node.elseBranch());
            }
            else {
                o.indent(() -> {
                    o.newline();
                    visit(o, node.elseBranch());
                });
            }
        });
    }

    protected void visitScoped(Layout out, String keyword, Expression scope, Expression body) {
        out.text(keyword + " ");
        visit(out, scope, 1);
        out.text("; ");
        visit(out, body);
    }

    /**
     * Lay out a binary operand, adding parentheses when its priority
     * and associativity require them.
     */
    public void visitOperand(Layout out, Priority context, boolean isLeft, Expression node) {
        visitParenthesized(out, Priorities.needsParens(context, isLeft, Priorities.of(node)), node, isLeft ? 0 : suffix);
    }

    private void visitParenthesized(Layout out, boolean parens, Expression node, int trailing) {
        if( parens )
            out.text("(");
        visit(out, node, parens ? trailing + 1 : trailing);
        if( parens )
            out.text(")");
    }

    // bindings

    private List<Consumer<Layout>> bindings(List<Binding> bindings) {
        var items = new ArrayList<Consumer<Layout>>(bindings.size());
        for( var binding : bindings )
            items.add(o -> visitBinding(o, binding));
        return items;
    }

    public void visitBinding(Layout out, Binding node) {
        if( node instanceof NamedBinding nb ) {
            visitAttrPath(out, nb.path());
            out.text(" = ");
            visit(out, nb.value(), 1);
            out.text(";");
        }
        else if( node instanceof InheritBinding ib ) {
            out.text("inherit");
            if( ib.hasSource() ) {
                out.text(" (");
                visit(out, ib.source(), 1);
                out.text(")");
            }
            for( var name : ib.names() ) {
                out.text(" ");
                visitKeyName(out, name);
            }
            out.text(";");
        }
        else {
            throw new IllegalStateException("Unknown binding: " + node);
        }
    }

    public void visitAttrPath(Layout out, AttrPath path) {
        var keys = path.keys();
        for( int i = 0; i < keys.size(); i++ ) {
            if( i > 0 )
                out.text(".");
            visitKeyName(out, keys.get(i));
        }
    }

    public void visitKeyName(Layout out, KeyName key) {
        if( key instanceof KeyName.Static sk ) {
            out.text(sk.name());
        }
        else if( key instanceof KeyName.Quoted qk ) {
            strings.visitString(out, qk.string());
        }
        else if( key instanceof KeyName.Interpolated ik ) {
            out.text("${");
            visit(out, ik.expression(), 1);
            out.text("}");
        }
        else {
            throw new IllegalStateException("Unknown key: " + key);
        }
    }

    // parameters

    public void visitParameter(Layout out, Parameter node) {
        if( node instanceof NamedParameter np ) {
            out.text(np.name());
        }
        else if( node instanceof SetParameter sp ) {
            var alias = sp.hasAlias() ? " @ " + sp.alias() : "";
            // the pattern is followed by the alias and the colon
            visitSetParameter(out, sp, alias.length() + 1);
            out.text(alias);
        }
        else {
            throw new IllegalStateException("Unknown parameter: " + node);
        }
    }

    private void visitSetParameter(Layout out, SetParameter node, int trailing) {
        var formals = node.formals();
        if( formals.isEmpty() && !node.variadic() ) {
            out.text("{}");
            return;
        }
        var items = new ArrayList<Consumer<Layout>>();
        for( int i = 0; i < formals.size(); i++ ) {
            var formal = formals.get(i);
            var separator = i + 1 < formals.size() || node.variadic() ? "," : "";
            items.add(o -> {
                o.text(formal.name());
                if( formal.hasDefault() ) {
                    o.text(" ? ");
                    visit(o, formal.defaultValue(), separator.length());
                }
                o.text(separator);
            });
        }
        if( node.variadic() )
            items.add(o -> o.text("..."));

        out.tryOneLine(trailing, (o, oneLine) -> {
            o.text("{");
            sequence(o, oneLine, items);
            o.text("}");
        });
    }

    // layout helpers

    /**
     * Lay out a sequence of items either on the current line, each
     * preceded by a space and the last followed by one, or one item per
     * line at one deeper indent, with line breaks before the first item
     * and after the last.
     */
    protected void sequence(Layout out, boolean oneLine, List<Consumer<Layout>> items) {
        if( oneLine ) {
            for( var item : items ) {
                out.text(" ");
                item.accept(out);
            }
            out.text(" ");
            return;
        }
        out.indent(() -> {
            for( var item : items ) {
                out.newline();
                item.accept(out);
            }
        });
        out.newline();
    }

}
