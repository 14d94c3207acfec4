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
package nixfmt.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Splitter;

/**
 * Factory shortcuts for building expression trees by hand.
 */
public class ASTUtils {

    public static ConstantExpression constX(long value) {
        return ConstantExpression.ofInteger(value);
    }

    public static ConstantExpression constX(boolean value) {
        return ConstantExpression.ofBoolean(value);
    }

    public static ConstantExpression floatX(String text) {
        return new ConstantExpression(ConstantExpression.Kind.FLOAT, text);
    }

    public static ConstantExpression nullX() {
        return ConstantExpression.ofNull();
    }

    public static ConstantExpression uriX(String text) {
        return new ConstantExpression(ConstantExpression.Kind.URI, text);
    }

    public static VariableExpression varX(String name) {
        return new VariableExpression(name);
    }

    public static StringExpression strX(Object... parts) {
        return new StringExpression(StringExpression.Quoting.QUOTED, asParts(parts));
    }

    public static StringExpression indStrX(Object... parts) {
        return new StringExpression(StringExpression.Quoting.INDENTED, asParts(parts));
    }

    /**
     * Strings become text fragments, expressions become interpolations.
     */
    private static List<StringPart> asParts(Object... parts) {
        var result = new ArrayList<StringPart>(parts.length);
        for( var part : parts ) {
            if( part instanceof String s )
                result.add(new StringPart.Text(s));
            else if( part instanceof Expression e )
                result.add(new StringPart.Interpolation(e));
            else
                throw new IllegalArgumentException("Not a string part: " + part);
        }
        return result;
    }

    public static PathExpression pathX(String path) {
        return new PathExpression(path);
    }

    public static EnvPathExpression envPathX(String path) {
        return new EnvPathExpression(path);
    }

    public static ListExpression listX(Expression... elements) {
        return new ListExpression(Arrays.asList(elements));
    }

    public static SetExpression setX(Binding... bindings) {
        return new SetExpression(false, Arrays.asList(bindings));
    }

    public static SetExpression recSetX(Binding... bindings) {
        return new SetExpression(true, Arrays.asList(bindings));
    }

    public static AttrPath pathOf(String dotted) {
        return AttrPath.of(Splitter.on('.').splitToList(dotted).toArray(new String[0]));
    }

    public static NamedBinding bindX(String dotted, Expression value) {
        return new NamedBinding(pathOf(dotted), value);
    }

    public static InheritBinding inheritX(Expression source, String... names) {
        var keys = new ArrayList<KeyName>(names.length);
        for( var name : names )
            keys.add(new KeyName.Static(name));
        return new InheritBinding(source, keys);
    }

    public static UnaryExpression negX(Expression operand) {
        return new UnaryExpression(UnaryOperator.NEGATE, operand);
    }

    public static UnaryExpression notX(Expression operand) {
        return new UnaryExpression(UnaryOperator.NOT, operand);
    }

    public static BinaryExpression binX(Expression left, BinaryOperator op, Expression right) {
        return new BinaryExpression(op, left, right);
    }

    public static SelectExpression selectX(Expression base, String dotted) {
        return new SelectExpression(base, pathOf(dotted));
    }

    public static SelectExpression selectX(Expression base, String dotted, Expression defaultValue) {
        return new SelectExpression(base, pathOf(dotted), defaultValue);
    }

    public static HasAttrExpression hasAttrX(Expression base, String dotted) {
        return new HasAttrExpression(base, pathOf(dotted));
    }

    public static FunctionExpression lambdaX(String name, Expression body) {
        return new FunctionExpression(new NamedParameter(name), body);
    }

    public static FunctionExpression lambdaX(Parameter parameter, Expression body) {
        return new FunctionExpression(parameter, body);
    }

    public static SetParameter.Formal formal(String name) {
        return new SetParameter.Formal(name, null);
    }

    public static SetParameter.Formal formal(String name, Expression defaultValue) {
        return new SetParameter.Formal(name, defaultValue);
    }

    /**
     * Apply a function to each argument in turn, so that
     * {@code applyX(f, a, b)} denotes {@code f a b}.
     */
    public static Expression applyX(Expression function, Expression... arguments) {
        var result = function;
        for( var argument : arguments )
            result = new ApplyExpression(result, argument);
        return result;
    }

    public static LetExpression letX(List<Binding> bindings, Expression body) {
        return new LetExpression(bindings, body);
    }

    public static IfExpression ifX(Expression condition, Expression thenBranch, Expression elseBranch) {
        return new IfExpression(condition, thenBranch, elseBranch);
    }

    public static WithExpression withX(Expression scope, Expression body) {
        return new WithExpression(scope, body);
    }

    public static AssertExpression assertX(Expression condition, Expression body) {
        return new AssertExpression(condition, body);
    }

}
