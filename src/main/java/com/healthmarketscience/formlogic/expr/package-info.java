/*
Copyright (c) 2018 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/


/**
 * Form logic expressions decide, at runtime, whether a field is visible,
 * required or disabled, whether an annex applies, whether a bundle includes
 * one of its artifacts, and compute the values of named logic keys.  This
 * package holds the parsed form of those expressions.
 * <p/>
 * The expression language is small:
 * <ul>
 *   <li><b>Literals:</b> numbers ({@code 18}, {@code 2.5}, {@code 1e3}),
 *       strings in single or double quotes with backslash escapes,
 *       {@code true}, {@code false} and {@code null}.</li>
 *   <li><b>Variables:</b> a bare name references a logic key
 *       ({@code isAdult}), a dotted path references a field value
 *       ({@code fields.age.value}), a composite sub-property
 *       ({@code fields.fee.value.amount}), a logic key property
 *       ({@code total.amount}) or, within a bundle, a value of one of its
 *       inline artifacts ({@code forms.intake.isAdult}).</li>
 *   <li><b>Function calls:</b> a bare name directly followed by {@code (},
 *       e.g. {@code contains(fields.name.value, "x")}.</li>
 *   <li><b>Operators:</b> from lowest to highest precedence, the conditional
 *       {@code c ? a : b}, {@code or}/{@code ||}, {@code and}/{@code &&},
 *       {@code not}/{@code !}, the comparisons {@code == != < <= > >=},
 *       {@code + -}, {@code * / %} and the unary signs.</li>
 * </ul>
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.formlogic.expr.Expr} is the root of the
 *     expression tree, its nested classes are the individual node types.</li>
 * <li>{@link com.healthmarketscience.formlogic.expr.ExprVisitor} walks an
 *     expression tree, e.g. to infer its type.</li>
 * <li>{@link com.healthmarketscience.formlogic.expr.Identifier} is a
 *     variable reference, split into its dotted segments.</li>
 * <li>{@link com.healthmarketscience.formlogic.expr.ParseResult} is the
 *     outcome of parsing, either an expression and the variables it
 *     references or the error message and offset.</li>
 * <li>{@link com.healthmarketscience.formlogic.expr.ParseException} is thrown
 *     for failures which occur during expression parsing.</li>
 * </ul>
 * <p/>
 * Expressions are parsed using
 * {@link com.healthmarketscience.formlogic.LogicValidator#parseExpression}.
 */
package com.healthmarketscience.formlogic.expr;
